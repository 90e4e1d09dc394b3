package com.example.merchant.repository;

import com.example.merchant.model.Cart;
import com.example.merchant.model.CartItem;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class CartRepository {

    private final JdbcClient jdbcClient;

    public CartRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    public void create(String sessionId) {
        Instant now = Instant.now();
        jdbcClient.sql("""
            INSERT INTO carts (session_id, created_at, updated_at)
            VALUES (:sessionId, :createdAt, :updatedAt)
            """)
            .param("sessionId", sessionId)
            .param("createdAt", now)
            .param("updatedAt", now)
            .update();
    }

    public Optional<Cart> findBySessionId(String sessionId) {
        return jdbcClient.sql("SELECT id FROM carts WHERE session_id = :sessionId")
            .param("sessionId", sessionId)
            .query(Long.class)
            .optional()
            .map(cartId -> new Cart(cartId, sessionId, findItems(cartId)));
    }

    /**
     * Items in insertion order, with the product's current name and price.
     */
    public List<CartItem> findItems(Long cartId) {
        return jdbcClient.sql("""
            SELECT ci.product_id, p.name AS product_name, ci.quantity, p.price AS unit_price
            FROM cart_items ci JOIN products p ON p.id = ci.product_id
            WHERE ci.cart_id = :cartId
            ORDER BY ci.id
            """)
            .param("cartId", cartId)
            .query(CartItem.class)
            .list();
    }

    /**
     * Add to the quantity of an existing line, or create the line.
     */
    public void addItem(Long cartId, Long productId, int quantity) {
        int updated = jdbcClient.sql("""
            UPDATE cart_items SET quantity = quantity + :quantity
            WHERE cart_id = :cartId AND product_id = :productId
            """)
            .param("quantity", quantity)
            .param("cartId", cartId)
            .param("productId", productId)
            .update();

        if (updated == 0) {
            jdbcClient.sql("""
                INSERT INTO cart_items (cart_id, product_id, quantity)
                VALUES (:cartId, :productId, :quantity)
                """)
                .param("cartId", cartId)
                .param("productId", productId)
                .param("quantity", quantity)
                .update();
        }
        touch(cartId);
    }

    /**
     * Take the given quantities out of the cart. Lines that reach zero are deleted; lines and
     * quantities not listed stay.
     */
    public int removeItems(Long cartId, List<CartItem> items) {
        for (CartItem item : items) {
            jdbcClient.sql("""
                UPDATE cart_items SET quantity = quantity - :quantity
                WHERE cart_id = :cartId AND product_id = :productId
                """)
                .param("quantity", item.quantity())
                .param("cartId", cartId)
                .param("productId", item.productId())
                .update();
        }
        int deleted = jdbcClient.sql("DELETE FROM cart_items WHERE cart_id = :cartId AND quantity <= 0")
            .param("cartId", cartId)
            .update();
        touch(cartId);
        return deleted;
    }

    /**
     * Receipt id of a settlement recorded for the cart whose order is not written yet.
     */
    public Optional<String> findSettledReceiptId(Long cartId) {
        return jdbcClient.sql("SELECT settled_receipt_id FROM carts WHERE id = :cartId AND settled_receipt_id IS NOT NULL")
            .param("cartId", cartId)
            .query(String.class)
            .optional();
    }

    public void markSettled(Long cartId, String receiptId, String transactionId) {
        jdbcClient.sql("""
            UPDATE carts SET settled_receipt_id = :receiptId, settled_transaction_id = :transactionId,
                updated_at = :updatedAt
            WHERE id = :cartId
            """)
            .param("receiptId", receiptId)
            .param("transactionId", transactionId)
            .param("updatedAt", Instant.now())
            .param("cartId", cartId)
            .update();
    }

    public void clearSettlement(Long cartId) {
        jdbcClient.sql("UPDATE carts SET settled_receipt_id = NULL, settled_transaction_id = NULL WHERE id = :cartId")
            .param("cartId", cartId)
            .update();
    }

    private void touch(Long cartId) {
        jdbcClient.sql("UPDATE carts SET updated_at = :updatedAt WHERE id = :cartId")
            .param("updatedAt", Instant.now())
            .param("cartId", cartId)
            .update();
    }
}
