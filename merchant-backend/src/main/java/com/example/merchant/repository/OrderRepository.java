package com.example.merchant.repository;

import com.example.merchant.model.Order;
import com.example.merchant.model.OrderItem;
import org.springframework.jdbc.core.simple.JdbcClient;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class OrderRepository {

    private final JdbcClient jdbcClient;

    public OrderRepository(JdbcClient jdbcClient) {
        this.jdbcClient = jdbcClient;
    }

    /**
     * Insert the order (its id is ignored) and return the generated id.
     */
    public long save(Order order) {
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbcClient.sql("""
            INSERT INTO orders
            (order_number, customer_name, customer_email, phone, shipping_address, billing_address,
             subtotal, shipping_cost, tax_amount, discount_amount, total_amount,
             status, payment_method, payment_status, card_brand, card_last_four,
             transaction_id, provider_reference, receipt_id, payment_rail, processing_fee, net_amount, created_at)
            VALUES (:orderNumber, :customerName, :customerEmail, :phone, :shippingAddress, :billingAddress,
                    :subtotal, :shippingCost, :taxAmount, :discountAmount, :totalAmount,
                    :status, :paymentMethod, :paymentStatus, :cardBrand, :cardLastFour,
                    :transactionId, :providerReference, :receiptId, :paymentRail, :processingFee, :netAmount, :createdAt)
            """)
            .param("orderNumber", order.orderNumber())
            .param("customerName", order.customerName())
            .param("customerEmail", order.customerEmail())
            .param("phone", order.phone())
            .param("shippingAddress", order.shippingAddress())
            .param("billingAddress", order.billingAddress())
            .param("subtotal", order.subtotal())
            .param("shippingCost", order.shippingCost())
            .param("taxAmount", order.taxAmount())
            .param("discountAmount", order.discountAmount())
            .param("totalAmount", order.totalAmount())
            .param("status", order.status())
            .param("paymentMethod", order.paymentMethod())
            .param("paymentStatus", order.paymentStatus())
            .param("cardBrand", order.cardBrand())
            .param("cardLastFour", order.cardLastFour())
            .param("transactionId", order.transactionId())
            .param("providerReference", order.providerReference())
            .param("receiptId", order.receiptId())
            .param("paymentRail", order.paymentRail())
            .param("processingFee", order.processingFee())
            .param("netAmount", order.netAmount())
            .param("createdAt", order.createdAt())
            .update(keyHolder, "id");
        return keyHolder.getKeyAs(Long.class);
    }

    public void saveItem(long orderId, OrderItem item) {
        jdbcClient.sql("""
            INSERT INTO order_items (order_id, product_id, product_name, quantity, price)
            VALUES (:orderId, :productId, :productName, :quantity, :price)
            """)
            .param("orderId", orderId)
            .param("productId", item.productId())
            .param("productName", item.productName())
            .param("quantity", item.quantity())
            .param("price", item.price())
            .update();
    }

    public Optional<Order> findByOrderNumber(String orderNumber) {
        return jdbcClient.sql("SELECT * FROM orders WHERE order_number = :orderNumber")
            .param("orderNumber", orderNumber)
            .query(Order.class)
            .optional();
    }

    public List<OrderItem> findItems(long orderId) {
        return jdbcClient.sql("""
            SELECT product_id, product_name, quantity, price
            FROM order_items WHERE order_id = :orderId ORDER BY id
            """)
            .param("orderId", orderId)
            .query(OrderItem.class)
            .list();
    }

    public long count() {
        return jdbcClient.sql("SELECT COUNT(*) FROM orders")
            .query(Long.class)
            .single();
    }
}
