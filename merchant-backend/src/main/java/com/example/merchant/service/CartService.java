package com.example.merchant.service;

import com.example.merchant.exception.CartEmptyException;
import com.example.merchant.exception.CartNotFoundException;
import com.example.merchant.exception.InvalidRequestException;
import com.example.merchant.exception.ProductNotFoundException;
import com.example.merchant.exception.SettlementAlreadyRecordedException;
import com.example.merchant.model.Cart;
import com.example.merchant.model.SettlementReceipt;
import com.example.merchant.repository.CartRepository;
import com.example.merchant.repository.ProductRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
public class CartService {

    private static final Logger logger = LoggerFactory.getLogger(CartService.class);

    private final CartRepository cartRepository;
    private final ProductRepository productRepository;

    public CartService(CartRepository cartRepository, ProductRepository productRepository) {
        this.cartRepository = cartRepository;
        this.productRepository = productRepository;
    }

    public Cart createCart() {
        String sessionId = UUID.randomUUID().toString();
        cartRepository.create(sessionId);
        logger.info("Created cart {}", sessionId);
        return requireCart(sessionId);
    }

    public Cart requireCart(String sessionId) {
        return cartRepository.findBySessionId(sessionId)
                .orElseThrow(() -> new CartNotFoundException("Cart not found: " + sessionId));
    }

    /**
     * The cart about to be paid for: it must exist and hold at least one item.
     */
    public Cart requireCheckoutCart(String sessionId) {
        Cart cart = requireCart(sessionId);
        if (cart.isEmpty()) {
            throw new CartEmptyException("Cart is empty");
        }
        return cart;
    }

    /**
     * Remember that the cart has been paid through the facilitator. Committed on its own, before
     * the order is written, so a failed order write cannot lead to a second settlement.
     */
    @Transactional
    public void recordSettlement(Cart cart, SettlementReceipt receipt) {
        cartRepository.markSettled(cart.id(), receipt.receiptId(), receipt.transactionId());
    }

    /**
     * Refuses a cart that already carries a settlement without an order.
     */
    public void requireUnsettled(Cart cart) {
        cartRepository.findSettledReceiptId(cart.id()).ifPresent(receiptId -> {
            throw new SettlementAlreadyRecordedException(cart.sessionId(), receiptId);
        });
    }

    /**
     * Add a product to the cart, creating the cart under the given session id if needed.
     */
    @Transactional
    public Cart addItem(String sessionId, Long productId, Integer quantity) {
        if (productId == null) {
            throw new InvalidRequestException("product_id is required");
        }
        if (quantity == null || quantity <= 0) {
            throw new InvalidRequestException("quantity must be positive");
        }
        productRepository.findById(productId)
                .orElseThrow(() -> new ProductNotFoundException(productId));

        Cart cart = cartRepository.findBySessionId(sessionId).orElseGet(() -> {
            cartRepository.create(sessionId);
            logger.info("Created cart {} on first item", sessionId);
            return requireCart(sessionId);
        });
        cartRepository.addItem(cart.id(), productId, quantity);
        logger.debug("Added {} x product {} to cart {}", quantity, productId, sessionId);
        return requireCart(sessionId);
    }

}
