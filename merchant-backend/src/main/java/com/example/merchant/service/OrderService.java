package com.example.merchant.service;

import com.example.merchant.model.Cart;
import com.example.merchant.model.CartItem;
import com.example.merchant.model.CardPaymentResult;
import com.example.merchant.model.ChargeQuote;
import com.example.merchant.model.Order;
import com.example.merchant.model.OrderItem;
import com.example.merchant.model.PaymentSession;
import com.example.merchant.model.PlacedOrder;
import com.example.merchant.model.SettlementReceipt;
import com.example.merchant.repository.CartRepository;
import com.example.merchant.repository.OrderRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Materializes paid carts as orders. Each order is written in one transaction together with its
 * items and the removal of the paid lines from the cart.
 */
@Service
public class OrderService {

    private static final Logger logger = LoggerFactory.getLogger(OrderService.class);

    private static final DateTimeFormatter ORDER_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMddHHmmss").withZone(ZoneOffset.UTC);

    private final OrderRepository orderRepository;
    private final CartRepository cartRepository;
    private final Clock clock;

    public OrderService(OrderRepository orderRepository, CartRepository cartRepository, Clock clock) {
        this.orderRepository = orderRepository;
        this.cartRepository = cartRepository;
        this.clock = clock;
    }

    /**
     * Order for a card payment. Line items and amounts come from the payment session snapshot,
     * not from the cart's current content.
     */
    @Transactional
    public PlacedOrder placeCardOrder(Cart cart, PaymentSession session, CardPaymentResult payment) {
        ChargeQuote quote = session.quote();
        Order order = new Order(
                null,
                newOrderNumber(),
                session.customer().name(),
                session.customer().email(),
                session.customer().phone(),
                session.shippingAddress().toSingleLine(),
                session.billingAddress().toSingleLine(),
                quote.subtotal(),
                quote.shipping(),
                quote.tax(),
                quote.discount(),
                quote.total(),
                Order.STATUS_CONFIRMED,
                Order.METHOD_CREDIT_CARD,
                Order.PAYMENT_PROCESSED,
                payment.cardBrand(),
                payment.lastFour(),
                payment.transactionId(),
                payment.providerReference(),
                null,
                null,
                null,
                null,
                clock.instant()
        );
        return persist(order, session.items(), cart);
    }

    @Transactional
    public PlacedOrder placeDelegatedOrder(Cart cart, ChargeQuote quote, String agentId, SettlementReceipt receipt) {
        Order order = new Order(
                null,
                newOrderNumber(),
                "Agent " + agentId,
                "agent_" + agentId + "@system.local",
                null,
                null,
                null,
                quote.subtotal(),
                quote.shipping(),
                quote.tax(),
                quote.discount(),
                quote.total(),
                Order.STATUS_CONFIRMED,
                Order.METHOD_X402_DELEGATION,
                Order.PAYMENT_PROCESSED,
                null,
                null,
                receipt.transactionId(),
                null,
                receipt.receiptId(),
                receipt.paymentRailUsed(),
                receipt.processingFee(),
                receipt.netAmount(),
                clock.instant()
        );
        PlacedOrder placed = persist(order, cart.items(), cart);
        cartRepository.clearSettlement(cart.id());
        return placed;
    }

    public Optional<PlacedOrder> findByOrderNumber(String orderNumber) {
        return orderRepository.findByOrderNumber(orderNumber)
                .map(order -> new PlacedOrder(order, orderRepository.findItems(order.id())));
    }

    public String newTrackingNumber() {
        return "TRK" + randomHex(10);
    }

    private PlacedOrder persist(Order order, List<CartItem> lines, Cart cart) {
        long orderId = orderRepository.save(order);
        List<OrderItem> items = lines.stream()
                .map(line -> new OrderItem(line.productId(), line.productName(), line.quantity(), line.unitPrice()))
                .toList();
        items.forEach(item -> orderRepository.saveItem(orderId, item));
        int cleared = cartRepository.removeItems(cart.id(), lines);

        logger.info("Placed order {} ({} {}) for cart {}, removed {} cart lines",
                order.orderNumber(), order.totalAmount(), order.paymentMethod(), cart.sessionId(), cleared);
        return new PlacedOrder(withId(order, orderId), items);
    }

    private String newOrderNumber() {
        Instant now = clock.instant();
        return "ORD-" + ORDER_TIMESTAMP.format(now) + "-" + randomHex(8);
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }

    private static Order withId(Order o, long id) {
        return new Order(id, o.orderNumber(), o.customerName(), o.customerEmail(), o.phone(),
                o.shippingAddress(), o.billingAddress(), o.subtotal(), o.shippingCost(), o.taxAmount(),
                o.discountAmount(), o.totalAmount(), o.status(), o.paymentMethod(), o.paymentStatus(),
                o.cardBrand(), o.cardLastFour(), o.transactionId(), o.providerReference(), o.receiptId(),
                o.paymentRail(), o.processingFee(), o.netAmount(), o.createdAt());
    }

}
