package com.example.merchant.model;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A placed order. Card orders carry brand and last four digits, delegated orders carry the
 * settlement receipt fields.
 */
public record Order(
        Long id,
        String orderNumber,
        String customerName,
        String customerEmail,
        String phone,
        String shippingAddress,
        String billingAddress,
        BigDecimal subtotal,
        BigDecimal shippingCost,
        BigDecimal taxAmount,
        BigDecimal discountAmount,
        BigDecimal totalAmount,
        String status,
        String paymentMethod,
        String paymentStatus,
        String cardBrand,
        String cardLastFour,
        String transactionId,
        String providerReference,
        String receiptId,
        String paymentRail,
        BigDecimal processingFee,
        BigDecimal netAmount,
        Instant createdAt
) {
    public static final String STATUS_CONFIRMED = "confirmed";
    public static final String PAYMENT_PROCESSED = "processed";
    public static final String METHOD_CREDIT_CARD = "credit_card";
    public static final String METHOD_X402_DELEGATION = "x402_delegation";
}
