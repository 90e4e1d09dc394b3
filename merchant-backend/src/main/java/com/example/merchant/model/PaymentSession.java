package com.example.merchant.model;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A finalized, unpaid cart. Created by finalize, consumed once by fulfill, never changed in between.
 */
public record PaymentSession(
        UUID sessionId,
        String cartSessionId,
        List<CartItem> items,
        ChargeQuote quote,
        Address shippingAddress,
        Address billingAddress,
        CustomerInfo customer,
        String couponCode,
        Instant createdAt,
        Instant expiresAt
) {

    public PaymentSession {
        items = List.copyOf(items);
    }

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

}
