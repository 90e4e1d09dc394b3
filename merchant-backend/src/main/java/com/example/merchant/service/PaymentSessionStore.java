package com.example.merchant.service;

import com.example.merchant.model.Address;
import com.example.merchant.model.CartItem;
import com.example.merchant.model.ChargeQuote;
import com.example.merchant.model.CustomerInfo;
import com.example.merchant.model.PaymentSession;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Finalized-but-unpaid carts, keyed by an opaque payment session id.
 */
public interface PaymentSessionStore {

    PaymentSession create(String cartSessionId, List<CartItem> items, ChargeQuote quote,
                          Address shippingAddress, Address billingAddress, CustomerInfo customer, String couponCode);

    /**
     * Remove and return the session. Among concurrent callers for the same id at most one gets it;
     * an expired session is removed and reported as absent.
     */
    Optional<PaymentSession> consume(UUID sessionId);

    /**
     * Drop expired sessions and return how many were dropped.
     */
    int purgeExpired();

    int size();

}
