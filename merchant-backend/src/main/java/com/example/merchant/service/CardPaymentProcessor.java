package com.example.merchant.service;

import com.example.merchant.model.CardDetails;
import com.example.merchant.model.CardPaymentResult;

import java.math.BigDecimal;

/**
 * Charges a card.
 */
public interface CardPaymentProcessor {

    /**
     * @throws com.example.merchant.exception.PaymentDeclinedException if the card is refused
     */
    CardPaymentResult processCard(CardDetails card, BigDecimal amount, String currency);

}
