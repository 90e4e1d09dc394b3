package com.example.merchant.service;

import com.example.merchant.exception.PaymentDeclinedException;
import com.example.merchant.model.CardDetails;
import com.example.merchant.model.CardPaymentResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Set;
import java.util.UUID;

/**
 * Stand-in card processor. Approves every card except the well-known decline test numbers.
 */
@Component
public class MockCardPaymentProcessor implements CardPaymentProcessor {

    private static final Logger logger = LoggerFactory.getLogger(MockCardPaymentProcessor.class);

    static final Set<String> DECLINED_CARDS = Set.of("4000000000000002", "4000000000009995");

    @Override
    public CardPaymentResult processCard(CardDetails card, BigDecimal amount, String currency) {
        String brand = CardValidator.detectBrand(card.number());
        if (DECLINED_CARDS.contains(card.number())) {
            logger.info("Declined {} card ending {} for {} {}", brand, card.lastFour(), amount, currency);
            throw new PaymentDeclinedException("Card declined by issuer");
        }
        CardPaymentResult result = new CardPaymentResult(
                "txn_" + randomHex(12),
                "ref_" + randomHex(8),
                brand,
                card.lastFour()
        );
        logger.info("Charged {} {} to {} card ending {}: {}", amount, currency, brand, card.lastFour(), result.transactionId());
        return result;
    }

    private static String randomHex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length);
    }

}
