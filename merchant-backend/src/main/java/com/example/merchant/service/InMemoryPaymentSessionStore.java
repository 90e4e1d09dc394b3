package com.example.merchant.service;

import com.example.merchant.config.PaymentProperties;
import com.example.merchant.model.Address;
import com.example.merchant.model.CartItem;
import com.example.merchant.model.ChargeQuote;
import com.example.merchant.model.CustomerInfo;
import com.example.merchant.model.PaymentSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

@Component
public class InMemoryPaymentSessionStore implements PaymentSessionStore {

    private static final Logger logger = LoggerFactory.getLogger(InMemoryPaymentSessionStore.class);

    private final ConcurrentMap<UUID, PaymentSession> sessions = new ConcurrentHashMap<>();

    private final PaymentProperties properties;
    private final Clock clock;

    public InMemoryPaymentSessionStore(PaymentProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public PaymentSession create(String cartSessionId, List<CartItem> items, ChargeQuote quote,
                                 Address shippingAddress, Address billingAddress, CustomerInfo customer,
                                 String couponCode) {
        Instant now = clock.instant();
        PaymentSession session = new PaymentSession(
                UUID.randomUUID(),
                cartSessionId,
                items,
                quote,
                shippingAddress,
                billingAddress,
                customer,
                couponCode,
                now,
                now.plus(properties.getSession().getTtl())
        );
        sessions.put(session.sessionId(), session);
        logger.debug("Created payment session {} for cart {}", session.sessionId(), cartSessionId);
        return session;
    }

    @Override
    public Optional<PaymentSession> consume(UUID sessionId) {
        PaymentSession session = sessions.remove(sessionId);
        if (session == null) {
            return Optional.empty();
        }
        if (session.isExpired(clock.instant())) {
            logger.info("Payment session {} expired at {}", sessionId, session.expiresAt());
            return Optional.empty();
        }
        return Optional.of(session);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.instant();
        int purged = 0;
        for (PaymentSession session : sessions.values()) {
            if (session.isExpired(now) && sessions.remove(session.sessionId(), session)) {
                purged++;
            }
        }
        return purged;
    }

    @Override
    public int size() {
        return sessions.size();
    }

}
