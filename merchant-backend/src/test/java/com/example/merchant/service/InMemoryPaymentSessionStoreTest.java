package com.example.merchant.service;

import com.example.merchant.config.PaymentProperties;
import com.example.merchant.model.Address;
import com.example.merchant.model.CartItem;
import com.example.merchant.model.ChargeQuote;
import com.example.merchant.model.CustomerInfo;
import com.example.merchant.model.PaymentSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryPaymentSessionStoreTest {

    private static final Address ADDRESS = new Address("1 Main St", "Springfield", "IL", "62701", "US");
    private static final ChargeQuote QUOTE = new ChargeQuote(new BigDecimal("40.00"), new BigDecimal("9.99"),
            new BigDecimal("3.20"), new BigDecimal("0.00"), new BigDecimal("53.19"), "USD");

    MutableClock clock;
    InMemoryPaymentSessionStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T10:00:00Z"));
        store = new InMemoryPaymentSessionStore(new PaymentProperties(), clock);
    }

    private PaymentSession create() {
        return store.create("cart-1", List.of(new CartItem(10L, "Notebook Set", 2, new BigDecimal("20.00"))), QUOTE,
                ADDRESS, ADDRESS, new CustomerInfo("Jane Doe", "jane@example.com", null), null);
    }

    @Test
    void sessionExpiresAfterConfiguredTtl() {
        PaymentSession session = create();

        assertEquals(Instant.parse("2025-01-01T10:15:00Z"), session.expiresAt());
        assertEquals(1, store.size());
    }

    @Test
    void consumeSucceedsOnlyOnce() {
        PaymentSession session = create();

        assertEquals(session, store.consume(session.sessionId()).orElseThrow());
        assertTrue(store.consume(session.sessionId()).isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void unknownSessionIsAbsent() {
        assertTrue(store.consume(UUID.randomUUID()).isEmpty());
    }

    @Test
    void expiredSessionIsRemovedAndReportedAbsent() {
        PaymentSession session = create();
        clock.advance(Duration.ofMinutes(15));

        assertTrue(store.consume(session.sessionId()).isEmpty());
        assertEquals(0, store.size());
    }

    @Test
    void sessionIsUsableJustBeforeExpiry() {
        PaymentSession session = create();
        clock.advance(Duration.ofMinutes(15).minusSeconds(1));

        assertTrue(store.consume(session.sessionId()).isPresent());
    }

    @Test
    void purgeDropsOnlyExpiredSessions() {
        create();
        clock.advance(Duration.ofMinutes(10));
        PaymentSession fresh = create();
        clock.advance(Duration.ofMinutes(6));

        assertEquals(1, store.purgeExpired());
        assertEquals(1, store.size());
        assertTrue(store.consume(fresh.sessionId()).isPresent());
    }

    @Test
    void concurrentConsumersGetTheSessionExactlyOnce() throws Exception {
        int callers = 16;
        PaymentSession session = create();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<Boolean> consume = () -> {
                    start.await();
                    return store.consume(session.sessionId()).isPresent();
                };
                results.add(executor.submit(consume));
            }
            start.countDown();

            int successes = 0;
            for (Future<Boolean> result : results) {
                if (result.get()) {
                    successes++;
                }
            }
            assertEquals(1, successes);
        } finally {
            executor.shutdownNow();
        }
    }

    static class MutableClock extends Clock {

        private volatile Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }

    }

}
