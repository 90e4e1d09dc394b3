package com.example.merchant.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops expired payment sessions. Expiry is also enforced at consume time.
 */
@Component
public class PaymentSessionReaper {

    private static final Logger logger = LoggerFactory.getLogger(PaymentSessionReaper.class);

    private final PaymentSessionStore sessionStore;

    public PaymentSessionReaper(PaymentSessionStore sessionStore) {
        this.sessionStore = sessionStore;
    }

    @Scheduled(fixedDelayString = "${merchant.payment.session.reaper-interval:PT1M}")
    public void purgeExpiredSessions() {
        int purged = sessionStore.purgeExpired();
        if (purged > 0) {
            logger.info("Purged {} expired payment session(s), {} open", purged, sessionStore.size());
        }
    }

}
