package com.example.merchant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "merchant.payment")
public class PaymentProperties {

    private String currency = "USD";
    private String provider = "merchant_payment_processor";
    private String referenceCountry = "US";

    private Session session = new Session();
    private Shipping shipping = new Shipping();
    private Tax tax = new Tax();

    public static class Session {
        private Duration ttl = Duration.ofMinutes(15);
        private Duration reaperInterval = Duration.ofMinutes(1);

        public Duration getTtl() {
            return ttl;
        }

        public void setTtl(Duration ttl) {
            this.ttl = ttl;
        }

        public Duration getReaperInterval() {
            return reaperInterval;
        }

        public void setReaperInterval(Duration reaperInterval) {
            this.reaperInterval = reaperInterval;
        }
    }

    public static class Shipping {
        private BigDecimal domestic = new BigDecimal("9.99");
        private BigDecimal freeThreshold = new BigDecimal("50.00");
        private BigDecimal international = new BigDecimal("19.99");
        private BigDecimal delegated = new BigDecimal("15.00");  // flat rate for x402 checkout, no address known

        public BigDecimal getDomestic() {
            return domestic;
        }

        public void setDomestic(BigDecimal domestic) {
            this.domestic = domestic;
        }

        public BigDecimal getFreeThreshold() {
            return freeThreshold;
        }

        public void setFreeThreshold(BigDecimal freeThreshold) {
            this.freeThreshold = freeThreshold;
        }

        public BigDecimal getInternational() {
            return international;
        }

        public void setInternational(BigDecimal international) {
            this.international = international;
        }

        public BigDecimal getDelegated() {
            return delegated;
        }

        public void setDelegated(BigDecimal delegated) {
            this.delegated = delegated;
        }
    }

    public static class Tax {
        private BigDecimal rate = new BigDecimal("0.08");
        private BigDecimal delegatedRate = new BigDecimal("0.0875");

        public BigDecimal getRate() {
            return rate;
        }

        public void setRate(BigDecimal rate) {
            this.rate = rate;
        }

        public BigDecimal getDelegatedRate() {
            return delegatedRate;
        }

        public void setDelegatedRate(BigDecimal delegatedRate) {
            this.delegatedRate = delegatedRate;
        }
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getProvider() {
        return provider;
    }

    public void setProvider(String provider) {
        this.provider = provider;
    }

    public String getReferenceCountry() {
        return referenceCountry;
    }

    public void setReferenceCountry(String referenceCountry) {
        this.referenceCountry = referenceCountry;
    }

    public Session getSession() {
        return session;
    }

    public void setSession(Session session) {
        this.session = session;
    }

    public Shipping getShipping() {
        return shipping;
    }

    public void setShipping(Shipping shipping) {
        this.shipping = shipping;
    }

    public Tax getTax() {
        return tax;
    }

    public void setTax(Tax tax) {
        this.tax = tax;
    }

}
