package com.example.agent.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Identity and signing key of this agent, and the merchant it talks to.
 */
@Component
@ConfigurationProperties(prefix = "agent")
public class AgentProperties {

    /**
     * Agent identifier sent in Signature-Agent; must match the merchant's trusted-agent entry.
     */
    private String identifier = "https://directory.example.com";
    private String keyId = "primary";
    private String algorithm = "rsa-pss-sha256";

    /**
     * PEM (PKCS#8 or PKCS#1), JWK, or base64 raw Ed25519 seed.
     */
    private String privateKey;

    private String merchantBaseUrl = "http://localhost:8000";

    /**
     * Distance between created and expires of each signature. The merchant accepts at most 8 minutes.
     */
    private Duration validity = Duration.ofMinutes(8);

    /**
     * Fetch one product with a signed request when the application starts.
     */
    private boolean runOnStartup = false;
    private long startupProductId = 1;

    public String getIdentifier() {
        return identifier;
    }

    public void setIdentifier(String identifier) {
        this.identifier = identifier;
    }

    public String getKeyId() {
        return keyId;
    }

    public void setKeyId(String keyId) {
        this.keyId = keyId;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public String getPrivateKey() {
        return privateKey;
    }

    public void setPrivateKey(String privateKey) {
        this.privateKey = privateKey;
    }

    public String getMerchantBaseUrl() {
        return merchantBaseUrl;
    }

    public void setMerchantBaseUrl(String merchantBaseUrl) {
        this.merchantBaseUrl = merchantBaseUrl;
    }

    public Duration getValidity() {
        return validity;
    }

    public void setValidity(Duration validity) {
        this.validity = validity;
    }

    public boolean isRunOnStartup() {
        return runOnStartup;
    }

    public void setRunOnStartup(boolean runOnStartup) {
        this.runOnStartup = runOnStartup;
    }

    public long getStartupProductId() {
        return startupProductId;
    }

    public void setStartupProductId(long startupProductId) {
        this.startupProductId = startupProductId;
    }

}
