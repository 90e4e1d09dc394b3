package com.example.merchant.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for agent signature authentication.
 * Lists the trusted agents and their public keys, and which request paths demand a signature.
 */
@Component
@ConfigurationProperties(prefix = "merchant.agent-trust")
public class AgentTrustProperties {

    /**
     * Longest accepted distance between created and expires, in seconds (default: 8 minutes).
     */
    private long maxValiditySeconds = 480;

    /**
     * Ant-style path patterns that reject requests without signature headers.
     */
    private List<String> requiredPaths = new ArrayList<>(List.of("/api/cart/*/x402/checkout"));

    /**
     * Ant-style path patterns whose signatures must carry the payer tag. Other paths expect the browsing tag.
     */
    private List<String> payerPaths = new ArrayList<>(List.of("/api/cart/*/x402/checkout"));

    private List<Agent> agents = new ArrayList<>();

    public static class Agent {
        private String identifier;
        private String name;
        private String algorithm = "rsa-pss-sha256";
        private String publicKey;

        public String getIdentifier() {
            return identifier;
        }

        public void setIdentifier(String identifier) {
            this.identifier = identifier;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getAlgorithm() {
            return algorithm;
        }

        public void setAlgorithm(String algorithm) {
            this.algorithm = algorithm;
        }

        public String getPublicKey() {
            return publicKey;
        }

        public void setPublicKey(String publicKey) {
            this.publicKey = publicKey;
        }
    }

    public long getMaxValiditySeconds() {
        return maxValiditySeconds;
    }

    public void setMaxValiditySeconds(long maxValiditySeconds) {
        this.maxValiditySeconds = maxValiditySeconds;
    }

    public List<String> getRequiredPaths() {
        return requiredPaths;
    }

    public void setRequiredPaths(List<String> requiredPaths) {
        this.requiredPaths = requiredPaths;
    }

    public List<String> getPayerPaths() {
        return payerPaths;
    }

    public void setPayerPaths(List<String> payerPaths) {
        this.payerPaths = payerPaths;
    }

    public List<Agent> getAgents() {
        return agents;
    }

    public void setAgents(List<Agent> agents) {
        this.agents = agents;
    }

}
