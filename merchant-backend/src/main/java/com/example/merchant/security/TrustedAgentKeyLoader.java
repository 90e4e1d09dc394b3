package com.example.merchant.security;

import com.example.merchant.config.AgentTrustProperties;
import com.example.signature.AgentKeys;
import com.example.signature.SignatureAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the configured agent entries into {@link TrustedAgentKey}s. A bad entry fails the load as a whole.
 */
@Component
public class TrustedAgentKeyLoader {

    private static final Logger logger = LoggerFactory.getLogger(TrustedAgentKeyLoader.class);

    public List<TrustedAgentKey> load(List<AgentTrustProperties.Agent> agents) {
        List<TrustedAgentKey> keys = new ArrayList<>();
        for (AgentTrustProperties.Agent agent : agents) {
            if (agent.getIdentifier() == null || agent.getIdentifier().isBlank()) {
                throw new IllegalStateException("Trusted agent entry without identifier");
            }
            SignatureAlgorithm algorithm = SignatureAlgorithm.fromHeaderValue(agent.getAlgorithm())
                    .orElseThrow(() -> new IllegalStateException("Unsupported algorithm '" + agent.getAlgorithm()
                            + "' for agent " + agent.getIdentifier()));
            PublicKey publicKey;
            try {
                publicKey = AgentKeys.publicKey(agent.getPublicKey(), algorithm);
            } catch (GeneralSecurityException e) {
                throw new IllegalStateException("Invalid public key for agent " + agent.getIdentifier(), e);
            }
            keys.add(new TrustedAgentKey(agent.getIdentifier(), agent.getName(), algorithm, publicKey));
            logger.info("Trusted agent: {} ({}, {})", agent.getIdentifier(), agent.getName(), algorithm.headerValue());
        }
        return keys;
    }

}
