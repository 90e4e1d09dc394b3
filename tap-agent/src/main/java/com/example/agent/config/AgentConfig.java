package com.example.agent.config;

import com.example.agent.signer.AgentRequestSigner;
import com.example.signature.AgentKeys;
import com.example.signature.SignatureAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.time.Clock;

@Configuration
public class AgentConfig {

    private static final Logger logger = LoggerFactory.getLogger(AgentConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AgentRequestSigner agentRequestSigner(AgentProperties properties, Clock clock) {
        SignatureAlgorithm algorithm = SignatureAlgorithm.fromHeaderValue(properties.getAlgorithm())
                .orElseThrow(() -> new IllegalStateException("Unsupported agent.algorithm: " + properties.getAlgorithm()));
        if (properties.getPrivateKey() == null || properties.getPrivateKey().isBlank()) {
            throw new IllegalStateException("agent.private-key is not set");
        }
        PrivateKey privateKey;
        try {
            privateKey = AgentKeys.privateKey(properties.getPrivateKey(), algorithm);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("agent.private-key is not a usable " + algorithm.headerValue() + " key", e);
        }
        logger.info("Signing as {} (keyId={}, {})", properties.getIdentifier(), properties.getKeyId(), algorithm.headerValue());
        return new AgentRequestSigner(properties.getIdentifier(), properties.getKeyId(), algorithm, privateKey,
                properties.getValidity(), clock);
    }

}
