package com.example.merchant.security;

import com.example.signature.SignatureAlgorithm;

import java.security.PublicKey;
import java.util.Objects;

/**
 * A known agent: its identifier as sent in Signature-Agent, the algorithm it signs with and its public key.
 */
public record TrustedAgentKey(
        String agentIdentifier,
        String displayName,
        SignatureAlgorithm algorithm,
        PublicKey publicKey
) {

    public TrustedAgentKey {
        Objects.requireNonNull(agentIdentifier, "agentIdentifier");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(publicKey, "publicKey");
        if (displayName == null || displayName.isBlank()) {
            displayName = agentIdentifier;
        }
    }

}
