package com.example.merchant.security;

import com.example.merchant.config.AgentTrustProperties;
import com.example.signature.DecodedSignature;
import com.example.signature.MalformedSignatureException;
import com.example.signature.MissingComponentException;
import com.example.signature.RequestComponents;
import com.example.signature.SignatureCodec;
import com.example.signature.SignatureContext;
import com.example.signature.SignatureHeaders;
import com.example.signature.UnsupportedAlgorithmException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.GeneralSecurityException;
import java.security.InvalidKeyException;
import java.security.SignatureException;
import java.time.Clock;
import java.util.Set;

/**
 * Decides whether a signed request comes from a trusted agent.
 * <p>
 * Checks run in a fixed order and the first failure is reported: header grammar, known agent,
 * time window, tag, covered components, algorithm, and finally the signature itself.
 * Verification is stateless. A nonce is not remembered, so a captured request can be replayed
 * until it expires.
 */
@Component
public class SignatureVerifier {

    private static final Logger logger = LoggerFactory.getLogger(SignatureVerifier.class);

    private final TrustedAgentKeyStore keyStore;
    private final AgentTrustProperties properties;
    private final Clock clock;

    public SignatureVerifier(TrustedAgentKeyStore keyStore, AgentTrustProperties properties, Clock clock) {
        this.keyStore = keyStore;
        this.properties = properties;
        this.clock = clock;
    }

    public VerificationResult verify(String signatureAgent, String signatureInput, String signature,
                                     RequestComponents request) {
        return verify(new SignatureHeaders(signatureAgent, signatureInput, signature), request, Set.of());
    }

    /**
     * @param expectedTags tags acceptable for this request; empty accepts any tag
     */
    public VerificationResult verify(SignatureHeaders headers, RequestComponents request, Set<String> expectedTags) {
        DecodedSignature decoded;
        try {
            decoded = SignatureCodec.decode(headers);
        } catch (UnsupportedAlgorithmException e) {
            logger.debug("Rejected signature: {}", e.getMessage());
            return VerificationResult.untrusted(VerificationResult.UNSUPPORTED_ALGORITHM);
        } catch (MalformedSignatureException e) {
            logger.debug("Rejected signature: {}", e.getMessage());
            return VerificationResult.untrusted(VerificationResult.INVALID_FORMAT);
        }
        SignatureContext context = decoded.context();

        TrustedAgentKey key = keyStore.lookup(context.agentIdentifier()).orElse(null);
        if (key == null) {
            logger.info("Signature from unknown agent {}", context.agentIdentifier());
            return VerificationResult.untrusted(VerificationResult.UNKNOWN_AGENT);
        }

        long now = clock.instant().getEpochSecond();
        if (now < context.created()) {
            return VerificationResult.untrusted(VerificationResult.NOT_YET_VALID);
        }
        if (now > context.expires()) {
            return VerificationResult.untrusted(VerificationResult.EXPIRED);
        }
        if (context.expires() < context.created() || context.validitySeconds() > properties.getMaxValiditySeconds()) {
            return VerificationResult.untrusted(VerificationResult.WINDOW_TOO_LONG);
        }

        if (!expectedTags.isEmpty() && !expectedTags.contains(context.tag())) {
            logger.info("Agent {} sent tag '{}', expected one of {}", context.agentIdentifier(), context.tag(), expectedTags);
            return VerificationResult.untrusted(VerificationResult.UNEXPECTED_TAG);
        }

        byte[] base;
        try {
            base = SignatureCodec.signatureBase(context, request);
        } catch (MissingComponentException e) {
            return VerificationResult.untrusted(VerificationResult.MISSING_COMPONENT);
        } catch (IllegalArgumentException e) {
            logger.debug("Rejected signature: {}", e.getMessage());
            return VerificationResult.untrusted(VerificationResult.INVALID_FORMAT);
        }

        if (context.algorithm() != key.algorithm()) {
            logger.warn("⚠️Agent {} declared {} but is registered with {}",
                    context.agentIdentifier(), context.algorithm().headerValue(), key.algorithm().headerValue());
            return VerificationResult.untrusted(VerificationResult.ALGORITHM_MISMATCH);
        }

        boolean valid;
        try {
            valid = context.algorithm().verify(key.publicKey(), base, decoded.signature());
        } catch (SignatureException | InvalidKeyException e) {
            logger.debug("Signature check raised {}", e.toString());
            valid = false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Cannot verify " + context.algorithm().headerValue() + " signatures", e);
        }
        if (!valid) {
            logger.warn("⚠️Invalid signature from agent {} for {}{} (keyId={}, nonce={})",
                    context.agentIdentifier(), request.authority(), request.path(), context.keyId(), context.nonce());
            return VerificationResult.untrusted(VerificationResult.INVALID_SIGNATURE);
        }

        logger.info("Verified agent {} ({}) tag={}", key.displayName(), context.agentIdentifier(), context.tag());
        return VerificationResult.trusted(key, context);
    }

}
