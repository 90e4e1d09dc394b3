package com.example.agent.signer;

import com.example.signature.MissingComponentException;
import com.example.signature.RequestComponents;
import com.example.signature.SignatureAlgorithm;
import com.example.signature.SignatureCodec;
import com.example.signature.SignatureContext;
import com.example.signature.SignatureHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;

/**
 * Produces the Signature-Agent, Signature-Input and Signature headers for a request URL.
 * Each signature covers the URL's authority and path (with query), carries a fresh nonce and is
 * valid from now for the configured duration.
 */
public class AgentRequestSigner {

    private static final Logger logger = LoggerFactory.getLogger(AgentRequestSigner.class);

    private final String agentIdentifier;
    private final String keyId;
    private final SignatureAlgorithm algorithm;
    private final PrivateKey privateKey;
    private final Duration validity;
    private final Clock clock;

    public AgentRequestSigner(String agentIdentifier, String keyId, SignatureAlgorithm algorithm, PrivateKey privateKey,
                              Duration validity, Clock clock) {
        this.agentIdentifier = agentIdentifier;
        this.keyId = keyId;
        this.algorithm = algorithm;
        this.privateKey = privateKey;
        this.validity = validity;
        this.clock = clock;
    }

    public SignatureHeaders sign(String url, String tag) {
        RequestComponents request = requestComponents(URI.create(url));
        long created = clock.instant().getEpochSecond();
        SignatureContext context = SignatureContext.forAuthorityAndPath(agentIdentifier, UUID.randomUUID().toString(),
                created, created + validity.toSeconds(), keyId, algorithm, tag);
        try {
            SignatureHeaders headers = SignatureCodec.encode(context, request, privateKey);
            logger.debug("Signed {}{} with tag {} (nonce={})", request.authority(), request.path(), tag, context.nonce());
            return headers;
        } catch (MissingComponentException | GeneralSecurityException e) {
            throw new IllegalStateException("Cannot sign request to " + url, e);
        }
    }

    /**
     * Authority as host[:port] from the URL, path with its query string.
     */
    static RequestComponents requestComponents(URI uri) {
        if (uri.getRawAuthority() == null) {
            throw new IllegalArgumentException("Absolute URL required: " + uri);
        }
        String path = uri.getRawPath() == null || uri.getRawPath().isEmpty() ? "/" : uri.getRawPath();
        if (uri.getRawQuery() != null) {
            path = path + "?" + uri.getRawQuery();
        }
        return RequestComponents.of(uri.getRawAuthority(), path);
    }

}
