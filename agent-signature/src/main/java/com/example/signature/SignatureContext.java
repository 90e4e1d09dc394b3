package com.example.signature;

import java.util.List;
import java.util.Objects;

/**
 * Everything that goes into one request signature besides the request values themselves.
 * Built fresh per request on the agent side, or decoded from Signature-Input on the merchant side.
 *
 * @param agentIdentifier    the agent's identifier, sent quoted in Signature-Agent
 * @param coveredComponents  ordered component names, e.g. {@code @authority}, {@code @path}
 * @param created            unix seconds
 * @param expires            unix seconds
 * @param tag                intent of the request, e.g. {@code agent-browser-auth} or {@code agent-payer-auth}
 */
public record SignatureContext(
        String agentIdentifier,
        List<String> coveredComponents,
        String nonce,
        long created,
        long expires,
        String keyId,
        SignatureAlgorithm algorithm,
        String tag
) {

    public static final String AUTHORITY = "@authority";
    public static final String PATH = "@path";

    public static final String TAG_BROWSER_AUTH = "agent-browser-auth";
    public static final String TAG_PAYER_AUTH = "agent-payer-auth";

    public SignatureContext {
        Objects.requireNonNull(agentIdentifier, "agentIdentifier");
        Objects.requireNonNull(nonce, "nonce");
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(algorithm, "algorithm");
        Objects.requireNonNull(tag, "tag");
        coveredComponents = List.copyOf(coveredComponents);
    }

    /**
     * Context covering only {@code @authority} and {@code @path}, as the reference agents sign.
     */
    public static SignatureContext forAuthorityAndPath(String agentIdentifier, String nonce, long created, long expires,
                                                       String keyId, SignatureAlgorithm algorithm, String tag) {
        return new SignatureContext(agentIdentifier, List.of(AUTHORITY, PATH), nonce, created, expires,
                keyId, algorithm, tag);
    }

    public long validitySeconds() {
        return expires - created;
    }

}
