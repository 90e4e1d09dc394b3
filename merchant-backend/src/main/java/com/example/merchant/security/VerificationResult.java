package com.example.merchant.security;

import com.example.signature.SignatureContext;

/**
 * Outcome of verifying a signed request. {@code context} and {@code agentName} are set only when trusted.
 */
public record VerificationResult(boolean trusted, String message, String agentName, SignatureContext context) {

    public static final String INVALID_FORMAT = "invalid signature format";
    public static final String UNSUPPORTED_ALGORITHM = "unsupported algorithm";
    public static final String UNKNOWN_AGENT = "unknown agent";
    public static final String NOT_YET_VALID = "not yet valid";
    public static final String EXPIRED = "expired";
    public static final String WINDOW_TOO_LONG = "validity window too long";
    public static final String UNEXPECTED_TAG = "unexpected tag";
    public static final String MISSING_COMPONENT = "missing covered component";
    public static final String ALGORITHM_MISMATCH = "algorithm mismatch";
    public static final String INVALID_SIGNATURE = "invalid signature";
    public static final String MISSING_SIGNATURE = "missing signature";

    public static VerificationResult trusted(TrustedAgentKey key, SignatureContext context) {
        return new VerificationResult(true, "Verified agent: " + key.displayName(), key.displayName(), context);
    }

    public static VerificationResult untrusted(String message) {
        return new VerificationResult(false, message, null, null);
    }

}
