package com.example.signature;

/**
 * The three header values that carry an agent signature.
 */
public record SignatureHeaders(String signatureAgent, String signatureInput, String signature) {

    public static final String SIGNATURE_AGENT = "Signature-Agent";
    public static final String SIGNATURE_INPUT = "Signature-Input";
    public static final String SIGNATURE = "Signature";

    public boolean isAbsent() {
        return signatureAgent == null && signatureInput == null && signature == null;
    }

}
