package com.example.signature;

/**
 * The {@code alg} parameter is well formed but names an algorithm this codec cannot verify.
 */
public class UnsupportedAlgorithmException extends MalformedSignatureException {

    private final String algorithm;

    public UnsupportedAlgorithmException(String algorithm) {
        super("Unsupported signature algorithm: " + algorithm);
        this.algorithm = algorithm;
    }

    public String getAlgorithm() {
        return algorithm;
    }

}
