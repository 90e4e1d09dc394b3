package com.example.signature;

/**
 * Result of decoding the signature headers: the parameters the agent declared and the raw signature bytes.
 */
public record DecodedSignature(SignatureContext context, byte[] signature) {
}
