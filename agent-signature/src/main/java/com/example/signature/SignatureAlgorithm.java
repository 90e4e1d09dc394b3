package com.example.signature;

import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.Signature;
import java.security.interfaces.RSAKey;
import java.security.spec.MGF1ParameterSpec;
import java.security.spec.PSSParameterSpec;
import java.util.Arrays;
import java.util.Optional;

/**
 * Signature algorithms an agent may declare in the {@code alg} parameter of Signature-Input.
 * Each constant carries its own sign/verify implementation, so there is no fallback for
 * unknown names: {@link #fromHeaderValue(String)} returns empty instead.
 */
public enum SignatureAlgorithm {

    /**
     * RSASSA-PSS with SHA-256, MGF1(SHA-256) and the maximum salt length for the key size.
     */
    RSA_PSS_SHA256("rsa-pss-sha256", "RSA") {
        @Override
        public byte[] sign(PrivateKey privateKey, byte[] data) throws GeneralSecurityException {
            Signature signer = Signature.getInstance("RSASSA-PSS");
            signer.setParameter(pssParameters(modulusBits(privateKey)));
            signer.initSign(privateKey);
            signer.update(data);
            return signer.sign();
        }

        @Override
        public boolean verify(PublicKey publicKey, byte[] data, byte[] signature) throws GeneralSecurityException {
            Signature verifier = Signature.getInstance("RSASSA-PSS");
            verifier.setParameter(pssParameters(modulusBits(publicKey)));
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(signature);
        }
    },

    /**
     * Pure Ed25519 over the raw signature base bytes.
     */
    ED25519("ed25519", "Ed25519") {
        @Override
        public byte[] sign(PrivateKey privateKey, byte[] data) throws GeneralSecurityException {
            Signature signer = Signature.getInstance("Ed25519");
            signer.initSign(privateKey);
            signer.update(data);
            return signer.sign();
        }

        @Override
        public boolean verify(PublicKey publicKey, byte[] data, byte[] signature) throws GeneralSecurityException {
            Signature verifier = Signature.getInstance("Ed25519");
            verifier.initVerify(publicKey);
            verifier.update(data);
            return verifier.verify(signature);
        }
    };

    private static final int SHA256_LENGTH = 32;

    private final String headerValue;
    private final String keyAlgorithm;

    SignatureAlgorithm(String headerValue, String keyAlgorithm) {
        this.headerValue = headerValue;
        this.keyAlgorithm = keyAlgorithm;
    }

    public abstract byte[] sign(PrivateKey privateKey, byte[] data) throws GeneralSecurityException;

    public abstract boolean verify(PublicKey publicKey, byte[] data, byte[] signature) throws GeneralSecurityException;

    /**
     * The value used in the {@code alg} signature parameter.
     */
    public String headerValue() {
        return headerValue;
    }

    /**
     * The JCA key algorithm name ({@code KeyFactory}) for keys of this algorithm.
     */
    public String keyAlgorithm() {
        return keyAlgorithm;
    }

    public static Optional<SignatureAlgorithm> fromHeaderValue(String value) {
        return Arrays.stream(values())
                .filter(algorithm -> algorithm.headerValue.equals(value))
                .findFirst();
    }

    private static int modulusBits(Object key) throws GeneralSecurityException {
        if (key instanceof RSAKey rsaKey) {
            return rsaKey.getModulus().bitLength();
        }
        throw new GeneralSecurityException("RSA-PSS requires an RSA key");
    }

    // emLen - hLen - 2, the largest salt EMSA-PSS allows for this modulus
    private static PSSParameterSpec pssParameters(int modulusBits) {
        int emLen = (modulusBits - 1 + 7) / 8;
        int saltLength = emLen - SHA256_LENGTH - 2;
        return new PSSParameterSpec("SHA-256", "MGF1", MGF1ParameterSpec.SHA256, saltLength, 1);
    }

}
