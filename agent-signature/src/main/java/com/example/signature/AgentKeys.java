package com.example.signature;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.jwk.Curve;
import com.nimbusds.jose.jwk.JWK;
import com.nimbusds.jose.jwk.OctetKeyPair;
import com.nimbusds.jose.jwk.RSAKey;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.util.encoders.Hex;

import java.io.IOException;
import java.io.StringReader;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.interfaces.EdECKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.text.ParseException;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * Loads agent key material from configuration text.
 * <p>
 * Accepted forms:
 * <ul>
 *   <li>PEM: {@code PUBLIC KEY}, {@code PRIVATE KEY} (PKCS#8) or {@code RSA PRIVATE KEY} (PKCS#1)</li>
 *   <li>a JWK JSON object, {@code kty=RSA} or {@code kty=OKP} with {@code crv=Ed25519}</li>
 *   <li>base64 DER (SubjectPublicKeyInfo / PKCS#8)</li>
 *   <li>Ed25519 only: the raw 32-byte public key or private seed in base64</li>
 * </ul>
 * The loaded key must be of the type the algorithm expects.
 */
public final class AgentKeys {

    // DER prefixes that wrap a raw 32-byte Ed25519 key into SubjectPublicKeyInfo / PKCS#8
    private static final byte[] ED25519_SPKI_PREFIX = Hex.decode("302a300506032b6570032100");
    private static final byte[] ED25519_PKCS8_PREFIX = Hex.decode("302e020100300506032b657004220420");
    private static final int ED25519_KEY_LENGTH = 32;
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private AgentKeys() {
    }

    public static PublicKey publicKey(String material, SignatureAlgorithm algorithm) throws GeneralSecurityException {
        String text = requireText(material);
        byte[] der;
        if (text.startsWith("-----BEGIN")) {
            der = readPem(text, true);
        } else if (text.startsWith("{")) {
            return requireType(publicKeyFromJwk(text, algorithm), algorithm);
        } else {
            der = decodeBase64(text);
            if (algorithm == SignatureAlgorithm.ED25519 && der.length == ED25519_KEY_LENGTH) {
                der = concat(ED25519_SPKI_PREFIX, der);
            }
        }
        KeyFactory keyFactory = KeyFactory.getInstance(algorithm.keyAlgorithm());
        return requireType(keyFactory.generatePublic(new X509EncodedKeySpec(der)), algorithm);
    }

    public static PrivateKey privateKey(String material, SignatureAlgorithm algorithm) throws GeneralSecurityException {
        String text = requireText(material);
        byte[] der;
        if (text.startsWith("-----BEGIN")) {
            der = readPem(text, false);
        } else if (text.startsWith("{")) {
            return requireType(privateKeyFromJwk(text, algorithm), algorithm);
        } else {
            der = decodeBase64(text);
            if (algorithm == SignatureAlgorithm.ED25519 && der.length == ED25519_KEY_LENGTH) {
                der = concat(ED25519_PKCS8_PREFIX, der);
            }
        }
        KeyFactory keyFactory = KeyFactory.getInstance(algorithm.keyAlgorithm());
        return requireType(keyFactory.generatePrivate(new PKCS8EncodedKeySpec(der)), algorithm);
    }

    private static byte[] readPem(String text, boolean publicKey) throws GeneralSecurityException {
        Object parsed;
        try (PEMParser parser = new PEMParser(new StringReader(text))) {
            parsed = parser.readObject();
        } catch (IOException e) {
            throw new InvalidKeySpecException("Unreadable PEM key", e);
        }
        try {
            if (publicKey) {
                if (parsed instanceof SubjectPublicKeyInfo info) {
                    return info.getEncoded();
                }
                if (parsed instanceof PEMKeyPair pair) {
                    return pair.getPublicKeyInfo().getEncoded();
                }
            } else {
                if (parsed instanceof PrivateKeyInfo info) {
                    return info.getEncoded();
                }
                if (parsed instanceof PEMKeyPair pair) {
                    return pair.getPrivateKeyInfo().getEncoded();
                }
            }
        } catch (IOException e) {
            throw new InvalidKeySpecException("Cannot encode PEM key", e);
        }
        String found = parsed == null ? "nothing" : parsed.getClass().getSimpleName();
        throw new InvalidKeySpecException("Expected a " + (publicKey ? "public" : "private") + " key in PEM, found " + found);
    }

    private static PublicKey publicKeyFromJwk(String json, SignatureAlgorithm algorithm) throws GeneralSecurityException {
        JWK jwk = parseJwk(json);
        try {
            if (algorithm == SignatureAlgorithm.RSA_PSS_SHA256 && jwk instanceof RSAKey rsaKey) {
                return rsaKey.toRSAPublicKey();
            }
            if (algorithm == SignatureAlgorithm.ED25519 && jwk instanceof OctetKeyPair okp
                    && Curve.Ed25519.equals(okp.getCurve())) {
                return KeyFactory.getInstance(algorithm.keyAlgorithm())
                        .generatePublic(new X509EncodedKeySpec(concat(ED25519_SPKI_PREFIX, okp.getDecodedX())));
            }
        } catch (JOSEException e) {
            throw new InvalidKeySpecException("Invalid JWK public key", e);
        }
        throw new InvalidKeySpecException("JWK of type " + jwk.getKeyType() + " does not fit " + algorithm.headerValue());
    }

    private static PrivateKey privateKeyFromJwk(String json, SignatureAlgorithm algorithm) throws GeneralSecurityException {
        JWK jwk = parseJwk(json);
        if (!jwk.isPrivate()) {
            throw new InvalidKeySpecException("JWK has no private part");
        }
        try {
            if (algorithm == SignatureAlgorithm.RSA_PSS_SHA256 && jwk instanceof RSAKey rsaKey) {
                return rsaKey.toRSAPrivateKey();
            }
            if (algorithm == SignatureAlgorithm.ED25519 && jwk instanceof OctetKeyPair okp
                    && Curve.Ed25519.equals(okp.getCurve())) {
                return KeyFactory.getInstance(algorithm.keyAlgorithm())
                        .generatePrivate(new PKCS8EncodedKeySpec(concat(ED25519_PKCS8_PREFIX, okp.getDecodedD())));
            }
        } catch (JOSEException e) {
            throw new InvalidKeySpecException("Invalid JWK private key", e);
        }
        throw new InvalidKeySpecException("JWK of type " + jwk.getKeyType() + " does not fit " + algorithm.headerValue());
    }

    private static JWK parseJwk(String json) throws InvalidKeySpecException {
        try {
            return JWK.parse(json);
        } catch (ParseException e) {
            throw new InvalidKeySpecException("Invalid JWK", e);
        }
    }

    private static <K extends Key> K requireType(K key, SignatureAlgorithm algorithm) throws InvalidKeySpecException {
        boolean matches = switch (algorithm) {
            case RSA_PSS_SHA256 -> key instanceof java.security.interfaces.RSAKey;
            case ED25519 -> key instanceof EdECKey edKey && "Ed25519".equals(edKey.getParams().getName());
        };
        if (!matches) {
            throw new InvalidKeySpecException(key.getAlgorithm() + " key cannot be used with " + algorithm.headerValue());
        }
        return key;
    }

    private static String requireText(String material) throws InvalidKeySpecException {
        if (material == null || material.isBlank()) {
            throw new InvalidKeySpecException("No key material");
        }
        return material.strip();
    }

    private static byte[] decodeBase64(String text) throws InvalidKeySpecException {
        try {
            return Base64.getDecoder().decode(WHITESPACE.matcher(text).replaceAll(""));
        } catch (IllegalArgumentException e) {
            throw new InvalidKeySpecException("Key material is neither PEM, JWK nor base64", e);
        }
    }

    private static byte[] concat(byte[] prefix, byte[] key) {
        byte[] result = new byte[prefix.length + key.length];
        System.arraycopy(prefix, 0, result, 0, prefix.length);
        System.arraycopy(key, 0, result, prefix.length, key.length);
        return result;
    }

}
