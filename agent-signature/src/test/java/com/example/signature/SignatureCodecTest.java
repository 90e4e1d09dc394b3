package com.example.signature;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.SignatureException;
import java.util.Base64;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class SignatureCodecTest {

    private static final String AGENT = "\"https://agent.example.com\"";
    private static final String INPUT = "sig2=(\"@authority\" \"@path\"); created=1735689600; expires=1735690080; "
            + "keyId=\"primary\"; alg=\"ed25519\"; nonce=\"n1\"; tag=\"agent-browser-auth\"";
    private static final String SIGNATURE = "sig2=:AAEC:";

    static KeyPair rsaKeys;
    static KeyPair ed25519Keys;

    @BeforeAll
    static void generateKeys() throws Exception {
        KeyPairGenerator rsa = KeyPairGenerator.getInstance("RSA");
        rsa.initialize(2048);
        rsaKeys = rsa.generateKeyPair();
        ed25519Keys = KeyPairGenerator.getInstance("Ed25519").generateKeyPair();
    }

    private static SignatureContext context(SignatureAlgorithm algorithm) {
        return SignatureContext.forAuthorityAndPath("https://agent.example.com", "nonce-1",
                1735689600L, 1735690080L, "primary", algorithm, SignatureContext.TAG_BROWSER_AUTH);
    }

    @Test
    void signatureBaseIsByteExact() throws Exception {
        String base = SignatureCodec.signatureBaseString(context(SignatureAlgorithm.ED25519),
                RequestComponents.of("merchant.example.com", "/product/1"));

        assertEquals("\"@authority\": merchant.example.com\n"
                + "\"@path\": /product/1\n"
                + "\"@signature-params\": (\"@authority\" \"@path\"); created=1735689600; expires=1735690080; "
                + "keyId=\"primary\"; alg=\"ed25519\"; nonce=\"nonce-1\"; tag=\"agent-browser-auth\"", base);
        assertArrayEquals(base.getBytes(StandardCharsets.UTF_8),
                SignatureCodec.signatureBase(context(SignatureAlgorithm.ED25519),
                        RequestComponents.of("merchant.example.com", "/product/1")));
    }

    @Test
    void encodeProducesTheThreeHeaders() throws Exception {
        SignatureHeaders headers = SignatureCodec.encode(context(SignatureAlgorithm.ED25519),
                RequestComponents.of("merchant.example.com", "/product/1"), ed25519Keys.getPrivate());

        assertEquals(AGENT, headers.signatureAgent());
        assertEquals("sig2=(\"@authority\" \"@path\"); created=1735689600; expires=1735690080; "
                + "keyId=\"primary\"; alg=\"ed25519\"; nonce=\"nonce-1\"; tag=\"agent-browser-auth\"",
                headers.signatureInput());
        assertTrue(headers.signature().startsWith("sig2=:"));
        assertTrue(headers.signature().endsWith(":"));
    }

    @Test
    void rsaPssRoundTrip() throws Exception {
        assertRoundTrip(context(SignatureAlgorithm.RSA_PSS_SHA256), rsaKeys);
    }

    @Test
    void ed25519RoundTrip() throws Exception {
        assertRoundTrip(context(SignatureAlgorithm.ED25519), ed25519Keys);
    }

    @Test
    void customComponentRoundTrip() throws Exception {
        SignatureContext context = new SignatureContext("https://agent.example.com",
                List.of(SignatureContext.AUTHORITY, SignatureContext.PATH, "content-digest"),
                "nonce-2", 1735689600L, 1735690080L, "primary", SignatureAlgorithm.ED25519,
                SignatureContext.TAG_PAYER_AUTH);
        RequestComponents request = RequestComponents.of("merchant.example.com", "/api/cart/abc/x402/checkout")
                .withField("Content-Digest", "sha-256=:X48E9qOokqqrvdts8nOJRJN3OWDUoyWxBf7kbu9DBPE=:");

        SignatureHeaders headers = SignatureCodec.encode(context, request, ed25519Keys.getPrivate());
        DecodedSignature decoded = SignatureCodec.decode(headers);

        assertEquals(context, decoded.context());
        assertTrue(SignatureAlgorithm.ED25519.verify(ed25519Keys.getPublic(),
                SignatureCodec.signatureBase(decoded.context(), request), decoded.signature()));
    }

    @Test
    void singleByteMutationBreaksVerification() throws Exception {
        RequestComponents request = RequestComponents.of("merchant.example.com", "/product/1");
        for (SignatureAlgorithm algorithm : SignatureAlgorithm.values()) {
            KeyPair keys = algorithm == SignatureAlgorithm.ED25519 ? ed25519Keys : rsaKeys;
            SignatureHeaders headers = SignatureCodec.encode(context(algorithm), request, keys.getPrivate());
            DecodedSignature decoded = SignatureCodec.decode(headers);
            byte[] signature = decoded.signature();
            byte[] base = SignatureCodec.signatureBase(decoded.context(), request);

            for (int i = 0; i < signature.length; i += 7) {
                byte[] mutated = signature.clone();
                mutated[i] ^= 0x01;
                assertFalse(verifies(algorithm, keys, base, mutated), algorithm + " byte " + i);
            }
        }
    }

    @Test
    void differentPathDoesNotVerify() throws Exception {
        SignatureHeaders headers = SignatureCodec.encode(context(SignatureAlgorithm.ED25519),
                RequestComponents.of("merchant.example.com", "/product/1"), ed25519Keys.getPrivate());
        DecodedSignature decoded = SignatureCodec.decode(headers);

        byte[] otherBase = SignatureCodec.signatureBase(decoded.context(),
                RequestComponents.of("merchant.example.com", "/product/2"));
        assertFalse(SignatureAlgorithm.ED25519.verify(ed25519Keys.getPublic(), otherBase, decoded.signature()));
    }

    @Test
    void reorderedParametersAreRejectedAsMalformed() throws Exception {
        String reorderedParams = "(\"@authority\" \"@path\"); tag=\"agent-browser-auth\"; nonce=\"nonce-1\"; "
                + "alg=\"ed25519\"; keyId=\"primary\"; expires=1735690080; created=1735689600";
        String base = "\"@authority\": merchant.example.com\n\"@path\": /api/products/1\n"
                + "\"@signature-params\": " + reorderedParams;
        byte[] signature = SignatureAlgorithm.ED25519.sign(ed25519Keys.getPrivate(), base.getBytes(StandardCharsets.UTF_8));
        SignatureHeaders headers = new SignatureHeaders(AGENT, "sig2=" + reorderedParams,
                "sig2=:" + Base64.getEncoder().encodeToString(signature) + ":");

        MalformedSignatureException e = assertThrows(MalformedSignatureException.class, () -> SignatureCodec.decode(headers));
        assertFalse(e instanceof UnsupportedAlgorithmException);
        assertTrue(e.getMessage().contains("out of order"), e.getMessage());
    }

    @Test
    void requestComponentsRejectNullFieldValue() {
        RequestComponents request = RequestComponents.of("merchant.example.com", "/");

        assertThrows(IllegalArgumentException.class, () -> request.withField("x-merchant-id", null));
    }

    @Test
    void decodeReadsAllParameters() throws Exception {
        DecodedSignature decoded = SignatureCodec.decode(new SignatureHeaders(AGENT, INPUT, SIGNATURE));

        SignatureContext context = decoded.context();
        assertEquals("https://agent.example.com", context.agentIdentifier());
        assertEquals(List.of("@authority", "@path"), context.coveredComponents());
        assertEquals(1735689600L, context.created());
        assertEquals(1735690080L, context.expires());
        assertEquals(480L, context.validitySeconds());
        assertEquals("primary", context.keyId());
        assertEquals(SignatureAlgorithm.ED25519, context.algorithm());
        assertEquals("n1", context.nonce());
        assertEquals("agent-browser-auth", context.tag());
        assertArrayEquals(new byte[]{0, 1, 2}, decoded.signature());
    }

    static Stream<Arguments> malformedHeaders() {
        return Stream.of(
                Arguments.of("unquoted agent", "https://agent.example.com", INPUT, SIGNATURE),
                Arguments.of("missing agent", null, INPUT, SIGNATURE),
                Arguments.of("missing input", AGENT, null, SIGNATURE),
                Arguments.of("missing signature", AGENT, INPUT, null),
                Arguments.of("wrong input label", AGENT, INPUT.replace("sig2=", "sig1="), SIGNATURE),
                Arguments.of("wrong signature label", AGENT, INPUT, "sig1=:AAEC:"),
                Arguments.of("quoted created", AGENT, INPUT.replace("created=1735689600", "created=\"1735689600\""), SIGNATURE),
                Arguments.of("non-numeric expires", AGENT, INPUT.replace("expires=1735690080", "expires=soon"), SIGNATURE),
                Arguments.of("oversized created", AGENT, INPUT.replace("created=1735689600", "created=99999999999999999999"), SIGNATURE),
                Arguments.of("unquoted keyId", AGENT, INPUT.replace("keyId=\"primary\"", "keyId=primary"), SIGNATURE),
                Arguments.of("empty nonce", AGENT, INPUT.replace("nonce=\"n1\"", "nonce=\"\""), SIGNATURE),
                Arguments.of("unknown parameter", AGENT, INPUT + "; foo=\"bar\"", SIGNATURE),
                Arguments.of("duplicate parameter", AGENT, INPUT + "; nonce=\"n2\"", SIGNATURE),
                Arguments.of("missing parameter", AGENT, INPUT.replace("; tag=\"agent-browser-auth\"", ""), SIGNATURE),
                Arguments.of("trailing garbage", AGENT, INPUT + ";", SIGNATURE),
                Arguments.of("swapped created and expires", AGENT, INPUT.replace(
                        "created=1735689600; expires=1735690080", "expires=1735690080; created=1735689600"), SIGNATURE),
                Arguments.of("no space after separator", AGENT, INPUT.replace("; keyId=", ";keyId="), SIGNATURE),
                Arguments.of("extra space after separator", AGENT, INPUT.replace("; alg=", ";  alg="), SIGNATURE),
                Arguments.of("no components", AGENT, INPUT.replace("(\"@authority\" \"@path\")", "()"), SIGNATURE),
                Arguments.of("duplicate component", AGENT,
                        INPUT.replace("\"@path\")", "\"@path\" \"@path\")"), SIGNATURE),
                Arguments.of("unknown derived component", AGENT,
                        INPUT.replace("\"@path\")", "\"@path\" \"@method\")"), SIGNATURE),
                Arguments.of("missing @path", AGENT, INPUT.replace(" \"@path\")", ")"), SIGNATURE),
                Arguments.of("missing @authority", AGENT, INPUT.replace("\"@authority\" ", ""), SIGNATURE),
                Arguments.of("invalid custom component", AGENT,
                        INPUT.replace("\"@path\")", "\"@path\" \"X-Custom\")"), SIGNATURE),
                Arguments.of("unquoted component", AGENT, INPUT.replace("\"@authority\"", "@authority"), SIGNATURE),
                Arguments.of("double space between components", AGENT,
                        INPUT.replace("\"@authority\" \"@path\"", "\"@authority\"  \"@path\""), SIGNATURE),
                Arguments.of("signature without colons", AGENT, INPUT, "sig2=AAEC"),
                Arguments.of("signature not base64", AGENT, INPUT, "sig2=:AA*C:"),
                Arguments.of("signature truncated base64", AGENT, INPUT, "sig2=:A:")
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("malformedHeaders")
    void decodeRejectsGrammarViolations(String name, String agent, String input, String signature) {
        MalformedSignatureException e = assertThrows(MalformedSignatureException.class,
                () -> SignatureCodec.decode(new SignatureHeaders(agent, input, signature)));
        assertFalse(e instanceof UnsupportedAlgorithmException, name);
    }

    @Test
    void decodeReportsUnsupportedAlgorithmDistinctly() {
        String input = INPUT.replace("alg=\"ed25519\"", "alg=\"hmac-sha256\"");

        UnsupportedAlgorithmException e = assertThrows(UnsupportedAlgorithmException.class,
                () -> SignatureCodec.decode(new SignatureHeaders(AGENT, input, SIGNATURE)));
        assertEquals("hmac-sha256", e.getAlgorithm());
    }

    @Test
    void missingCustomComponentIsReported() {
        SignatureContext context = new SignatureContext("https://agent.example.com",
                List.of(SignatureContext.AUTHORITY, SignatureContext.PATH, "x-merchant-id"),
                "nonce-3", 1735689600L, 1735690080L, "primary", SignatureAlgorithm.ED25519,
                SignatureContext.TAG_BROWSER_AUTH);

        MissingComponentException e = assertThrows(MissingComponentException.class,
                () -> SignatureCodec.signatureBase(context, RequestComponents.of("merchant.example.com", "/")));
        assertEquals("x-merchant-id", e.getComponent());
    }

    @Test
    void encodeRejectsLineBreaksAndQuotes() {
        assertThrows(IllegalArgumentException.class, () -> SignatureCodec.encode(context(SignatureAlgorithm.ED25519),
                RequestComponents.of("merchant.example.com", "/product/1\r\nX-Injected: 1"), ed25519Keys.getPrivate()));

        SignatureContext quotedNonce = SignatureContext.forAuthorityAndPath("https://agent.example.com", "a\"b",
                1735689600L, 1735690080L, "primary", SignatureAlgorithm.ED25519, SignatureContext.TAG_BROWSER_AUTH);
        assertThrows(IllegalArgumentException.class, () -> SignatureCodec.encode(quotedNonce,
                RequestComponents.of("merchant.example.com", "/"), ed25519Keys.getPrivate()));
    }

    // a rejected signature may surface as false or as SignatureException depending on the provider
    private static boolean verifies(SignatureAlgorithm algorithm, KeyPair keys, byte[] base, byte[] signature) {
        try {
            return algorithm.verify(keys.getPublic(), base, signature);
        } catch (SignatureException e) {
            return false;
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void assertRoundTrip(SignatureContext context, KeyPair keys) throws Exception {
        RequestComponents request = RequestComponents.of("merchant.example.com", "/product/1");

        SignatureHeaders headers = SignatureCodec.encode(context, request, keys.getPrivate());
        DecodedSignature decoded = SignatureCodec.decode(headers);

        assertEquals(context, decoded.context());
        assertArrayEquals(Base64.getDecoder().decode(headers.signature().substring(6, headers.signature().length() - 1)),
                decoded.signature());
        assertTrue(context.algorithm().verify(keys.getPublic(),
                SignatureCodec.signatureBase(decoded.context(), request), decoded.signature()));
    }

}
