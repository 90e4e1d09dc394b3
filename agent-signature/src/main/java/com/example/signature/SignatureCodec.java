package com.example.signature;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.PrivateKey;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Encodes and decodes agent request signatures in the RFC 9421 style used between agents and the merchant.
 *
 * <pre>
 * Signature-Agent: "https://agent.example.com"
 * Signature-Input: sig2=("@authority" "@path"); created=1735689600; expires=1735690080; keyId="primary"; alg="ed25519"; nonce="..."; tag="agent-browser-auth"
 * Signature: sig2=:base64:
 * </pre>
 *
 * The signature base is one {@code "<component>": <value>} line per covered component, in the order the
 * component list declares them, followed by the {@code "@signature-params"} line. Lines are joined with
 * {@code \n} and the result is signed as UTF-8. Decoding is strict: any deviation from the grammar above
 * is rejected rather than repaired. Parameters must appear in the order shown, each introduced by
 * {@code "; "}, since the verifier rebuilds the {@code "@signature-params"} line in that form.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc9421">RFC 9421: HTTP Message Signatures</a>
 */
public final class SignatureCodec {

    public static final String LABEL = "sig2";

    static final String SIGNATURE_PARAMS = "@signature-params";

    private static final String CREATED = "created";
    private static final String EXPIRES = "expires";
    private static final String KEY_ID = "keyId";
    private static final String ALG = "alg";
    private static final String NONCE = "nonce";
    private static final String TAG = "tag";

    private static final List<String> PARAMETER_ORDER = List.of(CREATED, EXPIRES, KEY_ID, ALG, NONCE, TAG);
    private static final Set<String> INTEGER_PARAMETERS = Set.of(CREATED, EXPIRES);

    private static final Pattern SIGNATURE_AGENT_PATTERN = Pattern.compile("^\"([^\"\\\\\\s]+)\"$");
    private static final Pattern SIGNATURE_INPUT_PATTERN = Pattern.compile("^([^=]+)=\\(([^()]*)\\)(.*)$");
    private static final Pattern PARAMETER_PATTERN = Pattern.compile("; ([A-Za-z]+)=([0-9]+|\"[^\"\\\\]*\")");
    private static final Pattern COMPONENT_PATTERN = Pattern.compile("^\"(@?[a-z0-9][a-z0-9._-]*)\"$");
    private static final Pattern SIGNATURE_PATTERN = Pattern.compile("^([^=]+)=:([A-Za-z0-9+/]+={0,2}):$");
    private static final Pattern STRING_VALUE_PATTERN = Pattern.compile("^[\\x20-\\x7E&&[^\"\\\\]]+$");

    private SignatureCodec() {
    }

    // ---------------------------------------------------------------- encode (agent side)

    /**
     * Sign a request and produce the three header values.
     *
     * @throws MissingComponentException if the request has no value for a covered component
     * @throws GeneralSecurityException  if the private key cannot sign under the declared algorithm
     */
    public static SignatureHeaders encode(SignatureContext context, RequestComponents request, PrivateKey privateKey)
            throws MissingComponentException, GeneralSecurityException {
        requireEncodable(context);
        byte[] base = signatureBase(context, request);
        byte[] signature = context.algorithm().sign(privateKey, base);
        return new SignatureHeaders(
                quote(context.agentIdentifier()),
                LABEL + "=" + signatureParams(context),
                LABEL + "=:" + Base64.getEncoder().encodeToString(signature) + ":"
        );
    }

    /**
     * The serialized signature parameters, e.g.
     * {@code ("@authority" "@path"); created=1; expires=2; keyId="k"; alg="ed25519"; nonce="n"; tag="t"}.
     */
    public static String signatureParams(SignatureContext context) {
        String components = context.coveredComponents().stream()
                .map(SignatureCodec::quote)
                .collect(Collectors.joining(" ", "(", ")"));
        return components
                + "; " + CREATED + "=" + context.created()
                + "; " + EXPIRES + "=" + context.expires()
                + "; " + KEY_ID + "=" + quote(context.keyId())
                + "; " + ALG + "=" + quote(context.algorithm().headerValue())
                + "; " + NONCE + "=" + quote(context.nonce())
                + "; " + TAG + "=" + quote(context.tag());
    }

    public static String signatureBaseString(SignatureContext context, RequestComponents request)
            throws MissingComponentException {
        List<String> lines = new ArrayList<>();
        for (String component : context.coveredComponents()) {
            String value = request.valueOf(component)
                    .orElseThrow(() -> new MissingComponentException(component));
            if (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
                throw new IllegalArgumentException("Component " + component + " contains a line break");
            }
            lines.add(quote(component) + ": " + value.strip());
        }
        lines.add(quote(SIGNATURE_PARAMS) + ": " + signatureParams(context));
        return String.join("\n", lines);
    }

    public static byte[] signatureBase(SignatureContext context, RequestComponents request)
            throws MissingComponentException {
        return signatureBaseString(context, request).getBytes(StandardCharsets.UTF_8);
    }

    // ---------------------------------------------------------------- decode (merchant side)

    /**
     * Parse the three header values.
     *
     * @throws UnsupportedAlgorithmException if the headers are well formed but {@code alg} is not supported
     * @throws MalformedSignatureException   on any other deviation from the grammar
     */
    public static DecodedSignature decode(SignatureHeaders headers) throws MalformedSignatureException {
        String agentIdentifier = parseSignatureAgent(required(headers.signatureAgent(), SignatureHeaders.SIGNATURE_AGENT));
        String signatureInput = required(headers.signatureInput(), SignatureHeaders.SIGNATURE_INPUT);
        byte[] signature = parseSignature(required(headers.signature(), SignatureHeaders.SIGNATURE));

        Matcher matcher = SIGNATURE_INPUT_PATTERN.matcher(signatureInput);
        if (!matcher.matches()) {
            throw new MalformedSignatureException("Signature-Input does not match label=(components);params");
        }
        requireLabel(matcher.group(1), SignatureHeaders.SIGNATURE_INPUT);
        List<String> components = parseComponents(matcher.group(2));
        Map<String, String> parameters = parseParameters(matcher.group(3));

        long created = parseInteger(parameters.get(CREATED), CREATED);
        long expires = parseInteger(parameters.get(EXPIRES), EXPIRES);
        String algorithmName = parameters.get(ALG);
        SignatureAlgorithm algorithm = SignatureAlgorithm.fromHeaderValue(algorithmName)
                .orElseThrow(() -> new UnsupportedAlgorithmException(algorithmName));

        SignatureContext context = new SignatureContext(
                agentIdentifier,
                components,
                parameters.get(NONCE),
                created,
                expires,
                parameters.get(KEY_ID),
                algorithm,
                parameters.get(TAG)
        );
        return new DecodedSignature(context, signature);
    }

    private static String parseSignatureAgent(String value) throws MalformedSignatureException {
        Matcher matcher = SIGNATURE_AGENT_PATTERN.matcher(value.strip());
        if (!matcher.matches()) {
            throw new MalformedSignatureException("Signature-Agent must be a quoted identifier");
        }
        return matcher.group(1);
    }

    private static byte[] parseSignature(String value) throws MalformedSignatureException {
        Matcher matcher = SIGNATURE_PATTERN.matcher(value.strip());
        if (!matcher.matches()) {
            throw new MalformedSignatureException("Signature must be label=:base64:");
        }
        requireLabel(matcher.group(1), SignatureHeaders.SIGNATURE);
        try {
            return Base64.getDecoder().decode(matcher.group(2));
        } catch (IllegalArgumentException e) {
            throw new MalformedSignatureException("Signature is not valid base64", e);
        }
    }

    private static List<String> parseComponents(String inner) throws MalformedSignatureException {
        if (inner.isEmpty()) {
            throw new MalformedSignatureException("No covered components");
        }
        Set<String> components = new LinkedHashSet<>();
        for (String item : inner.split(" ", -1)) {
            Matcher matcher = COMPONENT_PATTERN.matcher(item);
            if (!matcher.matches()) {
                throw new MalformedSignatureException("Invalid component identifier: " + item);
            }
            String name = matcher.group(1);
            if (name.startsWith("@") && !SignatureContext.AUTHORITY.equals(name) && !SignatureContext.PATH.equals(name)) {
                throw new MalformedSignatureException("Unknown derived component: " + name);
            }
            if (!components.add(name)) {
                throw new MalformedSignatureException("Duplicate component: " + name);
            }
        }
        if (!components.contains(SignatureContext.AUTHORITY) || !components.contains(SignatureContext.PATH)) {
            throw new MalformedSignatureException("Covered components must include @authority and @path");
        }
        return List.copyOf(components);
    }

    private static Map<String, String> parseParameters(String raw) throws MalformedSignatureException {
        Map<String, String> parameters = new HashMap<>();
        Matcher matcher = PARAMETER_PATTERN.matcher(raw);
        int position = 0;
        while (position < raw.length()) {
            matcher.region(position, raw.length());
            if (!matcher.lookingAt()) {
                throw new MalformedSignatureException("Invalid signature parameters near: " + raw.substring(position));
            }
            String name = matcher.group(1);
            String value = matcher.group(2);
            if (!PARAMETER_ORDER.contains(name)) {
                throw new MalformedSignatureException("Unknown signature parameter: " + name);
            }
            boolean quoted = value.startsWith("\"");
            if (INTEGER_PARAMETERS.contains(name) == quoted) {
                throw new MalformedSignatureException("Parameter " + name
                        + (quoted ? " must be an integer" : " must be a quoted string"));
            }
            if (quoted) {
                value = value.substring(1, value.length() - 1);
                if (value.isEmpty()) {
                    throw new MalformedSignatureException("Parameter " + name + " is empty");
                }
            }
            if (parameters.containsKey(name)) {
                throw new MalformedSignatureException("Duplicate signature parameter: " + name);
            }
            if (PARAMETER_ORDER.indexOf(name) != parameters.size()) {
                throw new MalformedSignatureException("Signature parameter " + name + " out of order, expected "
                        + PARAMETER_ORDER.get(parameters.size()));
            }
            parameters.put(name, value);
            position = matcher.end();
        }
        for (String name : PARAMETER_ORDER) {
            if (!parameters.containsKey(name)) {
                throw new MalformedSignatureException("Missing signature parameter: " + name);
            }
        }
        return parameters;
    }

    private static long parseInteger(String value, String name) throws MalformedSignatureException {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new MalformedSignatureException("Parameter " + name + " is out of range", e);
        }
    }

    private static void requireLabel(String label, String header) throws MalformedSignatureException {
        if (!LABEL.equals(label)) {
            throw new MalformedSignatureException(header + " label must be '" + LABEL + "', got '" + label + "'");
        }
    }

    private static String required(String value, String header) throws MalformedSignatureException {
        if (value == null || value.isBlank()) {
            throw new MalformedSignatureException("Missing " + header + " header");
        }
        return value.strip();
    }

    private static void requireEncodable(SignatureContext context) {
        requireStringValue(context.agentIdentifier(), "agentIdentifier");
        requireStringValue(context.keyId(), KEY_ID);
        requireStringValue(context.nonce(), NONCE);
        requireStringValue(context.tag(), TAG);
        if (context.agentIdentifier().chars().anyMatch(Character::isWhitespace)) {
            throw new IllegalArgumentException("agentIdentifier must not contain whitespace");
        }
        for (String component : context.coveredComponents()) {
            if (!COMPONENT_PATTERN.matcher(quote(component)).matches()) {
                throw new IllegalArgumentException("Invalid component identifier: " + component);
            }
        }
    }

    private static void requireStringValue(String value, String name) {
        if (!STRING_VALUE_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(name + " must be non-empty printable ASCII without quotes or backslashes");
        }
    }

    private static String quote(String value) {
        return "\"" + value + "\"";
    }

}
