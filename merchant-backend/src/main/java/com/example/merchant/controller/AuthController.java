package com.example.merchant.controller;

import com.example.merchant.model.SignatureVerificationRequest;
import com.example.merchant.security.AgentAuthenticationToken;
import com.example.merchant.security.SignatureVerifier;
import com.example.merchant.security.VerificationResult;
import com.example.signature.RequestComponents;
import com.example.signature.SignatureHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private static final Logger logger = LoggerFactory.getLogger(AuthController.class);

    static final String VERIFIED_BY = "merchant-backend";

    private static final Pattern FIELD_NAME = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._-]*$");

    private final SignatureVerifier signatureVerifier;

    public AuthController(SignatureVerifier signatureVerifier) {
        this.signatureVerifier = signatureVerifier;
    }

    /**
     * Check signature headers captured elsewhere against the request they claim to sign.
     * Any tag is accepted here since the signed operation is not known.
     */
    @PostMapping(value = "/verify-signature",
            consumes = MediaType.APPLICATION_JSON_VALUE,
            produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> verifySignature(@RequestBody SignatureVerificationRequest request) {
        if (isBlank(request.authority()) || isBlank(request.path())) {
            return ErrorResponses.of(HttpStatus.BAD_REQUEST, "invalid_request", "authority and path are required");
        }

        RequestComponents components = RequestComponents.of(request.authority(), request.path());
        if (request.components() != null) {
            for (Map.Entry<String, String> component : request.components().entrySet()) {
                if (!FIELD_NAME.matcher(component.getKey()).matches() || component.getValue() == null) {
                    return ErrorResponses.of(HttpStatus.BAD_REQUEST, "invalid_request",
                            "components must map header field names to string values");
                }
                components = components.withField(component.getKey(), component.getValue());
            }
        }
        if (request.directoryAgent() != null) {
            components = components.withField("directory-agent", request.directoryAgent());
        }
        if (request.queryParam() != null) {
            components = components.withField("query-param", request.queryParam());
        }

        SignatureHeaders headers = new SignatureHeaders(
                request.signatureAgent(), request.signatureInput(), request.signature());
        VerificationResult result = headers.isAbsent()
                ? VerificationResult.untrusted(VerificationResult.MISSING_SIGNATURE)
                : signatureVerifier.verify(headers, components, Set.of());

        logger.info("Explicit signature check for {}{}: {}", request.authority(), request.path(), result.message());

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("is_trusted", result.trusted());
        response.put("message", result.message());
        response.put("agent_name", result.agentName());
        return ResponseEntity.ok(response);
    }

    /**
     * Whether the current request itself carried a verified agent signature.
     */
    @GetMapping(value = "/check-verification", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> checkVerification() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        Map<String, Object> response = new LinkedHashMap<>();
        if (authentication instanceof AgentAuthenticationToken agent) {
            response.put("verified", true);
            response.put("agent_name", agent.getAgentName());
            response.put("verified_by", VERIFIED_BY);
            response.put("message", "Request signed by " + agent.getAgentIdentifier());
        } else {
            response.put("verified", false);
            response.put("agent_name", null);
            response.put("verified_by", null);
            response.put("message", "Request carries no verified agent signature");
        }
        return ResponseEntity.ok(response);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}
