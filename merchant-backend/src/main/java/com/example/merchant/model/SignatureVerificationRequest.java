package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Signature headers and the request they claim to sign, submitted for an explicit check.
 * {@code directory_agent} and {@code query_param} are shorthands for the custom components of the same name.
 */
public record SignatureVerificationRequest(
        @JsonProperty("signature_agent") String signatureAgent,
        @JsonProperty("signature_input") String signatureInput,
        @JsonProperty("signature") String signature,
        @JsonProperty("authority") String authority,
        @JsonProperty("path") String path,
        @JsonProperty("directory_agent") String directoryAgent,
        @JsonProperty("query_param") String queryParam,
        @JsonProperty("components") Map<String, String> components
) {
}
