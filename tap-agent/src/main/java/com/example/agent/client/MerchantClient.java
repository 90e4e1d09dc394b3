package com.example.agent.client;

import com.example.agent.config.AgentProperties;
import com.example.agent.signer.AgentRequestSigner;
import com.example.signature.SignatureContext;
import com.example.signature.SignatureHeaders;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the merchant with signed requests: browsing under {@code agent-browser-auth}, paying
 * under {@code agent-payer-auth}.
 */
@Component
public class MerchantClient {

    private static final Logger logger = LoggerFactory.getLogger(MerchantClient.class);

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_OBJECT = new ParameterizedTypeReference<>() {
    };

    private final RestClient restClient;
    private final AgentRequestSigner signer;
    private final String baseUrl;

    public MerchantClient(RestClient.Builder restClientBuilder, AgentRequestSigner signer, AgentProperties properties) {
        this.restClient = restClientBuilder.build();
        this.signer = signer;
        this.baseUrl = properties.getMerchantBaseUrl();
    }

    public Map<String, Object> fetchProduct(long productId) {
        String url = url("/api/products/{productId}", productId);
        SignatureHeaders headers = signer.sign(url, SignatureContext.TAG_BROWSER_AUTH);

        Map<String, Object> product = restClient.get()
                .uri(url)
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> apply(h, headers))
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), (req, res) -> {
                    throw new MerchantRequestException(res.getStatusCode().value(),
                            StreamUtils.copyToString(res.getBody(), StandardCharsets.UTF_8));
                })
                .body(JSON_OBJECT);
        logger.info("Fetched product {}: {}", productId, product != null ? product.get("name") : null);
        return product;
    }

    /**
     * Pay for a cart with a delegation token issued to this agent.
     */
    public Map<String, Object> checkoutWithDelegation(String cartSessionId, String delegationToken, String agentId) {
        String url = url("/api/cart/{sessionId}/x402/checkout", cartSessionId);
        SignatureHeaders headers = signer.sign(url, SignatureContext.TAG_PAYER_AUTH);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("delegation_token", delegationToken);
        body.put("agent_id", agentId);

        Map<String, Object> result = restClient.post()
                .uri(url)
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .headers(h -> apply(h, headers))
                .body(body)
                .retrieve()
                .onStatus(status -> !status.is2xxSuccessful(), (req, res) -> {
                    String error = StreamUtils.copyToString(res.getBody(), StandardCharsets.UTF_8);
                    logger.warn("⚠️x402 checkout of cart {} failed: {} {}", cartSessionId, res.getStatusCode().value(), error);
                    throw new MerchantRequestException(res.getStatusCode().value(), error);
                })
                .body(JSON_OBJECT);
        logger.info("x402 checkout of cart {} completed", cartSessionId);
        return result;
    }

    private String url(String path, Object... variables) {
        return UriComponentsBuilder.fromUriString(baseUrl)
                .path(path)
                .buildAndExpand(variables)
                .encode()
                .toUriString();
    }

    private static void apply(HttpHeaders httpHeaders, SignatureHeaders headers) {
        httpHeaders.set(SignatureHeaders.SIGNATURE_AGENT, headers.signatureAgent());
        httpHeaders.set(SignatureHeaders.SIGNATURE_INPUT, headers.signatureInput());
        httpHeaders.set(SignatureHeaders.SIGNATURE, headers.signature());
    }

}
