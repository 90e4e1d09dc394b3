package com.example.merchant.service;

import com.example.merchant.config.FacilitatorProperties;
import com.example.merchant.exception.FacilitatorUnreachableException;
import com.example.merchant.exception.SettlementDeniedException;
import com.example.merchant.model.SettlementRequest;
import com.example.merchant.model.SettlementResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;

@Component
public class HttpPaymentFacilitatorClient implements PaymentFacilitatorClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpPaymentFacilitatorClient.class);

    static final String SETTLE_PATH = "/x402/settle";

    private final RestClient restClient;

    public HttpPaymentFacilitatorClient(RestClient.Builder restClientBuilder, FacilitatorProperties properties) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(properties.getConnectTimeout());
        requestFactory.setReadTimeout(properties.getReadTimeout());

        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .requestFactory(requestFactory)
                .build();
    }

    @Override
    public SettlementResponse settle(SettlementRequest request) {
        SettlementResponse response;
        try {
            response = restClient.post()
                    .uri(SETTLE_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (req, res) -> {
                        String body = StreamUtils.copyToString(res.getBody(), StandardCharsets.UTF_8);
                        logger.warn("⚠️Facilitator refused settlement for cart {}: {} {}",
                                request.cartId(), res.getStatusCode().value(), body);
                        throw new SettlementDeniedException(res.getStatusCode().value(), body);
                    })
                    .body(SettlementResponse.class);
        } catch (ResourceAccessException e) {
            logger.error("❌Payment Facilitator unavailable for cart {}: {}", request.cartId(), e.getMessage());
            throw new FacilitatorUnreachableException("Payment Facilitator unavailable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            logger.error("❌Unreadable settlement response for cart {}", request.cartId(), e);
            throw new FacilitatorUnreachableException("Payment Facilitator returned an unreadable response", e);
        }

        if (response == null || response.transactionReceipt() == null
                || response.transactionReceipt().transactionId() == null) {
            logger.error("❌Settlement response for cart {} has no transaction receipt", request.cartId());
            throw new FacilitatorUnreachableException("Payment Facilitator returned no transaction receipt");
        }
        return response;
    }

}
