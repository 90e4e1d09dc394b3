package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;
import java.util.List;

/**
 * Body of {@code POST /x402/settle}.
 */
public record SettlementRequest(
        @JsonProperty("delegation_token") String delegationToken,
        @JsonProperty("merchant_id") String merchantId,
        @JsonProperty("merchant_name") String merchantName,
        @JsonProperty("cart_id") String cartId,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("currency") String currency,
        @JsonProperty("items") List<Item> items,
        @JsonProperty("merchant_signature") String merchantSignature
) {

    public record Item(
            @JsonProperty("product_id") Long productId,
            @JsonProperty("name") String name,
            @JsonProperty("quantity") int quantity,
            @JsonProperty("price") BigDecimal price
    ) {
    }

}
