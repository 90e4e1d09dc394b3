package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record AddCartItemRequest(
        @JsonProperty("product_id") Long productId,
        @JsonProperty("quantity") Integer quantity
) {
}
