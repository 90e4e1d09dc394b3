package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FinalizeRequest(
        @JsonProperty("shipping_address") Address shippingAddress,
        @JsonProperty("billing_address") Address billingAddress,
        @JsonProperty("customer_info") CustomerInfo customerInfo,
        @JsonProperty("coupon_code") String couponCode
) {
}
