package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record FulfillRequest(
        @JsonProperty("payment_session_id") String paymentSessionId,
        @JsonProperty("card_number") String cardNumber,
        @JsonProperty("expiry_date") String expiryDate,
        @JsonProperty("cvv") String cvv,
        @JsonProperty("cardholder_name") String cardholderName
) {

    @Override
    public String toString() {
        return "FulfillRequest[paymentSessionId=" + paymentSessionId + ", card=****]";
    }

}
