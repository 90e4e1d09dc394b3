package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SettlementReceipt(
        @JsonProperty("receipt_id") String receiptId,
        @JsonProperty("transaction_id") String transactionId,
        @JsonProperty("payment_rail_used") String paymentRailUsed,
        @JsonProperty("amount") BigDecimal amount,
        @JsonProperty("processing_fee") BigDecimal processingFee,
        @JsonProperty("net_amount") BigDecimal netAmount
) {
}
