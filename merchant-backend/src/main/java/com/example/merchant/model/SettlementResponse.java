package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.math.BigDecimal;

/**
 * Body of a successful {@code /x402/settle} call.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SettlementResponse(
        @JsonProperty("transaction_receipt") SettlementReceipt transactionReceipt,
        @JsonProperty("remaining_delegation_limit") BigDecimal remainingDelegationLimit
) {
}
