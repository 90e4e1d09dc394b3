package com.example.merchant.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DelegatedCheckoutRequest(
        @JsonProperty("delegation_token") String delegationToken,
        @JsonProperty("agent_id") String agentId
) {
}
