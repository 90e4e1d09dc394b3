package com.example.merchant.model;

public record DelegatedCheckoutResult(PlacedOrder placed, SettlementResponse settlement, String agentId,
                                      String trackingNumber) {
}
