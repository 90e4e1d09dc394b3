package com.example.merchant.model;

public record CardPaymentResult(String transactionId, String providerReference, String cardBrand, String lastFour) {
}
