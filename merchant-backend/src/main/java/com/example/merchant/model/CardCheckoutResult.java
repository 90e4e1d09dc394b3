package com.example.merchant.model;

/**
 * A fulfilled card checkout: the order, the processor's answer and the shipment tracking number.
 */
public record CardCheckoutResult(PlacedOrder placed, CardPaymentResult payment, String trackingNumber) {
}
