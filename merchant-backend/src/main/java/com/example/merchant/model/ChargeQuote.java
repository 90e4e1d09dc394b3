package com.example.merchant.model;

import java.math.BigDecimal;

/**
 * Amounts charged for a cart, all at scale 2.
 */
public record ChargeQuote(
        BigDecimal subtotal,
        BigDecimal shipping,
        BigDecimal tax,
        BigDecimal discount,
        BigDecimal total,
        String currency
) {
}
