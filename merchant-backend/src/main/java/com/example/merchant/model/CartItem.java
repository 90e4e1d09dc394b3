package com.example.merchant.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A cart line with the product's name and price copied at read time.
 * Payment sessions and orders keep these copies, so later catalog changes do not reach them.
 */
public record CartItem(Long productId, String productName, int quantity, BigDecimal unitPrice) {

    public BigDecimal lineTotal() {
        return unitPrice.multiply(BigDecimal.valueOf(quantity)).setScale(2, RoundingMode.HALF_UP);
    }

}
