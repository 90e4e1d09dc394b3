package com.example.merchant.model;

import java.math.BigDecimal;
import java.time.Instant;

public record Product(
        Long id,
        String name,
        String description,
        BigDecimal price,
        String category,
        String imageUrl,
        Integer stockQuantity,
        Instant createdAt
) {
}
