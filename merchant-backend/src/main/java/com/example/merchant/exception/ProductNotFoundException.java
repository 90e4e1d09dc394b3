package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

public class ProductNotFoundException extends CheckoutException {

    public ProductNotFoundException(Long productId) {
        super(HttpStatus.NOT_FOUND, "product_not_found", "Product not found: " + productId);
    }

}
