package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

public class CartNotFoundException extends CheckoutException {

    public CartNotFoundException(String message) {
        super(HttpStatus.NOT_FOUND, "cart_not_found", message);
    }

}
