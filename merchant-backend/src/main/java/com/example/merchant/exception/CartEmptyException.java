package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

public class CartEmptyException extends CheckoutException {

    public CartEmptyException(String message) {
        super(HttpStatus.BAD_REQUEST, "cart_empty", message);
    }

}
