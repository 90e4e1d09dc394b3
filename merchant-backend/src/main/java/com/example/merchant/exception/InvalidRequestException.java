package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

public class InvalidRequestException extends CheckoutException {

    public InvalidRequestException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_request", message);
    }

}
