package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

public class InvalidPaymentFieldsException extends CheckoutException {

    public InvalidPaymentFieldsException(String message) {
        super(HttpStatus.BAD_REQUEST, "invalid_payment_fields", message);
    }

}
