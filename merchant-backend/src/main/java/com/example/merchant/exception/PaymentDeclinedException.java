package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

public class PaymentDeclinedException extends CheckoutException {

    public PaymentDeclinedException(String message) {
        super(HttpStatus.PAYMENT_REQUIRED, "payment_declined", message);
    }

}
