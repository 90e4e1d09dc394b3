package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

/**
 * The payment session is unknown, already consumed, expired, or belongs to another cart.
 * The cases are not told apart.
 */
public class SessionNotFoundException extends CheckoutException {

    public SessionNotFoundException() {
        super(HttpStatus.NOT_FOUND, "session_not_found", "Payment session not found or expired");
    }

}
