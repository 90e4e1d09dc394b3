package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

/**
 * No usable answer from the facilitator: connection failure, timeout, or a success response
 * without a receipt. The payment must be treated as not settled.
 */
public class FacilitatorUnreachableException extends CheckoutException {

    public FacilitatorUnreachableException(String message) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "facilitator_unreachable", message);
    }

    public FacilitatorUnreachableException(String message, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, "facilitator_unreachable", message, cause);
    }

}
