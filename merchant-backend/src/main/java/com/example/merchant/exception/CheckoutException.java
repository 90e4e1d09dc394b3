package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

/**
 * Base class for checkout and payment failures. Each carries the HTTP status and the error code
 * returned to the caller as {@code {"error": code, "error_description": message}}.
 */
public abstract class CheckoutException extends RuntimeException {

    private final HttpStatus status;
    private final String errorCode;

    protected CheckoutException(HttpStatus status, String errorCode, String message) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }

    protected CheckoutException(HttpStatus status, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errorCode = errorCode;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getErrorCode() {
        return errorCode;
    }

}
