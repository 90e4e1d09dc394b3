package com.example.signature;

/**
 * Thrown when signature headers do not follow the expected grammar.
 */
public class MalformedSignatureException extends Exception {

    public MalformedSignatureException(String message) {
        super(message);
    }

    public MalformedSignatureException(String message, Throwable cause) {
        super(message, cause);
    }

}
