package com.example.signature;

/**
 * A covered component has no value in the request being signed or verified.
 */
public class MissingComponentException extends Exception {

    private final String component;

    public MissingComponentException(String component) {
        super("Missing value for covered component: " + component);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }

}
