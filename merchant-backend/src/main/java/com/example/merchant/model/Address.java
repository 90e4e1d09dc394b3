package com.example.merchant.model;

public record Address(String street, String city, String state, String zip, String country) {

    public boolean isComplete() {
        return notBlank(street) && notBlank(city) && notBlank(zip) && notBlank(country);
    }

    /**
     * Single-line form stored with orders.
     */
    public String toSingleLine() {
        StringBuilder line = new StringBuilder(street).append(", ").append(city);
        if (notBlank(state)) {
            line.append(", ").append(state);
        }
        return line.append(" ").append(zip).append(", ").append(country).toString();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

}
