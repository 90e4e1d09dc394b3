package com.example.merchant.model;

import java.time.YearMonth;

/**
 * Card data after validation: number reduced to digits, expiry parsed.
 */
public record CardDetails(String number, YearMonth expiry, String cvv, String cardholderName) {

    public String lastFour() {
        return number.substring(number.length() - 4);
    }

    @Override
    public String toString() {
        return "CardDetails[number=****" + lastFour() + ", expiry=" + expiry + "]";
    }

}
