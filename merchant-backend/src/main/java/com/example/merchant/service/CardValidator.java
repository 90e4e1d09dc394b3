package com.example.merchant.service;

import com.example.merchant.exception.InvalidPaymentFieldsException;
import com.example.merchant.model.CardDetails;
import com.example.merchant.model.FulfillRequest;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.YearMonth;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Component
public class CardValidator {

    private static final Pattern SEPARATORS = Pattern.compile("[\\s-]");
    private static final Pattern DIGITS = Pattern.compile("\\d{13,19}");
    private static final Pattern EXPIRY = Pattern.compile("(\\d{2})/(\\d{2}|\\d{4})");
    private static final Pattern CVV = Pattern.compile("\\d{3,4}");

    private final Clock clock;

    public CardValidator(Clock clock) {
        this.clock = clock;
    }

    /**
     * @throws InvalidPaymentFieldsException naming the first field that fails
     */
    public CardDetails validate(FulfillRequest request) {
        String number = SEPARATORS.matcher(request.cardNumber()).replaceAll("");
        if (!DIGITS.matcher(number).matches() || !passesLuhn(number)) {
            throw new InvalidPaymentFieldsException("Invalid card number");
        }

        Matcher expiry = EXPIRY.matcher(request.expiryDate().strip());
        if (!expiry.matches()) {
            throw new InvalidPaymentFieldsException("Invalid expiry date, expected MM/YY or MM/YYYY");
        }
        int month = Integer.parseInt(expiry.group(1));
        int year = Integer.parseInt(expiry.group(2));
        if (expiry.group(2).length() == 2) {
            year += 2000;
        }
        if (month < 1 || month > 12) {
            throw new InvalidPaymentFieldsException("Invalid expiry month");
        }
        YearMonth expiresIn = YearMonth.of(year, month);
        if (expiresIn.isBefore(YearMonth.now(clock))) {
            throw new InvalidPaymentFieldsException("Card has expired");
        }

        String cvv = request.cvv().strip();
        if (!CVV.matcher(cvv).matches()) {
            throw new InvalidPaymentFieldsException("Invalid CVV");
        }

        return new CardDetails(number, expiresIn, cvv, request.cardholderName().strip());
    }

    static boolean passesLuhn(String digits) {
        int sum = 0;
        boolean doubled = false;
        for (int i = digits.length() - 1; i >= 0; i--) {
            int digit = digits.charAt(i) - '0';
            if (doubled) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
            doubled = !doubled;
        }
        return sum % 10 == 0;
    }

    public static String detectBrand(String digits) {
        if (digits.startsWith("4")) {
            return "Visa";
        }
        if (digits.startsWith("34") || digits.startsWith("37")) {
            return "American Express";
        }
        if (digits.startsWith("2") || (digits.charAt(0) == '5' && digits.charAt(1) >= '1' && digits.charAt(1) <= '5')) {
            return "Mastercard";
        }
        if (digits.startsWith("6")) {
            return "Discover";
        }
        return "Unknown";
    }

}
