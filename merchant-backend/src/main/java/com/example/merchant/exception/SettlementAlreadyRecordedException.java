package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

/**
 * The cart was already settled with the facilitator but its order was never written. It must be
 * reconciled by hand instead of being paid again.
 */
public class SettlementAlreadyRecordedException extends CheckoutException {

    private final String receiptId;

    public SettlementAlreadyRecordedException(String cartSessionId, String receiptId) {
        super(HttpStatus.CONFLICT, "settlement_already_recorded",
                "Cart " + cartSessionId + " was already settled under receipt " + receiptId);
        this.receiptId = receiptId;
    }

    public String getReceiptId() {
        return receiptId;
    }

}
