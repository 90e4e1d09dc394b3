package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

/**
 * The facilitator answered but refused to settle. Its response body is kept verbatim.
 */
public class SettlementDeniedException extends CheckoutException {

    private final int facilitatorStatus;
    private final String facilitatorResponse;

    public SettlementDeniedException(int facilitatorStatus, String facilitatorResponse) {
        super(HttpStatus.PAYMENT_REQUIRED, "settlement_denied", "Payment settlement failed: " + facilitatorResponse);
        this.facilitatorStatus = facilitatorStatus;
        this.facilitatorResponse = facilitatorResponse;
    }

    public int getFacilitatorStatus() {
        return facilitatorStatus;
    }

    public String getFacilitatorResponse() {
        return facilitatorResponse;
    }

}
