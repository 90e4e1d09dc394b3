package com.example.merchant.service;

import com.example.merchant.model.SettlementRequest;
import com.example.merchant.model.SettlementResponse;

/**
 * Settles x402 delegation tokens with the external Payment Facilitator.
 */
public interface PaymentFacilitatorClient {

    /**
     * Ask the facilitator to settle a payment.
     *
     * @return the settlement, always with a transaction receipt
     * @throws com.example.merchant.exception.SettlementDeniedException       if the facilitator refuses
     * @throws com.example.merchant.exception.FacilitatorUnreachableException if there is no usable answer
     */
    SettlementResponse settle(SettlementRequest request);

}
