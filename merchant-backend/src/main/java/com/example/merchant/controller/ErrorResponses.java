package com.example.merchant.controller;

import com.example.merchant.exception.CheckoutException;
import com.example.merchant.exception.OrderNotRecordedException;
import com.example.merchant.exception.SettlementAlreadyRecordedException;
import com.example.merchant.exception.SettlementDeniedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The {@code {"error", "error_description"}} bodies returned by every endpoint.
 */
final class ErrorResponses {

    private ErrorResponses() {
    }

    static ResponseEntity<Map<String, Object>> of(HttpStatus status, String error, String description) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error);
        body.put("error_description", description);
        return ResponseEntity.status(status).body(body);
    }

    static ResponseEntity<Map<String, Object>> of(CheckoutException e) {
        ResponseEntity<Map<String, Object>> response = of(e.getStatus(), e.getErrorCode(), e.getMessage());
        if (e instanceof SettlementDeniedException denied) {
            response.getBody().put("facilitator_status", denied.getFacilitatorStatus());
            response.getBody().put("facilitator_response", denied.getFacilitatorResponse());
        } else if (e instanceof OrderNotRecordedException unrecorded) {
            response.getBody().put("receipt_id", unrecorded.getReceiptId());
        } else if (e instanceof SettlementAlreadyRecordedException recorded) {
            response.getBody().put("receipt_id", recorded.getReceiptId());
        }
        return response;
    }

    static ResponseEntity<Map<String, Object>> serverError(String description) {
        return of(HttpStatus.INTERNAL_SERVER_ERROR, "server_error", description);
    }

}
