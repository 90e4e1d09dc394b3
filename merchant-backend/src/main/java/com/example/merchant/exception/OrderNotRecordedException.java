package com.example.merchant.exception;

import org.springframework.http.HttpStatus;

/**
 * The facilitator settled the payment but the order could not be written.
 */
public class OrderNotRecordedException extends CheckoutException {

    private final String receiptId;

    public OrderNotRecordedException(String receiptId, Throwable cause) {
        super(HttpStatus.INTERNAL_SERVER_ERROR, "order_not_recorded",
                "Payment settled under receipt " + receiptId + " but the order could not be recorded", cause);
        this.receiptId = receiptId;
    }

    public String getReceiptId() {
        return receiptId;
    }

}
