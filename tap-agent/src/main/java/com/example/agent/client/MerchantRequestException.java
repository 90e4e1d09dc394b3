package com.example.agent.client;

/**
 * The merchant answered a signed request with an error status.
 */
public class MerchantRequestException extends RuntimeException {

    private final int status;
    private final String responseBody;

    public MerchantRequestException(int status, String responseBody) {
        super("Merchant responded " + status + ": " + responseBody);
        this.status = status;
        this.responseBody = responseBody;
    }

    public int getStatus() {
        return status;
    }

    public String getResponseBody() {
        return responseBody;
    }

}
