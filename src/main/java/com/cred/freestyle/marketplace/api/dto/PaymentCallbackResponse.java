package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.service.CallbackResult;

/**
 * Response DTO for a processed gateway callback.
 * {@code alreadyProcessed} is true when the callback repeated the transaction's current status.
 *
 * @author Marketplace Team
 */
public class PaymentCallbackResponse {

    private String message;
    private Boolean alreadyProcessed;
    private TransactionResponse transaction;

    public PaymentCallbackResponse() {
    }

    public static PaymentCallbackResponse fromResult(String message, CallbackResult result) {
        PaymentCallbackResponse response = new PaymentCallbackResponse();
        response.setMessage(message);
        response.setAlreadyProcessed(result.isAlreadyProcessed());
        response.setTransaction(TransactionResponse.fromEntity(result.getTransaction()));
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public Boolean getAlreadyProcessed() {
        return alreadyProcessed;
    }

    public void setAlreadyProcessed(Boolean alreadyProcessed) {
        this.alreadyProcessed = alreadyProcessed;
    }

    public TransactionResponse getTransaction() {
        return transaction;
    }

    public void setTransaction(TransactionResponse transaction) {
        this.transaction = transaction;
    }
}
