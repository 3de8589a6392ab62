package com.cred.freestyle.marketplace.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

import java.util.HashMap;
import java.util.Map;

/**
 * Payment gateway callback body.
 *
 * @author Marketplace Team
 */
public class PaymentCallbackRequest {

    @NotBlank(message = "Transaction reference is required")
    private String transactionReference;

    private String paymentProviderReference;

    @NotBlank(message = "Status is required")
    @Pattern(regexp = "(?i)completed|failed", message = "Status must be 'completed' or 'failed'")
    private String status;

    private Map<String, Object> metadata = new HashMap<>();

    public PaymentCallbackRequest() {
    }

    public PaymentCallbackRequest(String transactionReference, String paymentProviderReference, String status) {
        this.transactionReference = transactionReference;
        this.paymentProviderReference = paymentProviderReference;
        this.status = status;
    }

    public String getTransactionReference() {
        return transactionReference;
    }

    public void setTransactionReference(String transactionReference) {
        this.transactionReference = transactionReference;
    }

    public String getPaymentProviderReference() {
        return paymentProviderReference;
    }

    public void setPaymentProviderReference(String paymentProviderReference) {
        this.paymentProviderReference = paymentProviderReference;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }
}
