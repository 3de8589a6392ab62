package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.EnumValues;
import com.cred.freestyle.marketplace.domain.model.Transaction;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Response DTO for a payment transaction.
 *
 * @author Marketplace Team
 */
public class TransactionResponse {

    private String transactionId;
    private String userId;
    private String transactionType;
    private String subscriptionId;
    private String adBoostId;
    private BigDecimal amount;
    private String currency;
    private String paymentMethod;
    private String status;
    private String transactionReference;
    private String paymentProviderReference;
    private Map<String, Object> metadata;
    private Instant completedAt;
    private Instant failedAt;
    private Instant createdAt;

    public TransactionResponse() {
    }

    public static TransactionResponse fromEntity(Transaction transaction) {
        TransactionResponse response = new TransactionResponse();
        response.setTransactionId(transaction.getTransactionId());
        response.setUserId(transaction.getUserId());
        response.setTransactionType(EnumValues.toValue(transaction.getTransactionType()));
        if (transaction.getSubscription() != null) {
            response.setSubscriptionId(transaction.getSubscription().getSubscriptionId());
        }
        if (transaction.getAdBoost() != null) {
            response.setAdBoostId(transaction.getAdBoost().getBoostId());
        }
        response.setAmount(transaction.getAmount());
        response.setCurrency(transaction.getCurrency());
        response.setPaymentMethod(EnumValues.toValue(transaction.getPaymentMethod()));
        response.setStatus(EnumValues.toValue(transaction.getStatus()));
        response.setTransactionReference(transaction.getTransactionReference());
        response.setPaymentProviderReference(transaction.getPaymentProviderReference());
        response.setMetadata(transaction.getMetadata() == null
                ? new HashMap<>()
                : new HashMap<>(transaction.getMetadata()));
        response.setCompletedAt(transaction.getCompletedAt());
        response.setFailedAt(transaction.getFailedAt());
        response.setCreatedAt(transaction.getCreatedAt());
        return response;
    }

    public String getTransactionId() {
        return transactionId;
    }

    public void setTransactionId(String transactionId) {
        this.transactionId = transactionId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getTransactionType() {
        return transactionType;
    }

    public void setTransactionType(String transactionType) {
        this.transactionType = transactionType;
    }

    public String getSubscriptionId() {
        return subscriptionId;
    }

    public void setSubscriptionId(String subscriptionId) {
        this.subscriptionId = subscriptionId;
    }

    public String getAdBoostId() {
        return adBoostId;
    }

    public void setAdBoostId(String adBoostId) {
        this.adBoostId = adBoostId;
    }

    public BigDecimal getAmount() {
        return amount;
    }

    public void setAmount(BigDecimal amount) {
        this.amount = amount;
    }

    public String getCurrency() {
        return currency;
    }

    public void setCurrency(String currency) {
        this.currency = currency;
    }

    public String getPaymentMethod() {
        return paymentMethod;
    }

    public void setPaymentMethod(String paymentMethod) {
        this.paymentMethod = paymentMethod;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
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

    public Map<String, Object> getMetadata() {
        return metadata;
    }

    public void setMetadata(Map<String, Object> metadata) {
        this.metadata = metadata;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public void setCompletedAt(Instant completedAt) {
        this.completedAt = completedAt;
    }

    public Instant getFailedAt() {
        return failedAt;
    }

    public void setFailedAt(Instant failedAt) {
        this.failedAt = failedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
