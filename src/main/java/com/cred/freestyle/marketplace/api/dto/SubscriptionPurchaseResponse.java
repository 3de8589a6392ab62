package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.PremiumSubscription;
import com.cred.freestyle.marketplace.service.PurchaseResult;
import com.cred.freestyle.marketplace.service.payment.PaymentInstructions;

/**
 * Response DTO for a started subscription purchase.
 *
 * @author Marketplace Team
 */
public class SubscriptionPurchaseResponse {

    private String message;
    private SubscriptionResponse subscription;
    private TransactionResponse transaction;
    private PaymentInstructions paymentInstructions;

    public SubscriptionPurchaseResponse() {
    }

    public static SubscriptionPurchaseResponse fromResult(String message, PurchaseResult<PremiumSubscription> result) {
        SubscriptionPurchaseResponse response = new SubscriptionPurchaseResponse();
        response.setMessage(message);
        response.setSubscription(SubscriptionResponse.fromEntity(result.getEntitlement()));
        response.setTransaction(TransactionResponse.fromEntity(result.getTransaction()));
        response.setPaymentInstructions(result.getPaymentInstructions());
        return response;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public SubscriptionResponse getSubscription() {
        return subscription;
    }

    public void setSubscription(SubscriptionResponse subscription) {
        this.subscription = subscription;
    }

    public TransactionResponse getTransaction() {
        return transaction;
    }

    public void setTransaction(TransactionResponse transaction) {
        this.transaction = transaction;
    }

    public PaymentInstructions getPaymentInstructions() {
        return paymentInstructions;
    }

    public void setPaymentInstructions(PaymentInstructions paymentInstructions) {
        this.paymentInstructions = paymentInstructions;
    }
}
