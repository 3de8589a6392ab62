package com.cred.freestyle.marketplace.api.dto;

import com.cred.freestyle.marketplace.domain.model.AdBoost;
import com.cred.freestyle.marketplace.service.PurchaseResult;
import com.cred.freestyle.marketplace.service.payment.PaymentInstructions;

/**
 * Response DTO for a started boost purchase.
 *
 * @author Marketplace Team
 */
public class BoostPurchaseResponse {

    private String message;
    private AdBoostResponse boost;
    private TransactionResponse transaction;
    private PaymentInstructions paymentInstructions;

    public BoostPurchaseResponse() {
    }

    public static BoostPurchaseResponse fromResult(String message, PurchaseResult<AdBoost> result) {
        BoostPurchaseResponse response = new BoostPurchaseResponse();
        response.setMessage(message);
        response.setBoost(AdBoostResponse.fromEntity(result.getEntitlement()));
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

    public AdBoostResponse getBoost() {
        return boost;
    }

    public void setBoost(AdBoostResponse boost) {
        this.boost = boost;
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
