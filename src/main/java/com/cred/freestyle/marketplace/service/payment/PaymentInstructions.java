package com.cred.freestyle.marketplace.service.payment;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * What the payer has to do next to settle a pending transaction.
 *
 * @author Marketplace Team
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaymentInstructions {

    private final String method;
    private final String instructions;
    private final String transactionReference;

    public PaymentInstructions(String method, String instructions, String transactionReference) {
        this.method = method;
        this.instructions = instructions;
        this.transactionReference = transactionReference;
    }

    public String getMethod() {
        return method;
    }

    /**
     * Human-readable instructions; null for methods without specific guidance.
     */
    public String getInstructions() {
        return instructions;
    }

    public String getTransactionReference() {
        return transactionReference;
    }
}
