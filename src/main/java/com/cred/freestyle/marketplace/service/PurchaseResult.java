package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Transaction;
import com.cred.freestyle.marketplace.service.payment.PaymentInstructions;

/**
 * A pending entitlement together with the pending transaction that pays for it.
 *
 * @param <E> Entitlement type (subscription or ad boost)
 * @author Marketplace Team
 */
public class PurchaseResult<E> {

    private final E entitlement;
    private final Transaction transaction;
    private final PaymentInstructions paymentInstructions;

    public PurchaseResult(E entitlement, Transaction transaction, PaymentInstructions paymentInstructions) {
        this.entitlement = entitlement;
        this.transaction = transaction;
        this.paymentInstructions = paymentInstructions;
    }

    public E getEntitlement() {
        return entitlement;
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public PaymentInstructions getPaymentInstructions() {
        return paymentInstructions;
    }
}
