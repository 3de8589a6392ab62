package com.cred.freestyle.marketplace.service;

import com.cred.freestyle.marketplace.domain.model.Transaction;

/**
 * Result of applying a payment gateway callback.
 *
 * @author Marketplace Team
 */
public class CallbackResult {

    private final Transaction transaction;
    private final boolean alreadyProcessed;

    private CallbackResult(Transaction transaction, boolean alreadyProcessed) {
        this.transaction = transaction;
        this.alreadyProcessed = alreadyProcessed;
    }

    public static CallbackResult processed(Transaction transaction) {
        return new CallbackResult(transaction, false);
    }

    /**
     * The callback repeated the status the transaction already had; nothing was written.
     */
    public static CallbackResult alreadyProcessed(Transaction transaction) {
        return new CallbackResult(transaction, true);
    }

    public Transaction getTransaction() {
        return transaction;
    }

    public boolean isAlreadyProcessed() {
        return alreadyProcessed;
    }
}
