package com.cred.freestyle.marketplace.exception;

/**
 * Exception thrown when a generated transaction reference collides with an existing one
 * and no unique reference could be produced.
 *
 * @author Marketplace Team
 */
public class TransactionReferenceConflictException extends RuntimeException {

    private final String transactionReference;

    public TransactionReferenceConflictException(String transactionReference) {
        super("Transaction reference already exists: " + transactionReference);
        this.transactionReference = transactionReference;
    }

    public TransactionReferenceConflictException(String transactionReference, Throwable cause) {
        super("Transaction reference already exists: " + transactionReference, cause);
        this.transactionReference = transactionReference;
    }

    public String getTransactionReference() {
        return transactionReference;
    }
}
