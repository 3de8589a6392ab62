package com.cred.freestyle.marketplace.exception;

/**
 * Thrown when an operation is not allowed in the resource's current status,
 * e.g. cancelling a subscription that is not active or failing a completed transaction.
 * Nothing has been modified when this is thrown.
 *
 * @author Marketplace Team
 */
public class InvalidStateException extends ResourceException {

    private final String currentStatus;

    public InvalidStateException(String resourceType, String resourceId, String currentStatus, String message) {
        super(resourceType, resourceId, message);
        this.currentStatus = currentStatus;
    }

    public String getCurrentStatus() {
        return currentStatus;
    }
}
