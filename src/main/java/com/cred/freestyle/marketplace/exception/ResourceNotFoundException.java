package com.cred.freestyle.marketplace.exception;

/**
 * Thrown when a subscription, boost, transaction, plan, ad or user does not exist.
 *
 * @author Marketplace Team
 */
public class ResourceNotFoundException extends ResourceException {

    public ResourceNotFoundException(String resourceType, String resourceId) {
        this(resourceType, resourceId, notFoundMessage(resourceType, resourceId));
    }

    public ResourceNotFoundException(String resourceType, String resourceId, String message) {
        super(resourceType, resourceId, message);
    }

    static String notFoundMessage(String resourceType, String resourceId) {
        return String.format("%s with ID %s not found", resourceType, resourceId);
    }
}
