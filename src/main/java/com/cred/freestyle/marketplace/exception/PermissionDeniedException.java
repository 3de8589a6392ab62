package com.cred.freestyle.marketplace.exception;

/**
 * Thrown when a user acts on a resource owned by someone else.
 * Carries the not-found message so the response does not reveal that the resource exists.
 *
 * @author Marketplace Team
 */
public class PermissionDeniedException extends ResourceException {

    private final String userId;

    public PermissionDeniedException(String resourceType, String resourceId, String userId) {
        super(resourceType, resourceId, ResourceNotFoundException.notFoundMessage(resourceType, resourceId));
        this.userId = userId;
    }

    public String getUserId() {
        return userId;
    }
}
