package com.cred.freestyle.marketplace.exception;

/**
 * Base class of the domain errors that concern one identified resource.
 * The type and id end up in the {@code details} of the error response.
 *
 * @author Marketplace Team
 */
public abstract class ResourceException extends RuntimeException {

    private final String resourceType;
    private final String resourceId;

    protected ResourceException(String resourceType, String resourceId, String message) {
        super(message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
