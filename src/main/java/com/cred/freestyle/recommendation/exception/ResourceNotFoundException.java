package com.cred.freestyle.recommendation.exception;

/**
 * Exception thrown when no resource matches a request (e.g. no accessory recommendations
 * exist for a flat discount).
 *
 * @author Recommendation Team
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;

    public ResourceNotFoundException(String resourceType, String message) {
        super(message);
        this.resourceType = resourceType;
    }

    public String getResourceType() {
        return resourceType;
    }
}
