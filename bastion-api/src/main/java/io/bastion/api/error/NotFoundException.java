package io.bastion.api.error;

public final class NotFoundException extends ApiException {

    private final String resourceType;
    private final String resourceId;

    public NotFoundException(String message, String resourceType, String resourceId) {
        super(message, ErrorCode.NOT_FOUND, 404, null);
        this.resourceType = resourceType == null ? "unknown" : resourceType;
        this.resourceId = resourceId;
    }

    public String resourceType() {
        return resourceType;
    }

    /**
     * @return the missing resource's id, or null if the upstream did not supply one
     */
    public String resourceId() {
        return resourceId;
    }
}
