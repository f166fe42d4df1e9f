package io.bastion.api.error;

import java.util.List;
import java.util.Map;

/**
 * Raised when the upstream rejects the request payload (HTTP 422).
 */
public final class ValidationException extends ApiException {

    private final Map<String, List<String>> fieldErrors;

    public ValidationException(String message, Map<String, List<String>> fieldErrors, Integer statusCode) {
        super(message, ErrorCode.VALIDATION, statusCode, null);
        this.fieldErrors = fieldErrors == null ? Map.of() : Map.copyOf(fieldErrors);
    }

    /**
     * @return messages per rejected field, never null
     */
    public Map<String, List<String>> fieldErrors() {
        return fieldErrors;
    }
}
