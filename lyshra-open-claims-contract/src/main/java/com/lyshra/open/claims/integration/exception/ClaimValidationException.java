package com.lyshra.open.claims.integration.exception;

/**
 * Raised when an input is missing, malformed or violates a precondition
 * that does not depend on the claim's current status.
 */
public class ClaimValidationException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    public ClaimValidationException(String detail) {
        super(ClaimErrorCode.VALIDATION_FAILED, ClaimErrorCode.VALIDATION_FAILED.format(detail));
    }

    public static ClaimValidationException missingField(String field) {
        return new ClaimValidationException(field + " is required");
    }

    public static ClaimValidationException invalidValue(String field, Object value) {
        return new ClaimValidationException(String.format("unsupported %s '%s'", field, value));
    }
}
