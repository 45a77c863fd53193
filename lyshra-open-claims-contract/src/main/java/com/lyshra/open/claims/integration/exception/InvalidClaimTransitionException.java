package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.Claim;

/**
 * Raised when an operation is not allowed from the claim's current status.
 */
public class InvalidClaimTransitionException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    private final String operation;

    public InvalidClaimTransitionException(String operation, Claim current) {
        this(ClaimErrorCode.INVALID_TRANSITION,
                ClaimErrorCode.INVALID_TRANSITION.format(operation, current.getId(), current.getStatus().getCode()),
                operation,
                current);
    }

    protected InvalidClaimTransitionException(ClaimErrorCode errorCode, String message, String operation, Claim current) {
        super(errorCode, message, current.getId(), current);
        this.operation = operation;
    }

    /**
     * Creates an exception for a steal attempted on a claim whose owner is still active.
     */
    public static InvalidClaimTransitionException notStale(Claim current) {
        return new InvalidClaimTransitionException(ClaimErrorCode.INVALID_TRANSITION,
                String.format("Cannot steal claim %s: owner %s is still active", current.getId(), current.getClaimantId()),
                "steal",
                current);
    }

    public String getOperation() {
        return operation;
    }
}
