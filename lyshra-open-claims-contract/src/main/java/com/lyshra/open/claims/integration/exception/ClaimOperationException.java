package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.Claim;

import java.util.Optional;

/**
 * Base type of every failure raised by the claim engine.
 *
 * Each failure carries a stable {@link ClaimErrorCode}. Failures that concern an
 * existing claim also carry the snapshot observed when the failure was detected,
 * so callers can decide whether to re-read and retry without another lookup.
 */
public class ClaimOperationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ClaimErrorCode errorCode;
    private final String claimId;
    private final transient Claim snapshot;

    public ClaimOperationException(ClaimErrorCode errorCode, String message, String claimId, Claim snapshot) {
        super(message);
        this.errorCode = errorCode;
        this.claimId = claimId;
        this.snapshot = snapshot;
    }

    public ClaimOperationException(ClaimErrorCode errorCode, String message) {
        this(errorCode, message, null, null);
    }

    public ClaimErrorCode getErrorCode() {
        return errorCode;
    }

    public String getClaimId() {
        return claimId;
    }

    /**
     * Gets the claim as observed when the failure was detected, if any.
     */
    public Optional<Claim> getSnapshot() {
        return Optional.ofNullable(snapshot);
    }
}
