package com.lyshra.open.claims.integration.enumerations;

/**
 * Status of a pending ownership handoff request.
 */
public enum HandoffStatus {

    /**
     * Waiting for an eligible claimant to accept.
     */
    PENDING,

    /**
     * Accepted; ownership was transferred.
     */
    COMPLETED,

    /**
     * Withdrawn, or invalidated because the claim left the requester's hands.
     */
    CANCELLED;

    public boolean isResolved() {
        return this != PENDING;
    }
}
