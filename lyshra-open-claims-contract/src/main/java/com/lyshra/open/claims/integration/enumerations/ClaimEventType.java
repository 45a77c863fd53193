package com.lyshra.open.claims.integration.enumerations;

/**
 * Kinds of domain events emitted by the claim engine.
 */
public enum ClaimEventType {
    CREATED,
    CLAIMED,
    RELEASED,
    COMPLETED,
    ABANDONED,
    EXPIRED,
    STOLEN,
    HANDOFF,
    STATUS_CHANGED,
    PRIORITY_ESCALATED,

    /**
     * An owner asked for a handoff; the claim itself is unchanged.
     */
    HANDOFF_REQUESTED,

    /**
     * A pending handoff was withdrawn or invalidated.
     */
    HANDOFF_CANCELLED
}
