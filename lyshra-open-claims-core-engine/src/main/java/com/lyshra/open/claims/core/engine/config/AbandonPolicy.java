package com.lyshra.open.claims.core.engine.config;

/**
 * Whether abandoning a claim puts the work back into the pool.
 */
public enum AbandonPolicy {

    /**
     * The abandoned claim stays terminal and nothing else happens.
     */
    LEAVE_TERMINAL,

    /**
     * A fresh available claim with the same content is created, linked through
     * the {@code requeuedFrom} metadata key.
     */
    REQUEUE
}
