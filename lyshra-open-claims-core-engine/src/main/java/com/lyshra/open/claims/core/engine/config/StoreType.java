package com.lyshra.open.claims.core.engine.config;

/**
 * Supported claim store backends.
 */
public enum StoreType {
    /** In-memory storage (no persistence) */
    MEMORY,
    /** One serialized file per claim */
    FILE
}
