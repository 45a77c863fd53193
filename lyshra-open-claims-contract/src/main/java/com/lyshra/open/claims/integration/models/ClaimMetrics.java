package com.lyshra.open.claims.integration.models;

/**
 * Point-in-time counters of committed claim operations since the service started.
 */
public record ClaimMetrics(
        long totalCreated,
        long totalClaimed,
        long totalCompleted,
        long totalReleased,
        long totalAbandoned,
        long totalExpired,
        long totalRequeued,
        long totalStolen,
        long totalHandoffs,
        long totalConflicts
) {

    public static ClaimMetrics empty() {
        return new ClaimMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
