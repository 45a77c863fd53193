package com.lyshra.open.claims.core.engine.claim.impl;

import com.lyshra.open.claims.integration.models.ClaimMetrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable counters behind {@link ClaimMetrics} snapshots.
 */
class ClaimMetricsRecorder {

    final AtomicLong created = new AtomicLong(0);
    final AtomicLong claimed = new AtomicLong(0);
    final AtomicLong completed = new AtomicLong(0);
    final AtomicLong released = new AtomicLong(0);
    final AtomicLong abandoned = new AtomicLong(0);
    final AtomicLong expired = new AtomicLong(0);
    final AtomicLong requeued = new AtomicLong(0);
    final AtomicLong stolen = new AtomicLong(0);
    final AtomicLong handoffs = new AtomicLong(0);
    final AtomicLong conflicts = new AtomicLong(0);

    ClaimMetrics snapshot() {
        return new ClaimMetrics(
                created.get(),
                claimed.get(),
                completed.get(),
                released.get(),
                abandoned.get(),
                expired.get(),
                requeued.get(),
                stolen.get(),
                handoffs.get(),
                conflicts.get());
    }
}
