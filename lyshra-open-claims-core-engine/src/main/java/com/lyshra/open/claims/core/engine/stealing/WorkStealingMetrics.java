package com.lyshra.open.claims.core.engine.stealing;

import java.time.Instant;

/**
 * Cumulative work-stealing counters.
 */
public record WorkStealingMetrics(
        long cycles,
        long steals,
        long conflicts,
        long failures,
        long skippedCycles,
        long failedCycles,
        Instant lastCycleAt
) {
}
