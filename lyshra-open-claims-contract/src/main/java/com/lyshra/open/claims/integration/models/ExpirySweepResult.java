package com.lyshra.open.claims.integration.models;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one expiry pass over stale claims.
 *
 * @param sweptAt    reference instant used for staleness
 * @param requeued   ids of claims returned to available
 * @param expired    ids of claims moved to the expired status
 * @param skipped    ids of claims left alone because they changed concurrently or recovered
 * @param failed     ids of claims whose expiry failed for another reason
 */
public record ExpirySweepResult(
        Instant sweptAt,
        List<String> requeued,
        List<String> expired,
        List<String> skipped,
        List<String> failed
) {

    public ExpirySweepResult {
        requeued = List.copyOf(requeued);
        expired = List.copyOf(expired);
        skipped = List.copyOf(skipped);
        failed = List.copyOf(failed);
    }

    public static ExpirySweepResult empty(Instant sweptAt) {
        return new ExpirySweepResult(sweptAt, List.of(), List.of(), List.of(), List.of());
    }

    public int processedCount() {
        return requeued.size() + expired.size();
    }

    public boolean isEmpty() {
        return processedCount() == 0 && skipped.isEmpty() && failed.isEmpty();
    }
}
