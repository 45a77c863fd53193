package com.lyshra.open.claims.core.engine.stealing;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one work-stealing cycle.
 *
 * @param startedAt          reference instant of the cycle
 * @param idleClaimantCount  idle claimants considered
 * @param staleClaimCount    stale claims considered
 * @param steals             committed reassignments, in execution order
 * @param conflicts          candidates skipped because the claim changed or recovered
 * @param failures           candidates skipped for any other reason
 * @param deadlineReached    true if the cycle stopped early at its deadline
 * @param skipped            true if the cycle did not run because another one was in flight
 */
public record StealCycleResult(
        Instant startedAt,
        int idleClaimantCount,
        int staleClaimCount,
        List<Steal> steals,
        int conflicts,
        int failures,
        boolean deadlineReached,
        boolean skipped
) {

    /**
     * One committed reassignment.
     */
    public record Steal(String claimId, String fromClaimantId, String toClaimantId) {
    }

    public StealCycleResult {
        steals = List.copyOf(steals);
    }

    public static StealCycleResult skipped(Instant at) {
        return new StealCycleResult(at, 0, 0, List.of(), 0, 0, false, true);
    }

    public int stealCount() {
        return steals.size();
    }
}
