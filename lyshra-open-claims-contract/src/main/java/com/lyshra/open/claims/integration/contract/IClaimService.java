package com.lyshra.open.claims.integration.contract;

import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.enumerations.ClaimType;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.ClaimFilter;
import com.lyshra.open.claims.integration.models.ClaimMetrics;
import com.lyshra.open.claims.integration.models.ClaimResult;
import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.CreateClaimRequest;
import com.lyshra.open.claims.integration.models.ExpirySweepResult;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Lifecycle operations on claims.
 *
 * <h2>Claim Lifecycle</h2>
 * <pre>
 * createClaim() ─→ AVAILABLE
 *                     │
 *                claim() ─→ CLAIMED ─ startWork() ─→ IN_PROGRESS ⇄ BLOCKED
 *                              │                        │              │
 *         ┌──────────┬─────────┴───────┬────────────────┴──────┬───────┘
 *    complete()   release()        abandon()           expireStale()
 *         │          │                 │                       │
 *         ▼          ▼                 ▼                       ▼
 *     COMPLETED   AVAILABLE        ABANDONED          EXPIRED | AVAILABLE
 *
 *    steal() (stale only) ─→ CLAIMED for a new claimant
 *    handoff()            ─→ same status for a new claimant
 * </pre>
 *
 * <p>Every mutating operation is exactly one compare-and-set against the claim store
 * followed by exactly one event. Nothing is retried internally: a caller that receives
 * {@code ClaimConflictException} must re-read and decide again.</p>
 */
public interface IClaimService {

    // ========== Producer Operations ==========

    Mono<Claim> createClaim(CreateClaimRequest request);

    Mono<Claim> createClaim(ClaimType type,
                            ClaimPriority priority,
                            String domain,
                            String title,
                            Map<String, String> metadata);

    // ========== Claimant Operations ==========

    /**
     * Takes ownership of an available claim with the claimant kind's default TTL.
     *
     * @return the claimed claim, or {@code ClaimAlreadyClaimedException} when the claim is not available
     */
    Mono<Claim> claim(String claimId, Claimant claimant);

    /**
     * Takes ownership of an available claim with an explicit TTL.
     */
    Mono<Claim> claim(String claimId, Claimant claimant, Duration ttlOverride);

    /**
     * Heartbeat. Refreshes {@code lastActivityAt} only; no history entry and no event.
     */
    Mono<Claim> touch(String claimId, String claimantId);

    Mono<Claim> startWork(String claimId, String claimantId);

    Mono<Claim> block(String claimId, String claimantId, String reason);

    Mono<Claim> unblock(String claimId, String claimantId);

    Mono<Claim> complete(String claimId, String claimantId, ClaimResult result);

    /**
     * Gives the claim back to the pool. The claim returns to available with no claimant.
     */
    Mono<Claim> release(String claimId, String claimantId, String reason);

    /**
     * Gives up on the work. Depending on the abandon policy a fresh available
     * copy is created; the returned claim is always the abandoned one.
     */
    Mono<Claim> abandon(String claimId, String claimantId, String reason);

    /**
     * Raises priority to {@code newPriority}, which must be strictly more urgent.
     */
    Mono<Claim> escalatePriority(String claimId, ClaimPriority newPriority);

    /**
     * Raises priority by one tier. Fails with {@code ClaimValidationException} at {@code p0}.
     */
    Mono<Claim> escalatePriority(String claimId);

    // ========== System Operations ==========

    /**
     * Applies the per-kind expiry action to every claim stale at {@code now}.
     */
    Mono<ExpirySweepResult> expireStale(Instant now);

    /**
     * Same as {@link #expireStale(Instant)}, stopping between claims once {@code deadline}
     * has elapsed. Claims not reached are left for the next sweep.
     */
    Mono<ExpirySweepResult> expireStale(Instant now, Duration deadline);

    /**
     * Reassigns a stale claim to {@code newClaimant}. Privileged; used by work stealing.
     */
    Mono<Claim> steal(String claimId, Claimant newClaimant, String reason);

    /**
     * Transfers an active claim from its owner to {@code toClaimant}, keeping its status.
     * Privileged; used by the handoff manager.
     */
    Mono<Claim> handoff(String claimId, String fromClaimantId, Claimant toClaimant, String note, String handoffId);

    // ========== Queries ==========

    Mono<Claim> getClaim(String claimId);

    Flux<Claim> findClaims(ClaimFilter filter);

    /**
     * Available claims the claimant may take, highest priority first.
     * Agents see their own domain; humans see every domain.
     */
    Flux<Claim> getAvailableForClaimant(Claimant claimant);

    ClaimMetrics getMetrics();
}
