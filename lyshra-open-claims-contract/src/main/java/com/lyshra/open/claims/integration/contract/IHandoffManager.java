package com.lyshra.open.claims.integration.contract;

import com.lyshra.open.claims.integration.enumerations.ClaimantKind;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.PendingHandoff;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Consensual ownership transfer between humans and agents.
 *
 * <pre>
 * requestHumanReview() / requestAgentAssist() ─→ PENDING
 *                                                   │
 *                       ┌───────────────────────────┤
 *               completeHandoff()             cancelHandoff()
 *                       │                  (or claim left the requester)
 *                       ▼                           ▼
 *                   COMPLETED                   CANCELLED
 * </pre>
 */
public interface IHandoffManager {

    /**
     * Asks for a human to take over the claim. The requester keeps the claim until accepted.
     */
    Mono<PendingHandoff> requestHumanReview(String claimId, String requesterId, String note);

    /**
     * Asks for an agent to take over the claim.
     */
    Mono<PendingHandoff> requestAgentAssist(String claimId, String requesterId, String note);

    /**
     * Pending handoffs addressed to the given kind, oldest first.
     */
    Flux<PendingHandoff> getPendingByTargetKind(ClaimantKind kind);

    Mono<PendingHandoff> getHandoff(String handoffId);

    Flux<PendingHandoff> getHandoffsForClaim(String claimId);

    /**
     * Accepts a pending handoff and transfers the claim to {@code newClaimant}.
     *
     * @return the claim after transfer
     */
    Mono<Claim> completeHandoff(String handoffId, Claimant newClaimant);

    Mono<PendingHandoff> cancelHandoff(String handoffId, String reason);
}
