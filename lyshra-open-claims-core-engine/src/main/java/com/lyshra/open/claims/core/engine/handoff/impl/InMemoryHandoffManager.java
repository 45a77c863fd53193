package com.lyshra.open.claims.core.engine.handoff.impl;

import com.lyshra.open.claims.integration.contract.IActivityTracker;
import com.lyshra.open.claims.integration.contract.IClaimEventListener;
import com.lyshra.open.claims.integration.contract.IClaimEventPublisher;
import com.lyshra.open.claims.integration.contract.IClaimService;
import com.lyshra.open.claims.integration.contract.IHandoffManager;
import com.lyshra.open.claims.integration.enumerations.ClaimEventType;
import com.lyshra.open.claims.integration.enumerations.ClaimantKind;
import com.lyshra.open.claims.integration.enumerations.HandoffStatus;
import com.lyshra.open.claims.integration.exception.ClaimNotOwnedByRequesterException;
import com.lyshra.open.claims.integration.exception.ClaimNotOwnerException;
import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import com.lyshra.open.claims.integration.exception.HandoffAlreadyResolvedException;
import com.lyshra.open.claims.integration.exception.HandoffNotFoundException;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.ClaimEvent;
import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.PendingHandoff;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of the handoff manager.
 *
 * <h2>Features</h2>
 * <ul>
 *   <li>Human review and agent assist requests by the current owner</li>
 *   <li>Acceptance by any claimant of the requested kind</li>
 *   <li>Automatic cancellation when the claim leaves the requester before acceptance</li>
 * </ul>
 *
 * <p>The manager subscribes itself to the claim event publisher to observe ownership
 * changes. Only one acceptance of a given handoff can be in flight at a time.</p>
 */
@Slf4j
public class InMemoryHandoffManager implements IHandoffManager, IClaimEventListener {

    private static final Comparator<PendingHandoff> OLDEST_FIRST =
            Comparator.comparing(PendingHandoff::getCreatedAt).thenComparing(PendingHandoff::getId);

    /**
     * Claim events after which the requester may no longer hold the claim.
     */
    private static final Set<ClaimEventType> OWNERSHIP_EVENTS = EnumSet.of(
            ClaimEventType.RELEASED,
            ClaimEventType.COMPLETED,
            ClaimEventType.ABANDONED,
            ClaimEventType.EXPIRED,
            ClaimEventType.STOLEN,
            ClaimEventType.HANDOFF);

    private final IClaimService claimService;
    private final IActivityTracker activityTracker;
    private final IClaimEventPublisher eventPublisher;
    private final Clock clock;

    private final Map<String, PendingHandoff> handoffs = new ConcurrentHashMap<>();
    private final Set<String> accepting = ConcurrentHashMap.newKeySet();

    public InMemoryHandoffManager(IClaimService claimService,
                                  IActivityTracker activityTracker,
                                  IClaimEventPublisher eventPublisher,
                                  Clock clock) {
        this.claimService = Objects.requireNonNull(claimService, "claimService must not be null");
        this.activityTracker = Objects.requireNonNull(activityTracker, "activityTracker must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        eventPublisher.addListener(this);
    }

    // ========================================================================
    // REQUESTS
    // ========================================================================

    @Override
    public Mono<PendingHandoff> requestHumanReview(String claimId, String requesterId, String note) {
        return request(claimId, requesterId, note, ClaimantKind.HUMAN);
    }

    @Override
    public Mono<PendingHandoff> requestAgentAssist(String claimId, String requesterId, String note) {
        return request(claimId, requesterId, note, ClaimantKind.AGENT);
    }

    private Mono<PendingHandoff> request(String claimId, String requesterId, String note, ClaimantKind targetKind) {
        return claimService.getClaim(claimId)
                .map(claim -> {
                    if (!claim.isOwnedBy(requesterId)) {
                        log.warn("Handoff request rejected: {} does not hold claim {}", requesterId, claimId);
                        throw new ClaimNotOwnedByRequesterException(claim, requesterId);
                    }
                    Instant now = clock.instant();
                    PendingHandoff handoff = PendingHandoff.builder()
                            .id("handoff-" + UUID.randomUUID())
                            .claimId(claimId)
                            .fromClaimantId(requesterId)
                            .requestedToKind(targetKind)
                            .note(note)
                            .status(HandoffStatus.PENDING)
                            .createdAt(now)
                            .build();
                    handoffs.put(handoff.getId(), handoff);
                    activityTracker.recordActivity(requesterId);
                    log.info("Handoff {} requested: claim {} from {} to {}", handoff.getId(), claimId,
                            requesterId, targetKind.getCode());
                    eventPublisher.publish(ClaimEvent.handoffRequested(handoff, claim, now));
                    return handoff;
                });
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Override
    public Flux<PendingHandoff> getPendingByTargetKind(ClaimantKind kind) {
        return Flux.defer(() -> Flux.fromIterable(handoffs.values().stream()
                .filter(PendingHandoff::isPending)
                .filter(handoff -> handoff.getRequestedToKind() == kind)
                .sorted(OLDEST_FIRST)
                .toList()));
    }

    @Override
    public Mono<PendingHandoff> getHandoff(String handoffId) {
        return Mono.defer(() -> {
            PendingHandoff handoff = handoffId != null ? handoffs.get(handoffId) : null;
            return handoff != null ? Mono.just(handoff) : Mono.error(new HandoffNotFoundException(handoffId));
        });
    }

    @Override
    public Flux<PendingHandoff> getHandoffsForClaim(String claimId) {
        return Flux.defer(() -> Flux.fromIterable(pendingOrResolvedFor(claimId)));
    }

    private List<PendingHandoff> pendingOrResolvedFor(String claimId) {
        return handoffs.values().stream()
                .filter(handoff -> handoff.getClaimId().equals(claimId))
                .sorted(OLDEST_FIRST)
                .toList();
    }

    // ========================================================================
    // RESOLUTION
    // ========================================================================

    @Override
    public Mono<Claim> completeHandoff(String handoffId, Claimant newClaimant) {
        return getHandoff(handoffId)
                .flatMap(handoff -> {
                    if (newClaimant == null) {
                        return Mono.error(ClaimValidationException.missingField("newClaimant"));
                    }
                    if (!handoff.isPending()) {
                        return Mono.error(new HandoffAlreadyResolvedException(handoff));
                    }
                    if (newClaimant.getKind() != handoff.getRequestedToKind()) {
                        return Mono.error(new ClaimValidationException(String.format(
                                "handoff %s requires a %s, got %s %s", handoffId,
                                handoff.getRequestedToKind().getCode(), newClaimant.getKind().getCode(),
                                newClaimant.getId())));
                    }
                    if (!accepting.add(handoffId)) {
                        return Mono.error(new HandoffAlreadyResolvedException(handoff, "being accepted"));
                    }
                    return accept(handoff, newClaimant)
                            .doFinally(signal -> accepting.remove(handoffId));
                });
    }

    private Mono<Claim> accept(PendingHandoff handoff, Claimant newClaimant) {
        return claimService.getClaim(handoff.getClaimId())
                .flatMap(claim -> {
                    if (!claim.isOwnedBy(handoff.getFromClaimantId())) {
                        return Mono.error(requesterLostClaim(handoff, claim));
                    }
                    return claimService.handoff(handoff.getClaimId(), handoff.getFromClaimantId(), newClaimant,
                                    handoff.getNote(), handoff.getId())
                            .onErrorMap(ClaimNotOwnerException.class, e -> requesterLostClaim(handoff,
                                    e.getSnapshot().orElse(claim)));
                })
                .doOnNext(claim -> {
                    Instant now = clock.instant();
                    handoffs.computeIfPresent(handoff.getId(), (id, current) -> current.complete(newClaimant.getId(), now));
                    activityTracker.recordActivity(newClaimant);
                    log.info("Handoff {} completed: claim {} now held by {}", handoff.getId(), claim.getId(),
                            newClaimant.getId());
                });
    }

    /**
     * Cancels the handoff because its requester no longer holds the claim.
     */
    private ClaimNotOwnedByRequesterException requesterLostClaim(PendingHandoff handoff, Claim claim) {
        cancelPending(handoff.getId(), "claim no longer held by requester", handoff.getFromClaimantId());
        return new ClaimNotOwnedByRequesterException(claim, handoff.getFromClaimantId());
    }

    @Override
    public Mono<PendingHandoff> cancelHandoff(String handoffId, String reason) {
        return getHandoff(handoffId)
                .flatMap(handoff -> {
                    if (!handoff.isPending()) {
                        return Mono.error(new HandoffAlreadyResolvedException(handoff));
                    }
                    if (accepting.contains(handoffId)) {
                        return Mono.error(new HandoffAlreadyResolvedException(handoff, "being accepted"));
                    }
                    PendingHandoff cancelled = cancelPending(handoffId, reason, handoff.getFromClaimantId());
                    return cancelled != null && cancelled.getStatus() == HandoffStatus.CANCELLED
                            ? Mono.just(cancelled)
                            : Mono.error(new HandoffAlreadyResolvedException(handoffs.get(handoffId)));
                });
    }

    /**
     * Moves a pending handoff to cancelled and publishes the cancellation.
     *
     * @return the handoff after the attempt; unchanged if it was no longer pending
     */
    private PendingHandoff cancelPending(String handoffId, String reason, String actor) {
        Instant now = clock.instant();
        boolean[] cancelled = {false};
        PendingHandoff result = handoffs.computeIfPresent(handoffId, (id, current) -> {
            if (!current.isPending()) {
                return current;
            }
            cancelled[0] = true;
            return current.cancel(reason, now);
        });
        if (cancelled[0]) {
            log.info("Handoff {} for claim {} cancelled: {}", handoffId, result.getClaimId(), reason);
            eventPublisher.publish(ClaimEvent.handoffCancelled(result, actor, now));
        }
        return result;
    }

    // ========================================================================
    // OWNERSHIP TRACKING
    // ========================================================================

    /**
     * Cancels pending handoffs whose requester has lost the claim.
     */
    @Override
    public void onEvent(ClaimEvent event) {
        if (!OWNERSHIP_EVENTS.contains(event.getType())) {
            return;
        }
        for (PendingHandoff handoff : pendingOrResolvedFor(event.getClaimId())) {
            if (!handoff.isPending() || handoff.getId().equals(event.getHandoffId())) {
                continue;
            }
            boolean stillHeld = event.getNewStatus() != null
                    && event.getNewStatus().isActive()
                    && handoff.getFromClaimantId().equals(event.getNewClaimantId());
            if (!stillHeld) {
                cancelPending(handoff.getId(), "claim " + event.getType().name().toLowerCase(),
                        event.getActor());
            }
        }
    }
}
