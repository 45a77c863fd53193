package com.lyshra.open.claims.core.engine.claim.impl;

import com.lyshra.open.claims.core.engine.claim.ClaimTransition;
import com.lyshra.open.claims.core.engine.config.AbandonPolicy;
import com.lyshra.open.claims.core.engine.config.ClaimsConfig;
import com.lyshra.open.claims.core.engine.config.ExpiryAction;
import com.lyshra.open.claims.integration.contract.IActivityTracker;
import com.lyshra.open.claims.integration.contract.IClaimEventPublisher;
import com.lyshra.open.claims.integration.contract.IClaimService;
import com.lyshra.open.claims.integration.contract.IClaimStore;
import com.lyshra.open.claims.integration.enumerations.ClaimEventType;
import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import com.lyshra.open.claims.integration.enumerations.ClaimType;
import com.lyshra.open.claims.integration.exception.ClaimAlreadyClaimedException;
import com.lyshra.open.claims.integration.exception.ClaimConflictException;
import com.lyshra.open.claims.integration.exception.ClaimNotOwnerException;
import com.lyshra.open.claims.integration.exception.ClaimOperationException;
import com.lyshra.open.claims.integration.exception.ClaimStealLimitExceededException;
import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import com.lyshra.open.claims.integration.exception.InvalidClaimTransitionException;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.ClaimEvent;
import com.lyshra.open.claims.integration.models.ClaimFilter;
import com.lyshra.open.claims.integration.models.ClaimHistoryEntry;
import com.lyshra.open.claims.integration.models.ClaimMetrics;
import com.lyshra.open.claims.integration.models.ClaimResult;
import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.CreateClaimRequest;
import com.lyshra.open.claims.integration.models.ExpirySweepResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.UnaryOperator;

/**
 * Default claim service.
 *
 * <p>Each mutating operation reads the claim, then issues exactly one compare-and-set
 * update against the store. Preconditions are evaluated inside the update function
 * against the version being replaced, so a check and its write can never be separated
 * by a concurrent commit. Events are published and the activity tracker is informed
 * only after the store has committed.</p>
 *
 * <h2>Precondition order for owner operations</h2>
 * <ol>
 *   <li>Terminal claim: {@link InvalidClaimTransitionException}</li>
 *   <li>Caller is not the owner: {@link ClaimNotOwnerException}</li>
 *   <li>Operation not allowed from the current status: {@link InvalidClaimTransitionException}</li>
 * </ol>
 */
@Slf4j
public class ClaimServiceImpl implements IClaimService {

    public static final String SYSTEM_ACTOR = "system";
    public static final String EXPIRY_ACTOR = "system:expiry";
    public static final String PRODUCER_ACTOR = "producer";
    public static final String REQUEUED_FROM_KEY = "requeuedFrom";

    private final IClaimStore store;
    private final IActivityTracker activityTracker;
    private final IClaimEventPublisher eventPublisher;
    private final ClaimsConfig config;
    private final Clock clock;

    private final ClaimMetricsRecorder metrics = new ClaimMetricsRecorder();

    /**
     * Pair of the snapshot an update was based on and the committed result.
     */
    private record Commit(Claim before, Claim after) {
    }

    public ClaimServiceImpl(IClaimStore store,
                            IActivityTracker activityTracker,
                            IClaimEventPublisher eventPublisher,
                            ClaimsConfig config,
                            Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.activityTracker = Objects.requireNonNull(activityTracker, "activityTracker must not be null");
        this.eventPublisher = Objects.requireNonNull(eventPublisher, "eventPublisher must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ========================================================================
    // PRODUCER OPERATIONS
    // ========================================================================

    @Override
    public Mono<Claim> createClaim(CreateClaimRequest request) {
        return store.create(request)
                .doOnNext(claim -> {
                    metrics.created.incrementAndGet();
                    log.info("Created claim: {} ({}, {}, domain: {}) '{}'", claim.getId(),
                            claim.getType().getCode(), claim.getPriority().getCode(), claim.getDomain(), claim.getTitle());
                    eventPublisher.publish(ClaimEvent.created(claim, PRODUCER_ACTOR, claim.getCreatedAt()));
                });
    }

    @Override
    public Mono<Claim> createClaim(ClaimType type,
                                   ClaimPriority priority,
                                   String domain,
                                   String title,
                                   Map<String, String> metadata) {
        return Mono.fromCallable(() -> CreateClaimRequest.of(type, priority, domain, title, metadata))
                .flatMap(this::createClaim);
    }

    // ========================================================================
    // CLAIMANT OPERATIONS
    // ========================================================================

    @Override
    public Mono<Claim> claim(String claimId, Claimant claimant) {
        return claim(claimId, claimant, null);
    }

    @Override
    public Mono<Claim> claim(String claimId, Claimant claimant, Duration ttlOverride) {
        return Mono.defer(() -> {
            if (claimant == null) {
                return Mono.error(ClaimValidationException.missingField("claimant"));
            }
            if (ttlOverride != null && (ttlOverride.isNegative() || ttlOverride.isZero())) {
                return Mono.error(new ClaimValidationException("ttl must be positive"));
            }
            Duration ttl = ttlOverride != null ? ttlOverride : config.ttlFor(claimant.getKind());

            return commit(claimId, current -> {
                if (!ClaimTransition.CLAIM.isAllowedFrom(current.getStatus())) {
                    throw new ClaimAlreadyClaimedException(current);
                }
                Instant now = clock.instant();
                return current.toBuilder()
                        .status(ClaimStatus.CLAIMED)
                        .claimant(claimant)
                        .claimedAt(now)
                        .lastActivityAt(now)
                        .ttl(ttl)
                        .updatedAt(now)
                        .history(current.historyWith(
                                ClaimHistoryEntry.of(current.getStatus(), ClaimStatus.CLAIMED, claimant.getId(), "claimed", now)))
                        .build();
            })
                    .onErrorMap(ClaimConflictException.class, this::toAlreadyClaimed)
                    .doOnNext(commit -> {
                        activityTracker.recordActivity(claimant);
                        activityTracker.onClaimAcquired(claimant.getId(), claimId);
                        metrics.claimed.incrementAndGet();
                        log.info("Claim {} claimed by {} ({}), ttl={}",
                                claimId, claimant.getId(), claimant.getKind(), ttl);
                        publish(ClaimEventType.CLAIMED, commit, claimant.getId(), null);
                    })
                    .map(Commit::after);
        });
    }

    /**
     * A claim race lost to a concurrent change that left the claim unavailable is reported
     * as already claimed, not as a bare version conflict.
     */
    private Throwable toAlreadyClaimed(ClaimConflictException conflict) {
        return conflict.getSnapshot()
                .filter(current -> !current.isAvailable())
                .<Throwable>map(ClaimAlreadyClaimedException::new)
                .orElse(conflict);
    }

    @Override
    public Mono<Claim> touch(String claimId, String claimantId) {
        return commit(claimId, current -> {
            requireOwner(current, claimantId, ClaimTransition.TOUCH);
            Instant now = latest(clock.instant(), current.getLastActivityAt());
            return current.toBuilder()
                    .lastActivityAt(now)
                    .updatedAt(now)
                    .build();
        })
                .doOnNext(commit -> {
                    activityTracker.recordActivity(claimantId);
                    log.debug("Claim {} touched by {}", claimId, claimantId);
                })
                .map(Commit::after);
    }

    @Override
    public Mono<Claim> startWork(String claimId, String claimantId) {
        return ownerTransition(claimId, claimantId, ClaimTransition.START_WORK, null, ClaimEventType.STATUS_CHANGED,
                UnaryOperator.identity());
    }

    @Override
    public Mono<Claim> block(String claimId, String claimantId, String reason) {
        return ownerTransition(claimId, claimantId, ClaimTransition.BLOCK, reason, ClaimEventType.STATUS_CHANGED,
                UnaryOperator.identity());
    }

    @Override
    public Mono<Claim> unblock(String claimId, String claimantId) {
        return ownerTransition(claimId, claimantId, ClaimTransition.UNBLOCK, null, ClaimEventType.STATUS_CHANGED,
                UnaryOperator.identity());
    }

    @Override
    public Mono<Claim> complete(String claimId, String claimantId, ClaimResult result) {
        return ownerTransition(claimId, claimantId, ClaimTransition.COMPLETE,
                result != null ? result.getSummary() : null, ClaimEventType.COMPLETED,
                claim -> claim.toBuilder().result(result).build())
                .doOnNext(claim -> {
                    activityTracker.onClaimReleased(claimantId, claimId);
                    metrics.completed.incrementAndGet();
                });
    }

    @Override
    public Mono<Claim> release(String claimId, String claimantId, String reason) {
        return ownerTransition(claimId, claimantId, ClaimTransition.RELEASE, reason, ClaimEventType.RELEASED,
                claim -> claim.toBuilder()
                        .claimant(null)
                        .claimedAt(null)
                        .ttl(null)
                        .build())
                .doOnNext(claim -> {
                    activityTracker.onClaimReleased(claimantId, claimId);
                    metrics.released.incrementAndGet();
                });
    }

    @Override
    public Mono<Claim> abandon(String claimId, String claimantId, String reason) {
        return ownerTransition(claimId, claimantId, ClaimTransition.ABANDON, reason, ClaimEventType.ABANDONED,
                UnaryOperator.identity())
                .doOnNext(claim -> {
                    activityTracker.onClaimReleased(claimantId, claimId);
                    metrics.abandoned.incrementAndGet();
                })
                .flatMap(abandoned -> config.getAbandonPolicy() == AbandonPolicy.REQUEUE
                        ? requeue(abandoned).thenReturn(abandoned)
                        : Mono.just(abandoned));
    }

    private Mono<Claim> requeue(Claim abandoned) {
        Map<String, String> metadata = new LinkedHashMap<>(abandoned.getMetadata());
        metadata.put(REQUEUED_FROM_KEY, abandoned.getId());
        CreateClaimRequest request = CreateClaimRequest.builder()
                .type(abandoned.getType())
                .priority(abandoned.getPriority())
                .domain(abandoned.getDomain())
                .title(abandoned.getTitle())
                .description(abandoned.getDescription())
                .tags(abandoned.getTags())
                .metadata(metadata)
                .correlationId(abandoned.getCorrelationId() != null ? abandoned.getCorrelationId() : abandoned.getId())
                .build();
        return createClaim(request)
                .doOnNext(fresh -> {
                    metrics.requeued.incrementAndGet();
                    log.info("Requeued abandoned claim {} as {}", abandoned.getId(), fresh.getId());
                });
    }

    @Override
    public Mono<Claim> escalatePriority(String claimId, ClaimPriority newPriority) {
        if (newPriority == null) {
            return Mono.error(ClaimValidationException.missingField("priority"));
        }
        return escalate(claimId, current -> {
            if (!newPriority.isHigherThan(current.getPriority())) {
                throw new ClaimValidationException(String.format("priority %s is not higher than %s",
                        newPriority.getCode(), current.getPriority().getCode()));
            }
            return newPriority;
        });
    }

    @Override
    public Mono<Claim> escalatePriority(String claimId) {
        return escalate(claimId, current -> current.getPriority().escalate());
    }

    private Mono<Claim> escalate(String claimId, Function<Claim, ClaimPriority> nextPriority) {
        return commit(claimId, current -> {
            if (current.isTerminal()) {
                throw new InvalidClaimTransitionException("escalatePriority", current);
            }
            ClaimPriority priority = nextPriority.apply(current);
            return current.toBuilder()
                    .priority(priority)
                    .updatedAt(clock.instant())
                    .build();
        })
                .doOnNext(commit -> {
                    log.info("Claim {} priority escalated {} -> {}", claimId,
                            commit.before().getPriority().getCode(), commit.after().getPriority().getCode());
                    eventPublisher.publish(ClaimEvent.priorityEscalated(
                            commit.before(), commit.after(), SYSTEM_ACTOR, commit.after().getUpdatedAt()));
                })
                .map(Commit::after);
    }

    // ========================================================================
    // SYSTEM OPERATIONS
    // ========================================================================

    @Override
    public Mono<ExpirySweepResult> expireStale(Instant now) {
        return sweep(now, null);
    }

    @Override
    public Mono<ExpirySweepResult> expireStale(Instant now, Duration deadline) {
        return sweep(now, deadline);
    }

    private Mono<ExpirySweepResult> sweep(Instant now, Duration deadline) {
        return Mono.defer(() -> {
            long deadlineNanos = deadline != null ? System.nanoTime() + deadline.toNanos() : 0L;
            List<String> requeued = new ArrayList<>();
            List<String> expired = new ArrayList<>();
            List<String> skipped = new ArrayList<>();
            List<String> failed = new ArrayList<>();

            return store.findStale(now)
                    .concatMap(stale -> {
                        if (deadline != null && System.nanoTime() - deadlineNanos > 0) {
                            log.debug("Expiry deadline reached, leaving claim {} for the next sweep", stale.getId());
                            return Mono.empty();
                        }
                        return expireOne(stale, now)
                                .doOnNext(claim -> (claim.isAvailable() ? requeued : expired).add(claim.getId()))
                                .onErrorResume(error -> {
                                    if (error instanceof ClaimConflictException
                                            || error instanceof InvalidClaimTransitionException) {
                                        log.warn("Skipping expiry of claim {}: {}", stale.getId(), error.getMessage());
                                        skipped.add(stale.getId());
                                    } else {
                                        log.error("Expiry of claim {} failed", stale.getId(), error);
                                        failed.add(stale.getId());
                                    }
                                    return Mono.empty();
                                });
                    })
                    .then(Mono.fromCallable(() -> new ExpirySweepResult(now, requeued, expired, skipped, failed)))
                    .doOnNext(result -> {
                        if (!result.isEmpty()) {
                            log.info("Expiry sweep: requeued={}, expired={}, skipped={}, failed={}",
                                    result.requeued().size(), result.expired().size(),
                                    result.skipped().size(), result.failed().size());
                        }
                    });
        });
    }

    private Mono<Claim> expireOne(Claim stale, Instant now) {
        return store.update(stale.getId(), stale.getVersion(), current -> {
            if (!ClaimTransition.EXPIRE.isAllowedFrom(current.getStatus()) || !current.isStale(now)) {
                throw new InvalidClaimTransitionException(ClaimTransition.EXPIRE.getOperation(), current);
            }
            ExpiryAction action = config.expiryActionFor(current.getClaimant().getKind());
            ClaimStatus target = action.getTargetStatus();
            Instant at = clock.instant();
            ClaimHistoryEntry entry = ClaimHistoryEntry.of(current.getStatus(), target, EXPIRY_ACTOR,
                            "lease expired after " + current.getTtl(), at)
                    .toBuilder()
                    .previousClaimantId(current.getClaimantId())
                    .build();
            Claim.ClaimBuilder next = current.toBuilder()
                    .status(target)
                    .updatedAt(at)
                    .history(current.historyWith(entry));
            if (action == ExpiryAction.REQUEUE) {
                next.claimant(null).claimedAt(null).ttl(null);
            }
            return next.build();
        })
                .doOnError(ClaimConflictException.class, e -> metrics.conflicts.incrementAndGet())
                .doOnNext(expired -> {
                    activityTracker.onClaimReleased(stale.getClaimantId(), stale.getId());
                    metrics.expired.incrementAndGet();
                    if (expired.isAvailable()) {
                        metrics.requeued.incrementAndGet();
                    }
                    log.info("Claim {} of {} expired -> {}", stale.getId(), stale.getClaimantId(),
                            expired.getStatus().getCode());
                    publish(ClaimEventType.EXPIRED, new Commit(stale, expired), EXPIRY_ACTOR, "lease expired");
                });
    }

    @Override
    public Mono<Claim> steal(String claimId, Claimant newClaimant, String reason) {
        if (newClaimant == null) {
            return Mono.error(ClaimValidationException.missingField("claimant"));
        }
        return commit(claimId, current -> {
            if (!ClaimTransition.STEAL.isAllowedFrom(current.getStatus())) {
                throw new InvalidClaimTransitionException(ClaimTransition.STEAL.getOperation(), current);
            }
            Instant now = clock.instant();
            if (!current.isStale(now)) {
                throw InvalidClaimTransitionException.notStale(current);
            }
            if (current.isOwnedBy(newClaimant.getId())) {
                throw new ClaimValidationException(newClaimant.getId() + " already owns claim " + current.getId());
            }
            if (config.isStealLimited() && current.getStealCount() >= config.getMaxStealCount()) {
                throw new ClaimStealLimitExceededException(current, config.getMaxStealCount());
            }
            String previousOwner = current.getClaimantId();
            ClaimHistoryEntry entry = ClaimHistoryEntry.of(current.getStatus(), ClaimStatus.CLAIMED,
                            newClaimant.getId(), reason, now)
                    .toBuilder()
                    .previousClaimantId(previousOwner)
                    .build();
            return current.toBuilder()
                    .status(ClaimStatus.CLAIMED)
                    .claimant(newClaimant)
                    .claimedAt(now)
                    .lastActivityAt(latest(now, current.getLastActivityAt()))
                    .ttl(config.ttlFor(newClaimant.getKind()))
                    .updatedAt(now)
                    .stealCount(current.getStealCount() + 1)
                    .previousClaimantIds(current.previousClaimantsWith(previousOwner))
                    .history(current.historyWith(entry))
                    .build();
        })
                .doOnNext(commit -> {
                    String previousOwner = commit.before().getClaimantId();
                    activityTracker.onClaimReleased(previousOwner, claimId);
                    activityTracker.onClaimAcquired(newClaimant, claimId);
                    metrics.stolen.incrementAndGet();
                    log.info("Claim {} stolen from {} by {} (steal #{}): {}", claimId, previousOwner,
                            newClaimant.getId(), commit.after().getStealCount(), reason);
                    publish(ClaimEventType.STOLEN, commit, newClaimant.getId(), reason);
                })
                .map(Commit::after);
    }

    @Override
    public Mono<Claim> handoff(String claimId, String fromClaimantId, Claimant toClaimant, String note, String handoffId) {
        if (toClaimant == null) {
            return Mono.error(ClaimValidationException.missingField("toClaimant"));
        }
        return commit(claimId, current -> {
            requireOwner(current, fromClaimantId, ClaimTransition.HANDOFF);
            if (toClaimant.getId().equals(fromClaimantId)) {
                throw new ClaimValidationException("cannot hand off claim " + claimId + " to its current owner");
            }
            Instant now = clock.instant();
            ClaimHistoryEntry entry = ClaimHistoryEntry.of(current.getStatus(), current.getStatus(),
                            toClaimant.getId(), note != null ? "handoff: " + note : "handoff", now)
                    .toBuilder()
                    .previousClaimantId(fromClaimantId)
                    .build();
            return current.toBuilder()
                    .claimant(toClaimant)
                    .claimedAt(now)
                    .lastActivityAt(latest(now, current.getLastActivityAt()))
                    .ttl(config.ttlFor(toClaimant.getKind()))
                    .updatedAt(now)
                    .previousClaimantIds(current.previousClaimantsWith(fromClaimantId))
                    .history(current.historyWith(entry))
                    .build();
        })
                .doOnNext(commit -> {
                    activityTracker.onClaimReleased(fromClaimantId, claimId);
                    activityTracker.onClaimAcquired(toClaimant, claimId);
                    metrics.handoffs.incrementAndGet();
                    log.info("Claim {} handed off from {} to {} ({})", claimId, fromClaimantId,
                            toClaimant.getId(), toClaimant.getKind());
                    eventPublisher.publish(ClaimEvent.handoff(commit.before(), commit.after(), toClaimant.getId(),
                            note, handoffId, commit.after().getUpdatedAt()));
                })
                .map(Commit::after);
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Override
    public Mono<Claim> getClaim(String claimId) {
        return store.get(claimId);
    }

    @Override
    public Flux<Claim> findClaims(ClaimFilter filter) {
        return store.list(filter);
    }

    @Override
    public Flux<Claim> getAvailableForClaimant(Claimant claimant) {
        if (claimant == null) {
            return Flux.error(ClaimValidationException.missingField("claimant"));
        }
        ClaimFilter.ClaimFilterBuilder filter = ClaimFilter.builder().status(ClaimStatus.AVAILABLE);
        if (claimant.isAgent() && claimant.getDomain() != null) {
            filter.domain(claimant.getDomain());
        }
        return store.list(filter.build());
    }

    @Override
    public ClaimMetrics getMetrics() {
        return metrics.snapshot();
    }

    // ========================================================================
    // PRIVATE HELPERS
    // ========================================================================

    /**
     * Reads the claim and applies one compare-and-set update based on that read.
     */
    private Mono<Commit> commit(String claimId, UnaryOperator<Claim> mutation) {
        return store.get(claimId)
                .flatMap(before -> store.update(claimId, before.getVersion(), mutation)
                        .map(after -> new Commit(before, after)))
                .doOnError(ClaimConflictException.class, e -> {
                    metrics.conflicts.incrementAndGet();
                    log.warn("Concurrent modification of claim {}: {}", claimId, e.getMessage());
                })
                .doOnError(error -> error instanceof ClaimOperationException
                                && !(error instanceof ClaimConflictException),
                        e -> log.warn("Rejected operation on claim {}: {}", claimId, e.getMessage()));
    }

    /**
     * Status transition performed by the current owner, recorded in history and published.
     */
    private Mono<Claim> ownerTransition(String claimId,
                                        String claimantId,
                                        ClaimTransition transition,
                                        String reason,
                                        ClaimEventType eventType,
                                        UnaryOperator<Claim> extra) {
        ClaimStatus target = transition.getFixedTarget()
                .orElseThrow(() -> new IllegalArgumentException(transition + " has no fixed target"));
        return commit(claimId, current -> {
            requireOwner(current, claimantId, transition);
            Instant now = latest(clock.instant(), current.getLastActivityAt());
            Claim moved = current.toBuilder()
                    .status(target)
                    .lastActivityAt(now)
                    .updatedAt(now)
                    .history(current.historyWith(
                            ClaimHistoryEntry.of(current.getStatus(), target, claimantId, reason, now)))
                    .build();
            return extra.apply(moved);
        })
                .doOnNext(commit -> {
                    activityTracker.recordActivity(claimantId);
                    log.info("Claim {} {} by {}: {} -> {}", claimId, transition.getOperation(), claimantId,
                            commit.before().getStatus().getCode(), commit.after().getStatus().getCode());
                    publish(eventType, commit, claimantId, reason);
                })
                .map(Commit::after);
    }

    private static void requireOwner(Claim current, String claimantId, ClaimTransition transition) {
        if (current.isTerminal()) {
            throw new InvalidClaimTransitionException(transition.getOperation(), current);
        }
        if (!current.isOwnedBy(claimantId)) {
            throw new ClaimNotOwnerException(current, claimantId);
        }
        if (!transition.isAllowedFrom(current.getStatus())) {
            throw new InvalidClaimTransitionException(transition.getOperation(), current);
        }
    }

    private void publish(ClaimEventType type, Commit commit, String actor, String reason) {
        Instant at = commit.after().getUpdatedAt() != null ? commit.after().getUpdatedAt() : clock.instant();
        eventPublisher.publish(ClaimEvent.transition(type, commit.before(), commit.after(), actor, reason, at));
    }

    private static Instant latest(Instant candidate, Instant previous) {
        return previous != null && previous.isAfter(candidate) ? previous : candidate;
    }
}
