package com.lyshra.open.claims.core.engine.stealing;

import com.lyshra.open.claims.core.engine.config.WorkStealingConfig;
import com.lyshra.open.claims.integration.contract.IActivityTracker;
import com.lyshra.open.claims.integration.contract.IClaimService;
import com.lyshra.open.claims.integration.contract.IClaimStore;
import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.exception.ClaimConflictException;
import com.lyshra.open.claims.integration.exception.ClaimStealLimitExceededException;
import com.lyshra.open.claims.integration.exception.InvalidClaimTransitionException;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.IdleClaimant;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Reassigns stale claims to idle claimants.
 *
 * Cycle Algorithm:
 * 1. Collect idle claimants from the activity tracker (no claims, inactive for the idle threshold)
 * 2. Collect stale claims from the store, keeping those inactive for at least the stale threshold
 * 3. Order stale claims by priority, then by how long they are overdue, then oldest first
 * 4. Give each idle claimant, longest idle first, the first unmatched claim in its own domain;
 *    with cross-domain enabled, fall back to the first unmatched claim of any domain
 * 5. Steal the matched claims one at a time until the per-cycle limit or the deadline is reached
 *
 * A claimant never steals its own claim. Each claimant receives at most one claim
 * and each claim goes to at most one claimant per cycle. A steal that loses a race
 * or finds the claim recovered is counted as a conflict and skipped; no single
 * failure aborts the cycle.
 *
 * Thread Safety: This class is thread-safe. Cycles never overlap.
 */
@Slf4j
public class WorkStealingCoordinator {

    public static final String STEAL_REASON = "stale";

    private final IClaimService claimService;
    private final IClaimStore claimStore;
    private final IActivityTracker activityTracker;
    private final WorkStealingConfig config;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cycleInFlight = new AtomicBoolean(false);

    private final AtomicLong cycles = new AtomicLong(0);
    private final AtomicLong steals = new AtomicLong(0);
    private final AtomicLong conflicts = new AtomicLong(0);
    private final AtomicLong failures = new AtomicLong(0);
    private final AtomicLong skippedCycles = new AtomicLong(0);
    private final AtomicLong failedCycles = new AtomicLong(0);
    private final AtomicReference<Instant> lastCycleAt = new AtomicReference<>();

    private volatile Disposable cycleTask;

    /**
     * A planned reassignment, not yet committed.
     */
    record Assignment(Claim claim, IdleClaimant claimant) {
    }

    public WorkStealingCoordinator(IClaimService claimService,
                                   IClaimStore claimStore,
                                   IActivityTracker activityTracker,
                                   WorkStealingConfig config,
                                   Clock clock) {
        this.claimService = Objects.requireNonNull(claimService, "claimService must not be null");
        this.claimStore = Objects.requireNonNull(claimStore, "claimStore must not be null");
        this.activityTracker = Objects.requireNonNull(activityTracker, "activityTracker must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ========== Lifecycle ==========

    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            if (!config.isEnabled()) {
                log.info("Work stealing is disabled, not starting");
                return;
            }
            if (!running.compareAndSet(false, true)) {
                log.warn("Work stealing coordinator already running");
                return;
            }
            log.info("Starting work stealing coordinator: interval={}, idleThreshold={}, crossDomain={}, maxStealsPerCycle={}",
                    config.getCheckInterval(), config.getIdleThreshold(), config.isAllowCrossDomain(),
                    config.getMaxStealsPerCycle());
            cycleTask = Flux.interval(config.getCheckInterval(), Schedulers.parallel())
                    .onBackpressureDrop(tick -> {
                        skippedCycles.incrementAndGet();
                        log.debug("Dropping work stealing tick {}: previous cycle still running", tick);
                    })
                    .concatMap(tick -> runCycle()
                            .onErrorResume(error -> {
                                failedCycles.incrementAndGet();
                                log.error("Error during work stealing cycle", error);
                                return Mono.empty();
                            }), 1)
                    .subscribe(result -> {
                        if (result.stealCount() > 0) {
                            log.info("Work stealing cycle completed: {} steals, {} conflicts, {} failures",
                                    result.stealCount(), result.conflicts(), result.failures());
                        }
                    });
        });
    }

    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            log.info("Stopping work stealing coordinator");
            if (cycleTask != null) {
                cycleTask.dispose();
                cycleTask = null;
            }
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========== Cycle ==========

    /**
     * Runs one cycle now. If a cycle is already in flight, returns a skipped result.
     */
    public Mono<StealCycleResult> runCycle() {
        return Mono.defer(() -> {
            Instant now = clock.instant();
            if (!cycleInFlight.compareAndSet(false, true)) {
                skippedCycles.incrementAndGet();
                log.debug("Work stealing cycle already in flight, skipping");
                return Mono.just(StealCycleResult.skipped(now));
            }
            return Mono.zip(
                            activityTracker.getIdleClaimants(config.getIdleThreshold()).collectList(),
                            claimStore.findStale(now)
                                    .filter(claim -> claim.getInactivity(now).compareTo(config.getStaleThreshold()) >= 0)
                                    .collectList())
                    .flatMap(candidates -> execute(now, candidates.getT1(), candidates.getT2()))
                    .doOnNext(result -> {
                        cycles.incrementAndGet();
                        lastCycleAt.set(now);
                    })
                    .doFinally(signal -> cycleInFlight.set(false));
        });
    }

    private Mono<StealCycleResult> execute(Instant now, List<IdleClaimant> idle, List<Claim> stale) {
        List<Assignment> plan = plan(now, idle, stale);
        if (plan.isEmpty()) {
            log.debug("Work stealing cycle: nothing to do (idle={}, stale={})", idle.size(), stale.size());
            return Mono.just(new StealCycleResult(now, idle.size(), stale.size(), List.of(), 0, 0, false, false));
        }

        long deadlineNanos = System.nanoTime() + config.getCycleDeadline().toNanos();
        List<StealCycleResult.Steal> committed = new ArrayList<>();
        AtomicInteger cycleConflicts = new AtomicInteger();
        AtomicInteger cycleFailures = new AtomicInteger();
        AtomicBoolean deadlineReached = new AtomicBoolean(false);

        return Flux.fromIterable(plan)
                .concatMap(assignment -> {
                    if (committed.size() >= config.getMaxStealsPerCycle()) {
                        return Mono.empty();
                    }
                    if (System.nanoTime() - deadlineNanos > 0) {
                        if (deadlineReached.compareAndSet(false, true)) {
                            log.warn("Work stealing cycle deadline {} reached, deferring remaining candidates",
                                    config.getCycleDeadline());
                        }
                        return Mono.empty();
                    }
                    return steal(assignment, committed, cycleConflicts, cycleFailures);
                })
                .then(Mono.fromCallable(() -> new StealCycleResult(now, idle.size(), stale.size(), committed,
                        cycleConflicts.get(), cycleFailures.get(), deadlineReached.get(), false)));
    }

    private Mono<Claim> steal(Assignment assignment,
                              List<StealCycleResult.Steal> committed,
                              AtomicInteger cycleConflicts,
                              AtomicInteger cycleFailures) {
        Claim claim = assignment.claim();
        String toClaimantId = assignment.claimant().claimantId();
        return claimService.steal(claim.getId(), assignment.claimant().claimant(), STEAL_REASON)
                .doOnNext(stolen -> {
                    committed.add(new StealCycleResult.Steal(claim.getId(), claim.getClaimantId(), toClaimantId));
                    steals.incrementAndGet();
                    log.debug("Stole claim {} from {} for {}", claim.getId(), claim.getClaimantId(), toClaimantId);
                })
                .onErrorResume(error -> {
                    if (isBenign(error)) {
                        cycleConflicts.incrementAndGet();
                        conflicts.incrementAndGet();
                        log.warn("Skipping steal of claim {} for {}: {}", claim.getId(), toClaimantId, error.getMessage());
                    } else {
                        cycleFailures.incrementAndGet();
                        failures.incrementAndGet();
                        log.warn("Steal of claim {} for {} failed", claim.getId(), toClaimantId, error);
                    }
                    return Mono.empty();
                });
    }

    /**
     * A lost race or a claim that is no longer stale is expected during a cycle.
     */
    private static boolean isBenign(Throwable error) {
        return error instanceof ClaimConflictException
                || (error instanceof InvalidClaimTransitionException
                && !(error instanceof ClaimStealLimitExceededException));
    }

    /**
     * Matches idle claimants with stale claims. Pure; nothing is committed.
     */
    List<Assignment> plan(Instant now, List<IdleClaimant> idle, List<Claim> stale) {
        List<Claim> ordered = new ArrayList<>(stale);
        ordered.sort(stealOrder(now));

        Set<String> matched = new HashSet<>();
        List<Assignment> plan = new ArrayList<>();
        for (IdleClaimant candidate : idle) {
            Optional<Claim> pick = ordered.stream()
                    .filter(claim -> !matched.contains(claim.getId()))
                    .filter(claim -> !claim.isOwnedBy(candidate.claimantId()))
                    .filter(claim -> candidate.claimant().isInDomain(claim.getDomain()))
                    .findFirst();
            if (pick.isEmpty() && config.isAllowCrossDomain()) {
                pick = ordered.stream()
                        .filter(claim -> !matched.contains(claim.getId()))
                        .filter(claim -> !claim.isOwnedBy(candidate.claimantId()))
                        .findFirst();
            }
            pick.ifPresent(claim -> {
                matched.add(claim.getId());
                plan.add(new Assignment(claim, candidate));
            });
        }
        return plan;
    }

    static Comparator<Claim> stealOrder(Instant now) {
        return Comparator.comparing(Claim::getPriority, ClaimPriority.HIGHEST_FIRST)
                .thenComparing((Claim claim) -> overdue(claim, now), Comparator.reverseOrder())
                .thenComparing(Claim::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparing(Claim::getId);
    }

    private static Duration overdue(Claim claim, Instant now) {
        return claim.getInactivity(now).minus(claim.getTtl() != null ? claim.getTtl() : Duration.ZERO);
    }

    // ========== Metrics ==========

    public WorkStealingMetrics getMetrics() {
        return new WorkStealingMetrics(
                cycles.get(),
                steals.get(),
                conflicts.get(),
                failures.get(),
                skippedCycles.get(),
                failedCycles.get(),
                lastCycleAt.get());
    }
}
