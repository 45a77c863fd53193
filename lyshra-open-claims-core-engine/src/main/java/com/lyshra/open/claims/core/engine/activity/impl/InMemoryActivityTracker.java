package com.lyshra.open.claims.core.engine.activity.impl;

import com.lyshra.open.claims.integration.contract.IActivityTracker;
import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.IdleClaimant;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * In-memory activity tracker.
 *
 * Each known claimant has a registration holding its last activity time and the ids
 * of the claims it currently holds. Registrations are immutable and swapped with
 * {@link ConcurrentHashMap#compute}, so concurrent updates for one claimant never
 * lose an acquisition or a release.
 *
 * Thread Safety: This class is thread-safe.
 */
@Slf4j
public class InMemoryActivityTracker implements IActivityTracker {

    private static final Comparator<IdleClaimant> LONGEST_IDLE_FIRST =
            Comparator.comparing(IdleClaimant::idleFor).reversed()
                    .thenComparing(IdleClaimant::claimantId);

    private final Clock clock;
    private final ConcurrentHashMap<String, ClaimantRegistration> claimants = new ConcurrentHashMap<>();
    private final AtomicBoolean started = new AtomicBoolean(false);

    /**
     * Internal registration for tracking claimant state.
     */
    private static final class ClaimantRegistration {
        final Claimant claimant;
        final Instant lastActivityAt;
        final Set<String> activeClaimIds;

        ClaimantRegistration(Claimant claimant, Instant lastActivityAt, Set<String> activeClaimIds) {
            this.claimant = claimant;
            this.lastActivityAt = lastActivityAt;
            this.activeClaimIds = Set.copyOf(activeClaimIds);
        }

        ClaimantRegistration withActivity(Instant at) {
            Instant latest = at.isAfter(lastActivityAt) ? at : lastActivityAt;
            return new ClaimantRegistration(claimant, latest, activeClaimIds);
        }

        ClaimantRegistration withClaim(String claimId) {
            Set<String> ids = new HashSet<>(activeClaimIds);
            ids.add(claimId);
            return new ClaimantRegistration(claimant, lastActivityAt, ids);
        }

        ClaimantRegistration withoutClaim(String claimId) {
            Set<String> ids = new HashSet<>(activeClaimIds);
            ids.remove(claimId);
            return new ClaimantRegistration(claimant, lastActivityAt, ids);
        }
    }

    public InMemoryActivityTracker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ========================================================================
    // LIFECYCLE
    // ========================================================================

    @Override
    public void start() {
        if (started.compareAndSet(false, true)) {
            log.info("Activity tracker started");
        }
    }

    @Override
    public void reset() {
        int count = claimants.size();
        claimants.clear();
        log.info("Activity tracker reset, forgot {} claimants", count);
    }

    public boolean isStarted() {
        return started.get();
    }

    // ========================================================================
    // RECORDING
    // ========================================================================

    @Override
    public void registerClaimant(Claimant claimant) {
        recordActivity(claimant);
    }

    @Override
    public void recordActivity(Claimant claimant) {
        Objects.requireNonNull(claimant, "claimant must not be null");
        Instant now = clock.instant();
        claimants.compute(claimant.getId(), (id, existing) -> {
            if (existing == null) {
                log.debug("Registered claimant: {} (kind: {}, domain: {})",
                        id, claimant.getKind(), claimant.getDomain());
                return new ClaimantRegistration(claimant, now, Set.of());
            }
            return new ClaimantRegistration(claimant, existing.lastActivityAt, existing.activeClaimIds)
                    .withActivity(now);
        });
    }

    @Override
    public void recordActivity(String claimantId) {
        if (claimantId == null) {
            return;
        }
        Instant now = clock.instant();
        ClaimantRegistration updated = claimants.computeIfPresent(claimantId, (id, existing) -> existing.withActivity(now));
        if (updated == null) {
            log.debug("Ignoring activity of unknown claimant: {}", claimantId);
        }
    }

    @Override
    public void onClaimAcquired(String claimantId, String claimId) {
        ClaimantRegistration updated = claimants.computeIfPresent(claimantId, (id, existing) -> existing.withClaim(claimId));
        if (updated == null) {
            log.debug("Claim {} acquired by unknown claimant {}, not tracked", claimId, claimantId);
        }
    }

    @Override
    public void onClaimAcquired(Claimant claimant, String claimId) {
        Instant now = clock.instant();
        claimants.compute(claimant.getId(), (id, existing) -> existing != null
                ? existing.withClaim(claimId)
                : new ClaimantRegistration(claimant, now, Set.of(claimId)));
    }

    @Override
    public void onClaimReleased(String claimantId, String claimId) {
        if (claimantId == null) {
            return;
        }
        claimants.computeIfPresent(claimantId, (id, existing) -> existing.withoutClaim(claimId));
    }

    // ========================================================================
    // QUERIES
    // ========================================================================

    @Override
    public Flux<IdleClaimant> getIdleClaimants(Duration threshold) {
        return Flux.defer(() -> {
            Instant now = clock.instant();
            return Flux.fromIterable(claimants.values().stream()
                    .filter(registration -> registration.activeClaimIds.isEmpty())
                    .map(registration -> new IdleClaimant(registration.claimant, registration.lastActivityAt,
                            Duration.between(registration.lastActivityAt, now)))
                    .filter(idle -> idle.idleFor().compareTo(threshold) >= 0)
                    .sorted(LONGEST_IDLE_FIRST)
                    .toList());
        });
    }

    @Override
    public int getActiveClaimCount(String claimantId) {
        ClaimantRegistration registration = claimants.get(claimantId);
        return registration != null ? registration.activeClaimIds.size() : 0;
    }

    @Override
    public Optional<Instant> getLastActivity(String claimantId) {
        return Optional.ofNullable(claimants.get(claimantId)).map(registration -> registration.lastActivityAt);
    }

    public Optional<Claimant> getClaimant(String claimantId) {
        return Optional.ofNullable(claimants.get(claimantId)).map(registration -> registration.claimant);
    }

    public int getKnownClaimantCount() {
        return claimants.size();
    }
}
