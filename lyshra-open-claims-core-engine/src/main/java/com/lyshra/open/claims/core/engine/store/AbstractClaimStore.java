package com.lyshra.open.claims.core.engine.store;

import com.lyshra.open.claims.integration.contract.IClaimStore;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import com.lyshra.open.claims.integration.exception.ClaimConflictException;
import com.lyshra.open.claims.integration.exception.ClaimNotFoundException;
import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.ClaimFilter;
import com.lyshra.open.claims.integration.models.ClaimHistoryEntry;
import com.lyshra.open.claims.integration.models.CreateClaimRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Shared compare-and-set logic for claim stores that keep the working set in memory.
 *
 * <p>Every write runs inside {@link ConcurrentHashMap#compute}, so the version check,
 * the integrity check, the backend write ({@link #persist(Claim)}) and the cache swap
 * happen atomically per claim. If any step throws, the cached claim is left unchanged.</p>
 */
@Slf4j
public abstract class AbstractClaimStore implements IClaimStore {

    protected final Map<String, Claim> claims = new ConcurrentHashMap<>();
    protected final Clock clock;

    private volatile boolean initialized = false;

    protected AbstractClaimStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Writes the committed claim to the backend. Called while the claim's map entry is locked.
     */
    protected abstract void persist(Claim claim);

    protected void markInitialized(boolean value) {
        this.initialized = value;
    }

    protected boolean isInitialized() {
        return initialized;
    }

    protected void ensureInitialized() {
        if (!initialized) {
            throw new IllegalStateException(getClass().getSimpleName() + " is not initialized");
        }
    }

    // ========================================================================
    // WRITES
    // ========================================================================

    @Override
    public Mono<Claim> create(CreateClaimRequest request) {
        return Mono.fromCallable(() -> createSync(request));
    }

    protected Claim createSync(CreateClaimRequest request) {
        ensureInitialized();
        if (request == null) {
            throw ClaimValidationException.missingField("request");
        }
        request.validate();

        Instant now = clock.instant();
        Claim claim = Claim.builder()
                .id("claim-" + UUID.randomUUID())
                .type(request.getType())
                .status(ClaimStatus.AVAILABLE)
                .priority(request.getPriority())
                .domain(request.getDomain())
                .title(request.getTitle())
                .description(request.getDescription())
                .tags(request.getTags())
                .metadata(request.getMetadata())
                .correlationId(request.getCorrelationId())
                .createdAt(now)
                .updatedAt(now)
                .version(1L)
                .build();

        claims.compute(claim.getId(), (id, existing) -> {
            if (existing != null) {
                throw new IllegalStateException("Duplicate claim id generated: " + id);
            }
            persist(claim);
            return claim;
        });
        log.debug("Created claim: {} (type: {}, priority: {}, domain: {})",
                claim.getId(), claim.getType().getCode(), claim.getPriority().getCode(), claim.getDomain());
        return claim;
    }

    @Override
    public Mono<Claim> update(String claimId, long expectedVersion, UnaryOperator<Claim> mutation) {
        return Mono.fromCallable(() -> updateSync(claimId, expectedVersion, mutation));
    }

    protected Claim updateSync(String claimId, long expectedVersion, UnaryOperator<Claim> mutation) {
        ensureInitialized();
        Objects.requireNonNull(mutation, "mutation must not be null");
        if (claimId == null) {
            throw ClaimValidationException.missingField("claimId");
        }

        Claim[] committed = {null};
        claims.compute(claimId, (id, current) -> {
            if (current == null) {
                throw new ClaimNotFoundException(id);
            }
            if (current.getVersion() != expectedVersion) {
                log.debug("Version conflict on claim {}: expected={}, actual={}",
                        id, expectedVersion, current.getVersion());
                throw new ClaimConflictException(current, expectedVersion);
            }
            Claim proposed = mutation.apply(current);
            Claim next = proposed.toBuilder().version(current.getVersion() + 1).build();
            verifyIntegrity(current, next);
            persist(next);
            committed[0] = next;
            return next;
        });
        return committed[0];
    }

    /**
     * Rejects mutations that would rewrite identity, history or activity time.
     */
    protected void verifyIntegrity(Claim current, Claim next) {
        if (!current.getId().equals(next.getId())) {
            throw new ClaimValidationException("claim id cannot change: " + current.getId());
        }
        List<ClaimHistoryEntry> before = current.getHistory();
        List<ClaimHistoryEntry> after = next.getHistory();
        if (after.size() < before.size() || !after.subList(0, before.size()).equals(before)) {
            throw new ClaimValidationException("history of claim " + current.getId() + " is append-only");
        }
        if (next.isActive()
                && current.getLastActivityAt() != null
                && next.getLastActivityAt() != null
                && next.getLastActivityAt().isBefore(current.getLastActivityAt())) {
            throw new ClaimValidationException("lastActivityAt of claim " + current.getId() + " cannot move backwards");
        }
    }

    // ========================================================================
    // READS
    // ========================================================================

    @Override
    public Mono<Claim> get(String claimId) {
        return findById(claimId)
                .flatMap(found -> found.map(Mono::just)
                        .orElseGet(() -> Mono.error(new ClaimNotFoundException(claimId))));
    }

    @Override
    public Mono<Optional<Claim>> findById(String claimId) {
        return Mono.fromCallable(() -> {
            ensureInitialized();
            return claimId == null ? Optional.<Claim>empty() : Optional.ofNullable(claims.get(claimId));
        });
    }

    @Override
    public Flux<Claim> list(ClaimFilter filter) {
        ClaimFilter effective = filter != null ? filter : ClaimFilter.all();
        return Mono.fromCallable(() -> {
                    ensureInitialized();
                    Stream<Claim> matching = claims.values().stream()
                            .filter(effective::matches)
                            .sorted(ClaimFilter.PRIORITY_ORDER);
                    if (effective.hasLimit()) {
                        matching = matching.limit(effective.getLimit());
                    }
                    return matching.toList();
                })
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Long> count(ClaimFilter filter) {
        ClaimFilter effective = filter != null ? filter.toBuilder().limit(null).build() : ClaimFilter.all();
        return Mono.fromCallable(() -> {
            ensureInitialized();
            return claims.values().stream().filter(effective::matches).count();
        });
    }

    @Override
    public Flux<Claim> findStale(Instant now) {
        return Mono.fromCallable(() -> {
                    ensureInitialized();
                    return claims.values().stream()
                            .filter(claim -> claim.isStale(now))
                            .sorted(ClaimFilter.PRIORITY_ORDER)
                            .toList();
                })
                .flatMapMany(Flux::fromIterable);
    }

    @Override
    public Mono<Boolean> healthCheck() {
        return Mono.fromCallable(this::isInitialized);
    }

    /**
     * Number of claims currently held.
     */
    public int size() {
        return claims.size();
    }
}
