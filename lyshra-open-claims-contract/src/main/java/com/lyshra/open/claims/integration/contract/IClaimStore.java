package com.lyshra.open.claims.integration.contract;

import com.lyshra.open.claims.integration.models.Claim;
import com.lyshra.open.claims.integration.models.ClaimFilter;
import com.lyshra.open.claims.integration.models.CreateClaimRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Durable record of claims and the only point of serialization between concurrent writers.
 *
 * <h2>Concurrency</h2>
 * <p>All writes go through {@link #update(String, long, UnaryOperator)}, a per-claim
 * compare-and-set on the claim version. There is no global lock; two updates on
 * different claims never contend.</p>
 *
 * <h2>Integrity</h2>
 * <p>Implementations reject a mutation that changes the claim id, removes or rewrites
 * history entries, or moves {@code lastActivityAt} backwards on an active claim.</p>
 */
public interface IClaimStore {

    /**
     * Prepares the store for use (loads persisted claims, creates directories).
     */
    Mono<Void> initialize();

    Mono<Void> shutdown();

    /**
     * @return true if the store can currently serve reads and writes
     */
    Mono<Boolean> healthCheck();

    /**
     * Creates a new available claim with version 1.
     *
     * @param request the validated creation input
     * @return the stored claim
     */
    Mono<Claim> create(CreateClaimRequest request);

    /**
     * @return the claim, or an error of {@code ClaimNotFoundException}
     */
    Mono<Claim> get(String claimId);

    Mono<Optional<Claim>> findById(String claimId);

    /**
     * Atomically applies {@code mutation} if the stored version equals {@code expectedVersion}.
     *
     * <p>The mutation receives the current claim and returns its replacement. The store
     * assigns the new version. An exception thrown by the mutation is propagated and
     * nothing is written.</p>
     *
     * @param claimId         claim to update
     * @param expectedVersion version the caller read
     * @param mutation        pure function from the current claim to its replacement
     * @return the committed claim, or an error of {@code ClaimConflictException}
     *         carrying the current snapshot when the versions differ
     */
    Mono<Claim> update(String claimId, long expectedVersion, UnaryOperator<Claim> mutation);

    /**
     * Lists matching claims, highest priority first, then oldest first.
     */
    Flux<Claim> list(ClaimFilter filter);

    Mono<Long> count(ClaimFilter filter);

    /**
     * Finds active claims whose owner has been inactive for longer than the claim TTL.
     *
     * @param now reference instant
     */
    Flux<Claim> findStale(Instant now);
}
