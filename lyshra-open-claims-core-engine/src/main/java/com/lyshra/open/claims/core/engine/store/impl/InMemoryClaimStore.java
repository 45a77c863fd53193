package com.lyshra.open.claims.core.engine.store.impl;

import com.lyshra.open.claims.core.engine.store.AbstractClaimStore;
import com.lyshra.open.claims.integration.models.Claim;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;

/**
 * In-memory implementation of the claim store.
 *
 * <p>This implementation is suitable for testing and single-process deployments
 * that do not need claims to survive a restart.</p>
 */
@Slf4j
public class InMemoryClaimStore extends AbstractClaimStore {

    public InMemoryClaimStore() {
        this(Clock.systemUTC());
    }

    public InMemoryClaimStore(Clock clock) {
        super(clock);
        markInitialized(true);
    }

    @Override
    public Mono<Void> initialize() {
        return Mono.fromRunnable(() -> {
            markInitialized(true);
            log.info("In-memory claim store initialized");
        });
    }

    @Override
    public Mono<Void> shutdown() {
        return Mono.fromRunnable(() -> {
            log.info("Shutting down in-memory claim store with {} claims", claims.size());
            claims.clear();
        });
    }

    @Override
    protected void persist(Claim claim) {
        // the cache is the store
    }

    /**
     * Removes all claims. Intended for tests.
     */
    public void clear() {
        claims.clear();
    }
}
