package com.lyshra.open.claims.core.engine.store;

import com.lyshra.open.claims.core.engine.config.ClaimsConfig;
import com.lyshra.open.claims.core.engine.config.StoreType;
import com.lyshra.open.claims.core.engine.store.impl.FileBasedClaimStore;
import com.lyshra.open.claims.core.engine.store.impl.InMemoryClaimStore;
import com.lyshra.open.claims.integration.contract.IClaimStore;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Objects;

/**
 * Creates and owns the claim store selected by configuration.
 *
 * <h2>Supported Storage Types</h2>
 * <ul>
 *   <li>MEMORY: In-memory storage (no persistence, fast)</li>
 *   <li>FILE: One serialized file per claim (persistent, simple)</li>
 * </ul>
 */
@Slf4j
public class ClaimStoreManager {

    private final ClaimsConfig config;
    private final Clock clock;

    private final StoreType activeStoreType;
    private final IClaimStore activeStore;
    private volatile boolean initialized = false;

    public ClaimStoreManager(ClaimsConfig config, Clock clock) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.activeStoreType = Objects.requireNonNull(config.getStoreType(), "storeType must not be null");
        this.activeStore = createStore(activeStoreType);
    }

    /**
     * Initializes the configured store. Does nothing if it is already initialized.
     *
     * @return completion signal
     */
    public Mono<Void> initialize() {
        return Mono.defer(() -> {
            if (initialized) {
                return Mono.empty();
            }
            log.info("Initializing claim store with type: {}", activeStoreType);
            return activeStore.initialize()
                    .doOnSuccess(v -> {
                        this.initialized = true;
                        log.info("Claim store initialized successfully");
                    })
                    .doOnError(e -> log.error("Failed to initialize claim store", e));
        });
    }

    public Mono<Void> shutdown() {
        return Mono.defer(() -> {
            if (!initialized) {
                return Mono.empty();
            }
            log.info("Shutting down claim store");
            return activeStore.shutdown()
                    .doFinally(signal -> initialized = false);
        });
    }

    /**
     * Gets the configured store. The instance is the same before and after
     * initialization, so it can be handed to services up front.
     */
    public IClaimStore getStore() {
        return activeStore;
    }

    public StoreType getActiveStoreType() {
        return activeStoreType;
    }

    public boolean isInitialized() {
        return initialized;
    }

    public Mono<Boolean> healthCheck() {
        if (!initialized) {
            return Mono.just(false);
        }
        return activeStore.healthCheck();
    }

    private IClaimStore createStore(StoreType type) {
        return switch (type) {
            case MEMORY -> new InMemoryClaimStore(clock);
            case FILE -> new FileBasedClaimStore(config.getStorePath(), clock);
        };
    }
}
