package com.lyshra.open.claims.core.engine;

import com.lyshra.open.claims.core.engine.activity.impl.InMemoryActivityTracker;
import com.lyshra.open.claims.core.engine.config.ClaimsConfig;
import com.lyshra.open.claims.core.engine.event.impl.InMemoryClaimEventBus;
import com.lyshra.open.claims.core.engine.expiry.ClaimExpirySweeper;
import com.lyshra.open.claims.core.engine.stealing.WorkStealingCoordinator;
import com.lyshra.open.claims.core.engine.store.ClaimStoreManager;
import com.lyshra.open.claims.integration.contract.IActivityTracker;
import com.lyshra.open.claims.integration.contract.IClaimEventPublisher;
import com.lyshra.open.claims.integration.contract.IClaimService;
import com.lyshra.open.claims.integration.contract.IClaimStore;
import com.lyshra.open.claims.integration.contract.IHandoffManager;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import com.lyshra.open.claims.integration.models.ClaimFilter;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Main entry point for claim coordination.
 *
 * Owns every component and their lifecycle:
 * <pre>
 * ClaimCoordinationEngine engine = ClaimCoordinationEngineFactory.create(config);
 * engine.start().block();
 * IClaimService claims = engine.getClaimService();
 * ...
 * engine.stop().block();
 * </pre>
 *
 * Start order: configuration check, store, activity tracker, expiry sweeper, work stealing.
 * Claims that are still held when the store comes up are counted against their holders in
 * the activity tracker, so a holder is never reported idle after a restart.
 * Stop runs the background cycles down before the store and forgets tracked claimants.
 */
@Slf4j
public final class ClaimCoordinationEngine {

    @Getter
    private final ClaimsConfig config;

    @Getter
    private final ClaimStoreManager storeManager;

    private final InMemoryClaimEventBus eventBus;

    private final InMemoryActivityTracker activityTracker;

    @Getter
    private final IClaimService claimService;

    @Getter
    private final ClaimExpirySweeper expirySweeper;

    @Getter
    private final WorkStealingCoordinator stealingCoordinator;

    @Getter
    private final IHandoffManager handoffManager;

    private final AtomicBoolean running = new AtomicBoolean(false);

    ClaimCoordinationEngine(ClaimsConfig config,
                            ClaimStoreManager storeManager,
                            InMemoryClaimEventBus eventBus,
                            InMemoryActivityTracker activityTracker,
                            IClaimService claimService,
                            ClaimExpirySweeper expirySweeper,
                            WorkStealingCoordinator stealingCoordinator,
                            IHandoffManager handoffManager) {
        this.config = Objects.requireNonNull(config);
        this.storeManager = Objects.requireNonNull(storeManager);
        this.eventBus = Objects.requireNonNull(eventBus);
        this.activityTracker = Objects.requireNonNull(activityTracker);
        this.claimService = Objects.requireNonNull(claimService);
        this.expirySweeper = Objects.requireNonNull(expirySweeper);
        this.stealingCoordinator = Objects.requireNonNull(stealingCoordinator);
        this.handoffManager = Objects.requireNonNull(handoffManager);
    }

    /**
     * Initializes the store and starts the background cycles enabled by configuration.
     */
    public Mono<Void> start() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(false, true)) {
                log.warn("Claim coordination engine already running");
                return Mono.empty();
            }
            log.info("Starting claim coordination engine (store: {})", storeManager.getActiveStoreType());
            return Mono.fromRunnable(config::validate)
                    .then(storeManager.initialize())
                    .then(Mono.fromRunnable(activityTracker::start))
                    .then(restoreHeldClaims())
                    .then(config.isExpiryEnabled() ? expirySweeper.start() : Mono.empty())
                    .then(stealingCoordinator.start())
                    .doOnSuccess(v -> log.info("Claim coordination engine started"))
                    .doOnError(e -> {
                        log.error("Failed to start claim coordination engine", e);
                        running.set(false);
                    });
        });
    }

    /**
     * Stops the background cycles and shuts the store down.
     */
    public Mono<Void> stop() {
        return Mono.defer(() -> {
            if (!running.compareAndSet(true, false)) {
                return Mono.empty();
            }
            log.info("Stopping claim coordination engine");
            return stealingCoordinator.stop()
                    .then(expirySweeper.stop())
                    .then(storeManager.shutdown())
                    .then(Mono.<Void>fromRunnable(activityTracker::reset))
                    .doOnSuccess(v -> log.info("Claim coordination engine stopped"))
                    .doOnError(e -> log.error("Error during claim coordination engine shutdown", e));
        });
    }

    private Mono<Void> restoreHeldClaims() {
        ClaimFilter held = ClaimFilter.builder().statuses(ClaimStatus.activeStatuses()).build();
        return storeManager.getStore().list(held)
                .filter(claim -> claim.getClaimant() != null)
                .doOnNext(claim -> activityTracker.onClaimAcquired(claim.getClaimant(), claim.getId()))
                .count()
                .doOnNext(count -> {
                    if (count > 0) {
                        log.info("Restored {} held claims into the activity tracker", count);
                    }
                })
                .then();
    }

    public boolean isRunning() {
        return running.get();
    }

    public IClaimStore getStore() {
        return storeManager.getStore();
    }

    public IClaimEventPublisher getEventPublisher() {
        return eventBus;
    }

    public IActivityTracker getActivityTracker() {
        return activityTracker;
    }

    public Mono<Boolean> healthCheck() {
        return storeManager.healthCheck();
    }
}
