package com.lyshra.open.claims.core.engine;

import com.lyshra.open.claims.core.engine.activity.impl.InMemoryActivityTracker;
import com.lyshra.open.claims.core.engine.claim.impl.ClaimServiceImpl;
import com.lyshra.open.claims.core.engine.config.ClaimsConfig;
import com.lyshra.open.claims.core.engine.config.ClaimsConfigLoader;
import com.lyshra.open.claims.core.engine.event.impl.InMemoryClaimEventBus;
import com.lyshra.open.claims.core.engine.event.impl.LoggingClaimEventListener;
import com.lyshra.open.claims.core.engine.expiry.ClaimExpirySweeper;
import com.lyshra.open.claims.core.engine.handoff.impl.InMemoryHandoffManager;
import com.lyshra.open.claims.core.engine.stealing.WorkStealingCoordinator;
import com.lyshra.open.claims.core.engine.store.ClaimStoreManager;
import com.lyshra.open.claims.integration.contract.IClaimStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.Objects;

/**
 * Factory for creating and wiring claim coordination engine components.
 *
 * Usage:
 * <pre>
 * ClaimCoordinationEngine engine = ClaimCoordinationEngineFactory.create(ClaimsConfig.defaultConfig());
 * engine.start().block();
 * engine.getClaimService().claim(claimId, Claimant.agent("agent-1", "frontend")).block();
 * engine.stop().block();
 * </pre>
 */
@Slf4j
public final class ClaimCoordinationEngineFactory {

    private ClaimCoordinationEngineFactory() {
        // Utility class
    }

    /**
     * Creates an engine from the classpath, system property and environment configuration.
     */
    public static ClaimCoordinationEngine createDefault() {
        return create(ClaimsConfigLoader.loadDefault(), Clock.systemUTC());
    }

    public static ClaimCoordinationEngine create(ClaimsConfig config) {
        return create(config, Clock.systemUTC());
    }

    /**
     * Creates a fully wired engine. Nothing is started.
     *
     * @param config the configuration
     * @param clock the time source shared by every component
     * @return the wired engine
     */
    public static ClaimCoordinationEngine create(ClaimsConfig config, Clock clock) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(clock, "clock must not be null");
        config.validate();

        log.info("Creating claim coordination engine with config: {}", config);

        ClaimStoreManager storeManager = new ClaimStoreManager(config, clock);
        IClaimStore store = storeManager.getStore();

        InMemoryClaimEventBus eventBus = new InMemoryClaimEventBus();
        eventBus.addListener(new LoggingClaimEventListener());

        InMemoryActivityTracker activityTracker = new InMemoryActivityTracker(clock);

        ClaimServiceImpl claimService = new ClaimServiceImpl(store, activityTracker, eventBus, config, clock);

        ClaimExpirySweeper expirySweeper = new ClaimExpirySweeper(claimService, config, clock);

        WorkStealingCoordinator stealingCoordinator = new WorkStealingCoordinator(
                claimService,
                store,
                activityTracker,
                config.getWorkStealing(),
                clock
        );

        InMemoryHandoffManager handoffManager = new InMemoryHandoffManager(
                claimService,
                activityTracker,
                eventBus,
                clock
        );

        return new ClaimCoordinationEngine(
                config,
                storeManager,
                eventBus,
                activityTracker,
                claimService,
                expirySweeper,
                stealingCoordinator,
                handoffManager
        );
    }
}
