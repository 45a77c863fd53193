package com.lyshra.open.claims.core.engine.expiry;

import com.lyshra.open.claims.core.engine.config.ClaimsConfig;
import com.lyshra.open.claims.integration.contract.IClaimService;
import com.lyshra.open.claims.integration.models.ExpirySweepResult;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Periodic task that applies the expiry policy to stale claims.
 *
 * This component runs a background task that:
 * 1. Asks the claim service to expire every claim stale at the tick time
 * 2. Stops between claims once the cycle deadline has elapsed
 * 3. Drops ticks that arrive while a sweep is still running
 *
 * A failing sweep is logged; the schedule keeps running.
 *
 * Thread Safety: This class is thread-safe.
 */
@Slf4j
public class ClaimExpirySweeper {

    private final IClaimService claimService;
    private final Clock clock;
    private final Duration interval;
    private final Duration cycleDeadline;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean sweepInFlight = new AtomicBoolean(false);
    private final AtomicLong sweepCount = new AtomicLong(0);
    private final AtomicLong skippedSweepCount = new AtomicLong(0);
    private final AtomicLong failedSweepCount = new AtomicLong(0);
    private final AtomicReference<ExpirySweepResult> lastResult = new AtomicReference<>();

    private volatile Disposable sweepTask;

    public ClaimExpirySweeper(IClaimService claimService, ClaimsConfig config, Clock clock) {
        this.claimService = Objects.requireNonNull(claimService, "claimService must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.interval = config.getExpiryCheckInterval();
        this.cycleDeadline = config.getExpiryCycleDeadline();
    }

    // ========== Lifecycle ==========

    public Mono<Void> start() {
        return Mono.fromRunnable(() -> {
            if (!running.compareAndSet(false, true)) {
                log.warn("Claim expiry sweeper already running");
                return;
            }
            log.info("Starting claim expiry sweeper with interval {} and deadline {}", interval, cycleDeadline);
            sweepTask = Flux.interval(interval, Schedulers.parallel())
                    .onBackpressureDrop(tick -> {
                        skippedSweepCount.incrementAndGet();
                        log.debug("Dropping expiry tick {}: previous sweep still running", tick);
                    })
                    .concatMap(tick -> runSweep()
                            .onErrorResume(error -> {
                                failedSweepCount.incrementAndGet();
                                log.error("Error during claim expiry sweep", error);
                                return Mono.empty();
                            }), 1)
                    .subscribe();
        });
    }

    public Mono<Void> stop() {
        return Mono.fromRunnable(() -> {
            if (!running.compareAndSet(true, false)) {
                return;
            }
            log.info("Stopping claim expiry sweeper");
            if (sweepTask != null) {
                sweepTask.dispose();
                sweepTask = null;
            }
        });
    }

    public boolean isRunning() {
        return running.get();
    }

    // ========== Sweeping ==========

    /**
     * Runs one sweep now. Completes empty if another sweep is in flight.
     */
    public Mono<ExpirySweepResult> runSweep() {
        return Mono.defer(() -> {
            if (!sweepInFlight.compareAndSet(false, true)) {
                skippedSweepCount.incrementAndGet();
                log.debug("Expiry sweep already in flight, skipping");
                return Mono.empty();
            }
            return claimService.expireStale(clock.instant(), cycleDeadline)
                    .doOnNext(result -> {
                        sweepCount.incrementAndGet();
                        lastResult.set(result);
                    })
                    .doFinally(signal -> sweepInFlight.set(false));
        });
    }

    // ========== Metrics ==========

    public long getSweepCount() {
        return sweepCount.get();
    }

    public long getSkippedSweepCount() {
        return skippedSweepCount.get();
    }

    public long getFailedSweepCount() {
        return failedSweepCount.get();
    }

    public Optional<ExpirySweepResult> getLastResult() {
        return Optional.ofNullable(lastResult.get());
    }
}
