package com.lyshra.open.claims.core.engine.config;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Duration;

/**
 * Tuning for the periodic work-stealing cycle.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class WorkStealingConfig {

    @Builder.Default
    private final boolean enabled = true;

    @Builder.Default
    private final Duration checkInterval = Duration.ofSeconds(30);

    /**
     * Minimum inactivity before a claimant with no claims counts as idle.
     */
    @Builder.Default
    private final Duration idleThreshold = Duration.ofMinutes(2);

    /**
     * Minimum inactivity a stale claim must show before it can be stolen.
     */
    @Builder.Default
    private final Duration staleThreshold = Duration.ZERO;

    /**
     * Lets an idle claimant take a stale claim outside its own domain when none matches.
     */
    @Builder.Default
    private final boolean allowCrossDomain = false;

    @Builder.Default
    private final int maxStealsPerCycle = 10;

    /**
     * Upper bound on one cycle; remaining candidates wait for the next tick.
     */
    @Builder.Default
    private final Duration cycleDeadline = Duration.ofSeconds(10);

    public static WorkStealingConfig defaultConfig() {
        return WorkStealingConfig.builder().build();
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        requirePositive(checkInterval, "checkInterval");
        requirePositive(cycleDeadline, "cycleDeadline");
        if (idleThreshold == null || idleThreshold.isNegative()) {
            throw new IllegalStateException("idleThreshold must not be negative");
        }
        if (staleThreshold == null || staleThreshold.isNegative()) {
            throw new IllegalStateException("staleThreshold must not be negative");
        }
        if (maxStealsPerCycle <= 0) {
            throw new IllegalStateException("maxStealsPerCycle must be positive");
        }
    }

    static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalStateException(name + " must be positive");
        }
    }
}
