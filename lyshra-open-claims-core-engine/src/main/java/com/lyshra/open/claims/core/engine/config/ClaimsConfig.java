package com.lyshra.open.claims.core.engine.config;

import com.lyshra.open.claims.integration.enumerations.ClaimantKind;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Configuration for the claim coordination engine.
 *
 * Encapsulates every tunable parameter: lease lengths per claimant kind, expiry
 * behavior, steal limits, store backend and the nested work-stealing settings.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class ClaimsConfig {

    // Lease configuration
    @Builder.Default
    private final Duration agentTtl = Duration.ofMinutes(5);

    @Builder.Default
    private final Duration humanTtl = Duration.ofHours(1);

    // Expiry configuration
    @Builder.Default
    private final boolean expiryEnabled = true;

    @Builder.Default
    private final Duration expiryCheckInterval = Duration.ofSeconds(30);

    @Builder.Default
    private final Duration expiryCycleDeadline = Duration.ofSeconds(10);

    @Builder.Default
    private final ExpiryAction agentExpiryAction = ExpiryAction.REQUEUE;

    @Builder.Default
    private final ExpiryAction humanExpiryAction = ExpiryAction.EXPIRE;

    @Builder.Default
    private final AbandonPolicy abandonPolicy = AbandonPolicy.LEAVE_TERMINAL;

    /**
     * Maximum times a claim may be stolen (0 = unlimited).
     */
    @Builder.Default
    private final int maxStealCount = 3;

    // Store configuration
    @Builder.Default
    private final StoreType storeType = StoreType.MEMORY;

    @Builder.Default
    private final Path storePath = defaultStorePath();

    @Builder.Default
    private final WorkStealingConfig workStealing = WorkStealingConfig.defaultConfig();

    /**
     * Creates a configuration with all defaults.
     */
    public static ClaimsConfig defaultConfig() {
        return ClaimsConfig.builder().build();
    }

    public static Path defaultStorePath() {
        return Paths.get(System.getProperty("user.home"), ".lyshra-openclaims", "claims");
    }

    /**
     * Default lease length for the given claimant kind.
     */
    public Duration ttlFor(ClaimantKind kind) {
        return kind == ClaimantKind.HUMAN ? humanTtl : agentTtl;
    }

    public ExpiryAction expiryActionFor(ClaimantKind kind) {
        return kind == ClaimantKind.HUMAN ? humanExpiryAction : agentExpiryAction;
    }

    public boolean isStealLimited() {
        return maxStealCount > 0;
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if a value is out of range
     */
    public void validate() {
        WorkStealingConfig.requirePositive(agentTtl, "agentTtl");
        WorkStealingConfig.requirePositive(humanTtl, "humanTtl");
        WorkStealingConfig.requirePositive(expiryCheckInterval, "expiryCheckInterval");
        WorkStealingConfig.requirePositive(expiryCycleDeadline, "expiryCycleDeadline");
        if (maxStealCount < 0) {
            throw new IllegalStateException("maxStealCount must not be negative");
        }
        if (agentExpiryAction == null || humanExpiryAction == null || abandonPolicy == null) {
            throw new IllegalStateException("expiry actions and abandon policy must be set");
        }
        if (storeType == StoreType.FILE && storePath == null) {
            throw new IllegalStateException("storePath is required for FILE store");
        }
        if (workStealing == null) {
            throw new IllegalStateException("workStealing must be set");
        }
        workStealing.validate();
    }
}
