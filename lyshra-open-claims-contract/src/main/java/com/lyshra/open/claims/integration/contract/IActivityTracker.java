package com.lyshra.open.claims.integration.contract;

import com.lyshra.open.claims.integration.models.Claimant;
import com.lyshra.open.claims.integration.models.IdleClaimant;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Tracks when each claimant was last active and how many claims it holds.
 * Used to find idle claimants able to take stolen work.
 */
public interface IActivityTracker {

    void start();

    /**
     * Forgets every claimant.
     */
    void reset();

    /**
     * Announces a claimant able to take work. Counts as activity.
     */
    void registerClaimant(Claimant claimant);

    void recordActivity(Claimant claimant);

    /**
     * Records activity of an already known claimant. Unknown ids are ignored.
     */
    void recordActivity(String claimantId);

    void onClaimAcquired(String claimantId, String claimId);

    /**
     * Same as {@link #onClaimAcquired(String, String)}, registering the claimant first if unknown.
     */
    void onClaimAcquired(Claimant claimant, String claimId);

    void onClaimReleased(String claimantId, String claimId);

    /**
     * Claimants holding no claims and inactive for at least {@code threshold},
     * longest idle first, then by claimant id.
     */
    Flux<IdleClaimant> getIdleClaimants(Duration threshold);

    int getActiveClaimCount(String claimantId);

    Optional<Instant> getLastActivity(String claimantId);
}
