package com.lyshra.open.claims.integration.models;

import java.time.Duration;
import java.time.Instant;

/**
 * A claimant that holds no claims and has been inactive for at least the queried threshold.
 *
 * @param claimant       the idle claimant
 * @param lastActivityAt last recorded activity
 * @param idleFor        inactivity at the time of the query
 */
public record IdleClaimant(Claimant claimant, Instant lastActivityAt, Duration idleFor) {

    public String claimantId() {
        return claimant.getId();
    }
}
