package com.lyshra.open.claims.core.engine.config;

import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * What happens to a stale claim when its lease runs out.
 */
@AllArgsConstructor
@Getter
public enum ExpiryAction {

    /**
     * Return the claim to the pool so another claimant can pick it up.
     */
    REQUEUE(ClaimStatus.AVAILABLE),

    /**
     * Close the claim as expired; a person has to decide what to do next.
     */
    EXPIRE(ClaimStatus.EXPIRED);

    private final ClaimStatus targetStatus;
}
