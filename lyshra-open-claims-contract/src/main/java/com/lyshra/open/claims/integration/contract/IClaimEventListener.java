package com.lyshra.open.claims.integration.contract;

import com.lyshra.open.claims.integration.models.ClaimEvent;

/**
 * Receives claim events after they are committed.
 */
@FunctionalInterface
public interface IClaimEventListener {

    void onEvent(ClaimEvent event);
}
