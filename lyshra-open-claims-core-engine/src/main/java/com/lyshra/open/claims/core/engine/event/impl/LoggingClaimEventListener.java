package com.lyshra.open.claims.core.engine.event.impl;

import com.lyshra.open.claims.integration.contract.IClaimEventListener;
import com.lyshra.open.claims.integration.models.ClaimEvent;
import lombok.extern.slf4j.Slf4j;

/**
 * Writes every claim event to the log. Registered by default on the engine's event bus.
 */
@Slf4j
public class LoggingClaimEventListener implements IClaimEventListener {

    @Override
    public void onEvent(ClaimEvent event) {
        log.info("[CLAIM EVENT] {} claim={} actor={} status={}->{} owner={}->{}{}",
                event.getType(),
                event.getClaimId(),
                event.getActor(),
                event.getPreviousStatus(),
                event.getNewStatus(),
                event.getPreviousClaimantId(),
                event.getNewClaimantId(),
                event.getReasonOptional().map(reason -> " reason=" + reason).orElse(""));
    }
}
