package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.PendingHandoff;

public class HandoffAlreadyResolvedException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    private final String handoffId;

    public HandoffAlreadyResolvedException(PendingHandoff handoff) {
        this(handoff, handoff.getStatus().name().toLowerCase());
    }

    /**
     * @param state description of why the handoff can no longer be resolved (e.g. "being accepted")
     */
    public HandoffAlreadyResolvedException(PendingHandoff handoff, String state) {
        super(ClaimErrorCode.HANDOFF_ALREADY_RESOLVED,
                ClaimErrorCode.HANDOFF_ALREADY_RESOLVED.format(handoff.getId(), state),
                handoff.getClaimId(),
                null);
        this.handoffId = handoff.getId();
    }

    public String getHandoffId() {
        return handoffId;
    }
}
