package com.lyshra.open.claims.integration.exception;

public class HandoffNotFoundException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    private final String handoffId;

    public HandoffNotFoundException(String handoffId) {
        super(ClaimErrorCode.HANDOFF_NOT_FOUND, ClaimErrorCode.HANDOFF_NOT_FOUND.format(handoffId));
        this.handoffId = handoffId;
    }

    public String getHandoffId() {
        return handoffId;
    }
}
