package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.Claim;

/**
 * Raised to a claimant that tried to claim work that is no longer available.
 */
public class ClaimAlreadyClaimedException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    public ClaimAlreadyClaimedException(Claim current) {
        super(ClaimErrorCode.ALREADY_CLAIMED,
                ClaimErrorCode.ALREADY_CLAIMED.format(current.getId(),
                        current.getClaimantId() != null ? current.getClaimantId() : current.getStatus().getCode()),
                current.getId(),
                current);
    }

    public String getCurrentOwner() {
        return getSnapshot().map(Claim::getClaimantId).orElse(null);
    }
}
