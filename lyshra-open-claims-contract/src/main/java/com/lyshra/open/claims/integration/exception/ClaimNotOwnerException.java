package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.Claim;

public class ClaimNotOwnerException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    private final String claimantId;

    public ClaimNotOwnerException(Claim current, String claimantId) {
        super(ClaimErrorCode.NOT_OWNER,
                ClaimErrorCode.NOT_OWNER.format(claimantId, current.getId(), current.getClaimantId()),
                current.getId(),
                current);
        this.claimantId = claimantId;
    }

    public String getClaimantId() {
        return claimantId;
    }
}
