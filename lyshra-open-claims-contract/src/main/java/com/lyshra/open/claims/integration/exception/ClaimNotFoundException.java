package com.lyshra.open.claims.integration.exception;

public class ClaimNotFoundException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    public ClaimNotFoundException(String claimId) {
        super(ClaimErrorCode.CLAIM_NOT_FOUND, ClaimErrorCode.CLAIM_NOT_FOUND.format(claimId), claimId, null);
    }
}
