package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.Claim;

/**
 * Raised when a stale claim has already changed hands through stealing as often as allowed.
 */
public class ClaimStealLimitExceededException extends InvalidClaimTransitionException {

    private static final long serialVersionUID = 1L;

    public ClaimStealLimitExceededException(Claim current, int maxStealCount) {
        super(ClaimErrorCode.STEAL_LIMIT_EXCEEDED,
                ClaimErrorCode.STEAL_LIMIT_EXCEEDED.format(current.getId(), current.getStealCount(), maxStealCount),
                "steal",
                current);
    }
}
