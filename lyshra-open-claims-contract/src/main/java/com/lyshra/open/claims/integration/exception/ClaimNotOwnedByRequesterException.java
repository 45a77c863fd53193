package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.Claim;

/**
 * Raised when a handoff is requested, or would be completed, by someone who
 * does not hold the claim in an active status.
 */
public class ClaimNotOwnedByRequesterException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    private final String requesterId;

    public ClaimNotOwnedByRequesterException(Claim current, String requesterId) {
        super(ClaimErrorCode.NOT_OWNED_BY_REQUESTER,
                ClaimErrorCode.NOT_OWNED_BY_REQUESTER.format(requesterId, current.getId()),
                current.getId(),
                current);
        this.requesterId = requesterId;
    }

    public String getRequesterId() {
        return requesterId;
    }
}
