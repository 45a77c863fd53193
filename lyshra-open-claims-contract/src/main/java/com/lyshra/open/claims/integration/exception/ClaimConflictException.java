package com.lyshra.open.claims.integration.exception;

import com.lyshra.open.claims.integration.models.Claim;

/**
 * Raised by the claim store when a compare-and-set update loses a race.
 * The snapshot holds the current committed claim; the caller must re-read before retrying.
 */
public class ClaimConflictException extends ClaimOperationException {

    private static final long serialVersionUID = 1L;

    private final long expectedVersion;

    public ClaimConflictException(Claim current, long expectedVersion) {
        super(ClaimErrorCode.VERSION_CONFLICT,
                ClaimErrorCode.VERSION_CONFLICT.format(current.getId(), expectedVersion, current.getVersion()),
                current.getId(),
                current);
        this.expectedVersion = expectedVersion;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return getSnapshot().map(Claim::getVersion).orElse(-1L);
    }
}
