package com.lyshra.open.claims.integration.models;

import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * One committed status transition of a claim. Entries are appended, never edited.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public final class ClaimHistoryEntry implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final ClaimStatus fromStatus;
    private final ClaimStatus toStatus;

    /**
     * Id of the claimant or system component that caused the transition.
     */
    private final String actor;

    private final String reason;
    private final Instant timestamp;

    /**
     * Owner before the transition, set when ownership changed hands.
     */
    private final String previousClaimantId;

    public Optional<String> getReasonOptional() {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getPreviousClaimantIdOptional() {
        return Optional.ofNullable(previousClaimantId);
    }

    public static ClaimHistoryEntry of(ClaimStatus from, ClaimStatus to, String actor, String reason, Instant at) {
        return ClaimHistoryEntry.builder()
                .fromStatus(from)
                .toStatus(to)
                .actor(actor)
                .reason(reason)
                .timestamp(at)
                .build();
    }
}
