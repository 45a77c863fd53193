package com.lyshra.open.claims.integration.models;

import com.lyshra.open.claims.integration.enumerations.ClaimantKind;
import com.lyshra.open.claims.integration.enumerations.HandoffStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.time.Instant;
import java.util.Optional;

/**
 * A request by a claim's owner to pass the claim to a claimant of another kind.
 * The claim keeps its owner until the request is accepted.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class PendingHandoff implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Format: "handoff-{uuid}"
     */
    private final String id;

    private final String claimId;
    private final String fromClaimantId;
    private final ClaimantKind requestedToKind;
    private final String note;
    private final HandoffStatus status;
    private final Instant createdAt;
    private final Instant resolvedAt;
    private final String acceptedByClaimantId;
    private final String cancelReason;

    public boolean isPending() {
        return status == HandoffStatus.PENDING;
    }

    public Optional<String> getNoteOptional() {
        return Optional.ofNullable(note);
    }

    public PendingHandoff complete(String acceptorId, Instant at) {
        return toBuilder()
                .status(HandoffStatus.COMPLETED)
                .acceptedByClaimantId(acceptorId)
                .resolvedAt(at)
                .build();
    }

    public PendingHandoff cancel(String reason, Instant at) {
        return toBuilder()
                .status(HandoffStatus.CANCELLED)
                .cancelReason(reason)
                .resolvedAt(at)
                .build();
    }
}
