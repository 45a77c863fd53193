package com.lyshra.open.claims.integration.models;

import com.lyshra.open.claims.integration.enumerations.ClaimEventType;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * Domain event emitted after a claim mutation or handoff request has been committed.
 *
 * Events are delivered at least once; consumers should key on {@link #getEventId()}
 * when they need to deduplicate.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class ClaimEvent {

    private final String eventId;
    private final ClaimEventType type;
    private final String claimId;

    /**
     * Claimant or system component that caused the event.
     */
    private final String actor;

    private final ClaimStatus previousStatus;
    private final ClaimStatus newStatus;
    private final String reason;
    private final Instant timestamp;

    private final String previousClaimantId;
    private final String newClaimantId;

    /**
     * Free-form context, e.g. the handoff note or the escalated priority range.
     */
    private final String context;

    private final String handoffId;

    /**
     * Private constructor - use builder or factory methods.
     */
    private ClaimEvent(String eventId,
                       ClaimEventType type,
                       String claimId,
                       String actor,
                       ClaimStatus previousStatus,
                       ClaimStatus newStatus,
                       String reason,
                       Instant timestamp,
                       String previousClaimantId,
                       String newClaimantId,
                       String context,
                       String handoffId) {
        this.eventId = eventId != null ? eventId : "evt-" + UUID.randomUUID();
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.claimId = Objects.requireNonNull(claimId, "claimId must not be null");
        this.actor = actor;
        this.previousStatus = previousStatus;
        this.newStatus = newStatus;
        this.reason = reason;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.previousClaimantId = previousClaimantId;
        this.newClaimantId = newClaimantId;
        this.context = context;
        this.handoffId = handoffId;
    }

    // ========== Query Methods ==========

    public Optional<String> getReasonOptional() {
        return Optional.ofNullable(reason);
    }

    public Optional<String> getContextOptional() {
        return Optional.ofNullable(context);
    }

    /**
     * Checks if the event moved the claim to a different owner.
     */
    public boolean isOwnershipChange() {
        return !Objects.equals(previousClaimantId, newClaimantId);
    }

    // ========== Factory Methods ==========

    /**
     * Creates an event for a new claim.
     */
    public static ClaimEvent created(Claim claim, String actor, Instant at) {
        return ClaimEvent.builder()
                .type(ClaimEventType.CREATED)
                .claimId(claim.getId())
                .actor(actor)
                .newStatus(claim.getStatus())
                .timestamp(at)
                .context(claim.getTitle())
                .build();
    }

    /**
     * Creates an event describing the committed change from {@code before} to {@code after}.
     */
    public static ClaimEvent transition(ClaimEventType type,
                                        Claim before,
                                        Claim after,
                                        String actor,
                                        String reason,
                                        Instant at) {
        return ClaimEvent.builder()
                .type(type)
                .claimId(after.getId())
                .actor(actor)
                .previousStatus(before.getStatus())
                .newStatus(after.getStatus())
                .reason(reason)
                .timestamp(at)
                .previousClaimantId(before.getClaimantId())
                .newClaimantId(after.getClaimantId())
                .build();
    }

    /**
     * Creates a handoff event; the note travels as context.
     */
    public static ClaimEvent handoff(Claim before, Claim after, String actor, String note, String handoffId, Instant at) {
        return transition(ClaimEventType.HANDOFF, before, after, actor, "handoff", at).toBuilder()
                .context(note)
                .handoffId(handoffId)
                .build();
    }

    /**
     * Creates a priority escalation event. Status and owner are unchanged.
     */
    public static ClaimEvent priorityEscalated(Claim before, Claim after, String actor, Instant at) {
        return transition(ClaimEventType.PRIORITY_ESCALATED, before, after, actor, "priority escalated", at).toBuilder()
                .context(before.getPriority().getCode() + " -> " + after.getPriority().getCode())
                .build();
    }

    public static ClaimEvent handoffRequested(PendingHandoff handoff, Claim claim, Instant at) {
        return ClaimEvent.builder()
                .type(ClaimEventType.HANDOFF_REQUESTED)
                .claimId(handoff.getClaimId())
                .actor(handoff.getFromClaimantId())
                .previousStatus(claim.getStatus())
                .newStatus(claim.getStatus())
                .reason("handoff requested to " + handoff.getRequestedToKind().getCode())
                .timestamp(at)
                .previousClaimantId(handoff.getFromClaimantId())
                .newClaimantId(handoff.getFromClaimantId())
                .context(handoff.getNote())
                .handoffId(handoff.getId())
                .build();
    }

    public static ClaimEvent handoffCancelled(PendingHandoff handoff, String actor, Instant at) {
        return ClaimEvent.builder()
                .type(ClaimEventType.HANDOFF_CANCELLED)
                .claimId(handoff.getClaimId())
                .actor(actor)
                .reason(handoff.getCancelReason())
                .timestamp(at)
                .previousClaimantId(handoff.getFromClaimantId())
                .newClaimantId(handoff.getFromClaimantId())
                .context(handoff.getNote())
                .handoffId(handoff.getId())
                .build();
    }
}
