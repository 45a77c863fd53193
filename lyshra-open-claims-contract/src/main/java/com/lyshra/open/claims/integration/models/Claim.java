package com.lyshra.open.claims.integration.models;

import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import com.lyshra.open.claims.integration.enumerations.ClaimType;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of one unit of QE work and its current ownership lease.
 *
 * A claim is owned by at most one claimant at a time. Ownership is leased:
 * the claimant must show activity within {@link #getTtl()} or the claim becomes
 * stale and eligible for expiry or work stealing.
 *
 * Every committed mutation produces a new instance with {@link #getVersion()}
 * incremented by one. The version is the optimistic concurrency token used by
 * the claim store.
 *
 * Serialization: All fields are serializable; collections are defensive,
 * unmodifiable copies.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString(exclude = "history")
public final class Claim implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    // ========== Identity Fields ==========

    /**
     * Format: "claim-{uuid}"
     */
    private final String id;

    private final ClaimType type;
    private final ClaimStatus status;
    private final ClaimPriority priority;

    /**
     * Work domain used to match claims with specialized claimants.
     */
    private final String domain;

    private final String title;
    private final String description;
    private final List<String> tags;

    /**
     * Opaque producer metadata. Never interpreted by the engine except for
     * the {@code requeuedFrom} key written when an abandoned claim is requeued.
     */
    private final Map<String, String> metadata;

    // ========== Lease Fields ==========

    /**
     * Current owner. Null while available; kept after complete, abandon or expire so the
     * last holder stays on record.
     */
    private final Claimant claimant;

    private final Instant claimedAt;

    /**
     * Last observed activity of the current owner. Never moves backwards while active.
     */
    private final Instant lastActivityAt;

    /**
     * Maximum inactivity before the claim is considered stale.
     */
    private final Duration ttl;

    // ========== Versioning Fields ==========

    private final Instant createdAt;
    private final Instant updatedAt;
    private final long version;

    // ========== History & Audit Fields ==========

    /**
     * Number of times ownership was taken from a stale claimant.
     */
    private final int stealCount;

    /**
     * Owners this claim was taken away from (steal or handoff), oldest first.
     */
    private final List<String> previousClaimantIds;

    private final ClaimResult result;

    /**
     * Identifier linking this claim to an originating request or requeued predecessor.
     */
    private final String correlationId;

    private final List<ClaimHistoryEntry> history;

    private Claim(String id,
                  ClaimType type,
                  ClaimStatus status,
                  ClaimPriority priority,
                  String domain,
                  String title,
                  String description,
                  List<String> tags,
                  Map<String, String> metadata,
                  Claimant claimant,
                  Instant claimedAt,
                  Instant lastActivityAt,
                  Duration ttl,
                  Instant createdAt,
                  Instant updatedAt,
                  long version,
                  int stealCount,
                  List<String> previousClaimantIds,
                  ClaimResult result,
                  String correlationId,
                  List<ClaimHistoryEntry> history) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.status = Objects.requireNonNull(status, "status must not be null");
        this.priority = Objects.requireNonNull(priority, "priority must not be null");
        this.domain = domain;
        this.title = title;
        this.description = description;
        this.tags = copyOf(tags);
        this.metadata = metadata != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(metadata))
                : Collections.emptyMap();
        this.claimant = claimant;
        this.claimedAt = claimedAt;
        this.lastActivityAt = lastActivityAt;
        this.ttl = ttl;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
        this.version = version;
        this.stealCount = stealCount;
        this.previousClaimantIds = copyOf(previousClaimantIds);
        this.result = result;
        this.correlationId = correlationId;
        this.history = copyOf(history);
    }

    private static <T> List<T> copyOf(List<T> source) {
        return source != null ? Collections.unmodifiableList(new ArrayList<>(source)) : Collections.emptyList();
    }

    // ========== State Query Methods ==========

    /**
     * Checks if a claimant currently holds this claim.
     */
    public boolean isActive() {
        return status.isActive();
    }

    public boolean isAvailable() {
        return status == ClaimStatus.AVAILABLE;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Checks if the claim is held and its owner has been inactive for longer than the TTL.
     *
     * @param now the reference instant
     * @return true if stale at {@code now}
     */
    public boolean isStale(Instant now) {
        if (!isActive() || lastActivityAt == null || ttl == null) {
            return false;
        }
        return getInactivity(now).compareTo(ttl) > 0;
    }

    /**
     * Time elapsed since the last recorded activity, zero if never active.
     */
    public Duration getInactivity(Instant now) {
        if (lastActivityAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(lastActivityAt, now);
    }

    /**
     * Checks if the given claimant currently holds this claim.
     */
    public boolean isOwnedBy(String claimantId) {
        return isActive() && claimant != null && claimant.getId().equals(claimantId);
    }

    public long getTtlMs() {
        return ttl != null ? ttl.toMillis() : 0L;
    }

    public Optional<Claimant> getClaimantOptional() {
        return Optional.ofNullable(claimant);
    }

    public String getClaimantId() {
        return claimant != null ? claimant.getId() : null;
    }

    public Optional<ClaimResult> getResultOptional() {
        return Optional.ofNullable(result);
    }

    public boolean hasTag(String tag) {
        return tags.contains(tag);
    }

    /**
     * Returns the most recent history entry, if any.
     */
    public Optional<ClaimHistoryEntry> getLastHistoryEntry() {
        return history.isEmpty() ? Optional.empty() : Optional.of(history.get(history.size() - 1));
    }

    /**
     * Returns a copy of this claim's history with the given entry appended.
     */
    public List<ClaimHistoryEntry> historyWith(ClaimHistoryEntry entry) {
        List<ClaimHistoryEntry> extended = new ArrayList<>(history);
        extended.add(entry);
        return extended;
    }

    /**
     * Returns a copy of this claim's previous-claimant list with the given id appended.
     */
    public List<String> previousClaimantsWith(String claimantId) {
        List<String> extended = new ArrayList<>(previousClaimantIds);
        extended.add(claimantId);
        return extended;
    }
}
