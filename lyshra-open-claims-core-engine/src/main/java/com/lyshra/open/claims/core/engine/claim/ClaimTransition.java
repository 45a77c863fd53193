package com.lyshra.open.claims.core.engine.claim;

import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Claim state machine: for each operation, the statuses it may start from and the status it leads to.
 *
 * <pre>
 * AVAILABLE ─claim→ CLAIMED ─startWork→ IN_PROGRESS ─block→ BLOCKED ─unblock→ IN_PROGRESS
 * CLAIMED | IN_PROGRESS | BLOCKED ─complete→ COMPLETED
 *                                 ─release→  AVAILABLE
 *                                 ─abandon→  ABANDONED
 *                                 ─expire→   EXPIRED | AVAILABLE (per claimant kind)
 *                                 ─steal→    CLAIMED
 *                                 ─handoff→  unchanged
 * </pre>
 */
@Getter
public enum ClaimTransition {

    CLAIM("claim", EnumSet.of(ClaimStatus.AVAILABLE), ClaimStatus.CLAIMED),
    START_WORK("startWork", EnumSet.of(ClaimStatus.CLAIMED), ClaimStatus.IN_PROGRESS),
    BLOCK("block", EnumSet.of(ClaimStatus.IN_PROGRESS), ClaimStatus.BLOCKED),
    UNBLOCK("unblock", EnumSet.of(ClaimStatus.BLOCKED), ClaimStatus.IN_PROGRESS),
    COMPLETE("complete", ClaimStatus.activeStatuses(), ClaimStatus.COMPLETED),
    RELEASE("release", ClaimStatus.activeStatuses(), ClaimStatus.AVAILABLE),
    ABANDON("abandon", ClaimStatus.activeStatuses(), ClaimStatus.ABANDONED),
    TOUCH("touch", ClaimStatus.activeStatuses(), null),
    EXPIRE("expire", ClaimStatus.activeStatuses(), null),
    STEAL("steal", ClaimStatus.activeStatuses(), ClaimStatus.CLAIMED),
    HANDOFF("handoff", ClaimStatus.activeStatuses(), null);

    private final String operation;
    private final Set<ClaimStatus> sources;

    /**
     * Fixed target, or null when the target depends on the claim (unchanged, or chosen by expiry policy).
     */
    private final ClaimStatus target;

    ClaimTransition(String operation, Set<ClaimStatus> sources, ClaimStatus target) {
        this.operation = operation;
        this.sources = sources;
        this.target = target;
    }

    public boolean isAllowedFrom(ClaimStatus status) {
        return sources.contains(status);
    }

    public Optional<ClaimStatus> getFixedTarget() {
        return Optional.ofNullable(target);
    }
}
