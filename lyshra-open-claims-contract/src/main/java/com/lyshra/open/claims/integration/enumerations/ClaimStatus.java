package com.lyshra.open.claims.integration.enumerations;

import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a claim.
 *
 * <pre>
 * AVAILABLE ─claim→ CLAIMED ─startWork→ IN_PROGRESS ⇄ BLOCKED
 *                      │                    │            │
 *                      └───── complete / release / abandon / expire / steal ─────┘
 * </pre>
 */
@AllArgsConstructor
@Getter
public enum ClaimStatus {

    /**
     * Open for claiming.
     */
    AVAILABLE("available"),

    /**
     * Owned by a claimant that has not yet started work.
     */
    CLAIMED("claimed"),

    /**
     * Owned and actively being worked on.
     */
    IN_PROGRESS("in-progress"),

    /**
     * Owned but waiting on something outside the claimant's control.
     */
    BLOCKED("blocked"),

    /**
     * Work finished. Terminal.
     */
    COMPLETED("completed"),

    /**
     * Reserved for archival stores that keep released ownership records.
     * The engine itself returns released claims to {@link #AVAILABLE}.
     */
    RELEASED("released"),

    /**
     * Lease ran out and the claim was not requeued. Terminal.
     */
    EXPIRED("expired"),

    /**
     * Claimant gave up on the work. Terminal.
     */
    ABANDONED("abandoned");

    private static final Set<ClaimStatus> ACTIVE = EnumSet.of(CLAIMED, IN_PROGRESS, BLOCKED);
    private static final Set<ClaimStatus> TERMINAL = EnumSet.of(COMPLETED, RELEASED, EXPIRED, ABANDONED);

    private final String code;

    /**
     * Statuses in which a claimant holds the claim.
     */
    public static Set<ClaimStatus> activeStatuses() {
        return EnumSet.copyOf(ACTIVE);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static ClaimStatus fromCode(String code) {
        for (ClaimStatus status : values()) {
            if (status.code.equalsIgnoreCase(code)) {
                return status;
            }
        }
        throw ClaimValidationException.invalidValue("status", code);
    }
}
