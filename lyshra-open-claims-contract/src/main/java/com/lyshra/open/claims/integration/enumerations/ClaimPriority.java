package com.lyshra.open.claims.integration.enumerations;

import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Comparator;

/**
 * Priority tier of a claim. {@link #P0} is the most urgent.
 */
@AllArgsConstructor
@Getter
public enum ClaimPriority {

    P0("p0", 3),
    P1("p1", 2),
    P2("p2", 1),
    P3("p3", 0);

    /**
     * Orders priorities from most to least urgent.
     */
    public static final Comparator<ClaimPriority> HIGHEST_FIRST =
            Comparator.comparingInt(ClaimPriority::getRank).reversed();

    private final String code;

    /**
     * Higher rank means more urgent.
     */
    private final int rank;

    public boolean isHigherThan(ClaimPriority other) {
        return rank > other.rank;
    }

    public boolean isHighest() {
        return this == P0;
    }

    /**
     * Returns the next more urgent tier.
     *
     * @throws ClaimValidationException if already at {@link #P0}
     */
    public ClaimPriority escalate() {
        if (isHighest()) {
            throw new ClaimValidationException("Claim is already at highest priority: " + code);
        }
        return values()[ordinal() - 1];
    }

    public static ClaimPriority fromCode(String code) {
        for (ClaimPriority priority : values()) {
            if (priority.code.equalsIgnoreCase(code)) {
                return priority;
            }
        }
        throw ClaimValidationException.invalidValue("priority", code);
    }
}
