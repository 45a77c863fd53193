package com.lyshra.open.claims.integration.models;

import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.enumerations.ClaimStatus;
import com.lyshra.open.claims.integration.enumerations.ClaimType;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.Comparator;
import java.util.Set;

/**
 * Query over claims. Unset criteria match everything; set criteria are ANDed.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class ClaimFilter {

    /**
     * Ordering applied to every list result: priority descending, then oldest first.
     */
    public static final Comparator<Claim> PRIORITY_ORDER =
            Comparator.comparing(Claim::getPriority, ClaimPriority.HIGHEST_FIRST)
                    .thenComparing(Claim::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
                    .thenComparing(Claim::getId);

    @Singular("status")
    private final Set<ClaimStatus> statuses;

    private final String domain;
    private final ClaimPriority priority;
    private final String claimantId;
    private final ClaimType type;

    /**
     * Matches claims carrying at least one of these tags.
     */
    @Singular("tag")
    private final Set<String> tags;

    /**
     * Maximum number of results, null or non-positive for no limit.
     */
    private final Integer limit;

    public static ClaimFilter all() {
        return ClaimFilter.builder().build();
    }

    public static ClaimFilter byStatus(ClaimStatus status) {
        return ClaimFilter.builder().status(status).build();
    }

    public static ClaimFilter byClaimant(String claimantId) {
        return ClaimFilter.builder().claimantId(claimantId).build();
    }

    public boolean hasLimit() {
        return limit != null && limit > 0;
    }

    /**
     * Checks whether the claim satisfies every set criterion.
     */
    public boolean matches(Claim claim) {
        if (!statuses.isEmpty() && !statuses.contains(claim.getStatus())) {
            return false;
        }
        if (domain != null && !domain.equals(claim.getDomain())) {
            return false;
        }
        if (priority != null && priority != claim.getPriority()) {
            return false;
        }
        if (claimantId != null && !claimantId.equals(claim.getClaimantId())) {
            return false;
        }
        if (type != null && type != claim.getType()) {
            return false;
        }
        return tags.isEmpty() || tags.stream().anyMatch(claim::hasTag);
    }
}
