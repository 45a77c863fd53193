package com.lyshra.open.claims.integration.enumerations;

import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Discriminator of the claimant variant.
 */
@AllArgsConstructor
@Getter
public enum ClaimantKind {

    /**
     * Autonomous agent. Short leases, retryable work.
     */
    AGENT("agent"),

    /**
     * Human participant. Long leases, manual re-claim after expiry.
     */
    HUMAN("human");

    private final String code;

    public static ClaimantKind fromCode(String code) {
        for (ClaimantKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code)) {
                return kind;
            }
        }
        throw ClaimValidationException.invalidValue("claimantKind", code);
    }
}
