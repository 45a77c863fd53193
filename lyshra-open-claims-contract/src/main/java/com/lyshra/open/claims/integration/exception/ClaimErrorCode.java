package com.lyshra.open.claims.integration.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;

@AllArgsConstructor
@Getter
public enum ClaimErrorCode {

    VALIDATION_FAILED(
            "CLAIM_ERR_0001",
            "Invalid claim request: %s",
            "Correct the request input and retry."
    ),

    CLAIM_NOT_FOUND(
            "CLAIM_ERR_0002",
            "Claim not found: %s",
            "Verify the claim id."
    ),

    VERSION_CONFLICT(
            "CLAIM_ERR_0003",
            "Claim %s was modified concurrently (expected version %d, actual %d)",
            "Re-read the claim and retry the operation if it still applies."
    ),

    INVALID_TRANSITION(
            "CLAIM_ERR_0004",
            "Cannot %s claim %s in status %s",
            "Check the claim status before issuing the operation."
    ),

    NOT_OWNER(
            "CLAIM_ERR_0005",
            "Claimant %s does not own claim %s (owner: %s)",
            "Only the current owner may perform this operation."
    ),

    ALREADY_CLAIMED(
            "CLAIM_ERR_0006",
            "Claim %s is already claimed by %s",
            "Pick another available claim."
    ),

    HANDOFF_NOT_FOUND(
            "CLAIM_ERR_0007",
            "Handoff not found: %s",
            "Verify the handoff id."
    ),

    HANDOFF_ALREADY_RESOLVED(
            "CLAIM_ERR_0008",
            "Handoff %s is already %s",
            "Only pending handoffs can be completed or cancelled."
    ),

    NOT_OWNED_BY_REQUESTER(
            "CLAIM_ERR_0009",
            "Claimant %s does not hold an active claim %s",
            "Only the current owner of an active claim may request a handoff."
    ),

    STEAL_LIMIT_EXCEEDED(
            "CLAIM_ERR_0010",
            "Claim %s has been stolen %d times (limit %d)",
            "Review the claim manually; it keeps stalling with every claimant."
    )

    ;

    private final String errorCode;
    private final String errorTemplate;
    private final String resolution;

    public String format(Object... args) {
        return String.format(errorTemplate, args);
    }
}
