package com.lyshra.open.claims.integration.models;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome recorded on a claim when its owner completes it.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public final class ClaimResult implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final boolean success;
    private final String summary;

    /**
     * References to produced artifacts (file paths, report ids, PR links).
     */
    private final List<String> artifacts;

    private final Duration timeSpent;

    private ClaimResult(boolean success, String summary, List<String> artifacts, Duration timeSpent) {
        this.success = success;
        this.summary = summary;
        this.artifacts = artifacts != null
                ? Collections.unmodifiableList(new ArrayList<>(artifacts))
                : Collections.emptyList();
        this.timeSpent = timeSpent;
    }

    public static ClaimResult success(String summary) {
        return ClaimResult.builder().success(true).summary(summary).build();
    }

    public static ClaimResult failure(String summary) {
        return ClaimResult.builder().success(false).summary(summary).build();
    }
}
