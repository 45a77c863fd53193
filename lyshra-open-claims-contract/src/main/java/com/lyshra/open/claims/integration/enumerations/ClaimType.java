package com.lyshra.open.claims.integration.enumerations;

import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Kind of QE work a claim represents.
 * The set is closed; producers select one of these when creating a claim.
 */
@AllArgsConstructor
@Getter
public enum ClaimType {

    /**
     * Source code that lacks test coverage.
     */
    COVERAGE_GAP("coverage-gap"),

    /**
     * A test that passes and fails non-deterministically.
     */
    FLAKY_TEST("flaky-test"),

    /**
     * A reported defect that needs root-cause analysis.
     */
    DEFECT_INVESTIGATION("defect-investigation"),

    /**
     * Generated or modified tests that need review.
     */
    TEST_REVIEW("test-review");

    private final String code;

    /**
     * Resolves a claim type from its wire code (e.g. {@code "flaky-test"}).
     *
     * @throws ClaimValidationException if the code is unknown
     */
    public static ClaimType fromCode(String code) {
        for (ClaimType type : values()) {
            if (type.code.equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw ClaimValidationException.invalidValue("type", code);
    }
}
