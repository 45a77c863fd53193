package com.lyshra.open.claims.integration.models;

import com.lyshra.open.claims.integration.enumerations.ClaimPriority;
import com.lyshra.open.claims.integration.enumerations.ClaimType;
import com.lyshra.open.claims.integration.exception.ClaimValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Input for creating a new claim. Produced by whatever detected the work.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public final class CreateClaimRequest {

    private final ClaimType type;
    private final ClaimPriority priority;
    private final String domain;
    private final String title;
    private final String description;

    @Singular("tag")
    private final List<String> tags;

    @Singular("metadataEntry")
    private final Map<String, String> metadata;

    private final String correlationId;

    public static CreateClaimRequest of(ClaimType type,
                                        ClaimPriority priority,
                                        String domain,
                                        String title,
                                        Map<String, String> metadata) {
        CreateClaimRequestBuilder builder = CreateClaimRequest.builder()
                .type(type)
                .priority(priority)
                .domain(domain)
                .title(title);
        if (metadata != null) {
            builder.metadata(metadata);
        }
        return builder.build();
    }

    /**
     * Validates that all required fields are present.
     *
     * @throws ClaimValidationException if a required field is missing or blank
     */
    public void validate() {
        if (type == null) {
            throw ClaimValidationException.missingField("type");
        }
        if (priority == null) {
            throw ClaimValidationException.missingField("priority");
        }
        if (domain == null || domain.isBlank()) {
            throw ClaimValidationException.missingField("domain");
        }
        if (title == null || title.isBlank()) {
            throw ClaimValidationException.missingField("title");
        }
    }
}
