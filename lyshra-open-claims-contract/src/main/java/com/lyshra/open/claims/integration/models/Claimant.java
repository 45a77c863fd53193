package com.lyshra.open.claims.integration.models;

import com.lyshra.open.claims.integration.enumerations.ClaimantKind;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.io.Serial;
import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * A participant that can hold claims: an autonomous agent or a human.
 *
 * The variant is carried by {@link #getKind()} rather than a subclass so that
 * every component handles both kinds through the same value type.
 *
 * Thread Safety: This class is immutable and thread-safe.
 */
@Getter
@Builder(toBuilder = true)
@ToString
@EqualsAndHashCode
public final class Claimant implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * Stable identifier of the claimant (e.g. {@code agent-tg-1}, {@code user-alice}).
     */
    private final String id;

    private final ClaimantKind kind;

    /**
     * Display name.
     */
    private final String name;

    /**
     * Work domain the claimant specializes in. Optional for humans.
     */
    private final String domain;

    /**
     * Agent implementation type. Only meaningful for agents.
     */
    private final String agentType;

    private Claimant(String id, ClaimantKind kind, String name, String domain, String agentType) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.name = name != null ? name : id;
        this.domain = domain;
        this.agentType = agentType;
    }

    public static Claimant agent(String id, String name, String domain, String agentType) {
        return new Claimant(id, ClaimantKind.AGENT, name, domain, agentType);
    }

    public static Claimant agent(String id, String domain) {
        return agent(id, id, domain, null);
    }

    public static Claimant human(String id, String name, String domain) {
        return new Claimant(id, ClaimantKind.HUMAN, name, domain, null);
    }

    public static Claimant human(String id, String name) {
        return human(id, name, null);
    }

    public boolean isAgent() {
        return kind == ClaimantKind.AGENT;
    }

    public boolean isHuman() {
        return kind == ClaimantKind.HUMAN;
    }

    public Optional<String> getDomainOptional() {
        return Optional.ofNullable(domain);
    }

    /**
     * Checks whether this claimant works in the given domain.
     * A claimant without a domain matches nothing.
     */
    public boolean isInDomain(String otherDomain) {
        return domain != null && domain.equals(otherDomain);
    }
}
