package com.evidence.consensus.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Canonical record after resolving every {@link CandidateEntity} that shares one identity key.
 *
 * <p>A terminal {@code developmentStatus} is sticky: it only returns to ACTIVE when an
 * explicit override source took part in the merge ({@code statusOverridden}).
 * {@code highestPhaseReached} is the most advanced phase any input reported, kept for
 * audit even when the terminal status pins {@code phase} to the stage the program stopped at.</p>
 *
 * <p>{@code drugKey} is the stable {@code DRG-NAME-CHECKSUM} display key derived from the
 * identity key, or null when the resolver could not derive one.</p>
 *
 * <p>{@code contextualStatus} is populated by the status verifier; it is a per-context
 * view and never changes the canonical fields.</p>
 */
public record MergedEntity(
        String identityKey,
        String drugKey,
        String canonicalNameRaw,
        String aliasCode,
        DevelopmentPhase phase,
        DevelopmentPhase highestPhaseReached,
        DevelopmentStatus developmentStatus,
        StatusDetail statusDetail,
        boolean statusOverridden,
        Map<String, Object> attributes,
        Set<String> mergedSourceRefs,
        Map<String, ContextualStatus> contextualStatus
) {
    public MergedEntity {
        Objects.requireNonNull(identityKey, "identityKey is required");
        Objects.requireNonNull(canonicalNameRaw, "canonicalNameRaw is required");
        phase = phase != null ? phase : DevelopmentPhase.UNKNOWN;
        highestPhaseReached = highestPhaseReached != null ? highestPhaseReached : phase;
        developmentStatus = developmentStatus != null ? developmentStatus : DevelopmentStatus.ACTIVE;
        statusDetail = developmentStatus.isTerminal() ? statusDetail : null;
        statusOverridden = statusOverridden && !developmentStatus.isTerminal();
        attributes = Attributes.copyOf(attributes);
        mergedSourceRefs = Attributes.copyOfRefs(mergedSourceRefs);
        contextualStatus = contextualStatus != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(contextualStatus))
                : Map.of();
    }

    /**
     * Lifts a single sighting into a merged record under the given identity key.
     */
    public static MergedEntity from(CandidateEntity candidate, String identityKey) {
        return from(candidate, identityKey, null);
    }

    public static MergedEntity from(CandidateEntity candidate, String identityKey, String drugKey) {
        return new MergedEntity(
                identityKey,
                drugKey,
                candidate.canonicalNameRaw(),
                candidate.aliasCode(),
                candidate.phase(),
                candidate.phase(),
                candidate.developmentStatus(),
                candidate.statusDetail(),
                candidate.statusOverride() && !candidate.isTerminal(),
                candidate.attributes(),
                candidate.sourceRefs(),
                Map.of()
        );
    }

    /**
     * Same as {@link #mergedSourceRefs()}; a merged record's own sources are the union of its inputs.
     */
    public Set<String> sourceRefs() {
        return mergedSourceRefs;
    }

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public Optional<String> attributeAsString(String name) {
        Object value = attributes.get(name);
        return value instanceof String s ? Optional.of(s) : Optional.empty();
    }

    public boolean isTerminal() {
        return developmentStatus.isTerminal();
    }

    public Optional<ContextualStatus> statusIn(String contextId) {
        return Optional.ofNullable(contextualStatus.get(contextId));
    }

    /**
     * Returns a copy with the given per-context status added or replaced.
     */
    public MergedEntity withContextualStatus(ContextualStatus status) {
        Map<String, ContextualStatus> updated = new LinkedHashMap<>(contextualStatus);
        updated.put(status.contextId(), status);
        return new MergedEntity(identityKey, drugKey, canonicalNameRaw, aliasCode, phase, highestPhaseReached,
                developmentStatus, statusDetail, statusOverridden, attributes, mergedSourceRefs, updated);
    }

    @Override
    public String toString() {
        return "MergedEntity{" +
                "identityKey='" + identityKey + '\'' +
                ", drugKey=" + drugKey +
                ", name='" + canonicalNameRaw + '\'' +
                ", phase=" + phase +
                ", highestPhaseReached=" + highestPhaseReached +
                ", status=" + developmentStatus +
                ", sources=" + mergedSourceRefs.size() +
                ", contexts=" + contextualStatus.keySet() +
                '}';
    }
}
