package com.evidence.consensus.core.model;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * One sighting of a tracked entity (e.g. a drug) from one origin batch
 * such as a trial search, a news search or a discontinuation search.
 *
 * <p>{@code statusDetail} is only kept when the status is terminal.
 * {@code statusOverride} marks an explicit override source allowed to reactivate
 * an entity that another sighting reported as discontinued, failed or on hold.</p>
 */
public record CandidateEntity(
        String canonicalNameRaw,
        String aliasCode,
        DevelopmentPhase phase,
        DevelopmentStatus developmentStatus,
        StatusDetail statusDetail,
        Map<String, Object> attributes,
        Set<String> sourceRefs,
        boolean statusOverride
) {
    public CandidateEntity {
        Objects.requireNonNull(canonicalNameRaw, "canonicalNameRaw is required");
        aliasCode = aliasCode != null && !aliasCode.isBlank() ? aliasCode.trim() : null;
        phase = phase != null ? phase : DevelopmentPhase.UNKNOWN;
        developmentStatus = developmentStatus != null ? developmentStatus : DevelopmentStatus.ACTIVE;
        statusDetail = developmentStatus.isTerminal() ? statusDetail : null;
        attributes = Attributes.copyOf(attributes);
        sourceRefs = Attributes.copyOfRefs(sourceRefs);
    }

    public Optional<Object> attribute(String name) {
        return Optional.ofNullable(attributes.get(name));
    }

    public boolean isTerminal() {
        return developmentStatus.isTerminal();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String canonicalNameRaw;
        private String aliasCode;
        private DevelopmentPhase phase;
        private DevelopmentStatus developmentStatus;
        private StatusDetail statusDetail;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final Set<String> sourceRefs = new LinkedHashSet<>();
        private boolean statusOverride;

        public Builder canonicalNameRaw(String canonicalNameRaw) {
            this.canonicalNameRaw = canonicalNameRaw;
            return this;
        }

        public Builder aliasCode(String aliasCode) {
            this.aliasCode = aliasCode;
            return this;
        }

        public Builder phase(DevelopmentPhase phase) {
            this.phase = phase;
            return this;
        }

        public Builder developmentStatus(DevelopmentStatus developmentStatus) {
            this.developmentStatus = developmentStatus;
            return this;
        }

        public Builder statusDetail(StatusDetail statusDetail) {
            this.statusDetail = statusDetail;
            return this;
        }

        public Builder attribute(String name, Object value) {
            if (value != null) {
                this.attributes.put(name, value);
            }
            return this;
        }

        public Builder attributes(Map<String, ?> attributes) {
            if (attributes != null) {
                attributes.forEach(this::attribute);
            }
            return this;
        }

        public Builder sourceRef(String sourceRef) {
            this.sourceRefs.add(sourceRef);
            return this;
        }

        public Builder sourceRefs(Collection<String> sourceRefs) {
            if (sourceRefs != null) {
                this.sourceRefs.addAll(sourceRefs);
            }
            return this;
        }

        public Builder statusOverride(boolean statusOverride) {
            this.statusOverride = statusOverride;
            return this;
        }

        public CandidateEntity build() {
            return new CandidateEntity(canonicalNameRaw, aliasCode, phase, developmentStatus,
                    statusDetail, attributes, sourceRefs, statusOverride);
        }
    }
}
