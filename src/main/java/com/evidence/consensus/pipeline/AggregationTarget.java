package com.evidence.consensus.pipeline;

import com.evidence.consensus.core.model.CandidateEntity;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.ValueKind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Everything known about one target (e.g. one disease) for a single aggregation run.
 *
 * @param targetId      the target identifier, also used as the default context
 * @param estimates     scalar observations for the target
 * @param candidates    entity sightings for the target
 * @param contextIds    contexts to verify entity status in; defaults to the target itself
 * @param requiredKinds value kinds that always get a consensus, even with no estimates
 */
public record AggregationTarget(
        String targetId,
        List<SourceEstimate> estimates,
        List<CandidateEntity> candidates,
        List<String> contextIds,
        Set<ValueKind> requiredKinds
) {
    public AggregationTarget {
        Objects.requireNonNull(targetId, "targetId is required");
        estimates = estimates != null ? List.copyOf(estimates) : List.of();
        candidates = candidates != null ? List.copyOf(candidates) : List.of();
        contextIds = contextIds != null && !contextIds.isEmpty() ? List.copyOf(contextIds) : List.of(targetId);
        requiredKinds = requiredKinds != null && !requiredKinds.isEmpty()
                ? Set.copyOf(requiredKinds) : Set.of();
    }

    public boolean isEmpty() {
        return estimates.isEmpty() && candidates.isEmpty();
    }

    public static Builder builder(String targetId) {
        return new Builder(targetId);
    }

    public static class Builder {
        private final String targetId;
        private final List<SourceEstimate> estimates = new ArrayList<>();
        private final List<CandidateEntity> candidates = new ArrayList<>();
        private final List<String> contextIds = new ArrayList<>();
        private final Set<ValueKind> requiredKinds = EnumSet.noneOf(ValueKind.class);

        private Builder(String targetId) {
            this.targetId = targetId;
        }

        public Builder estimate(SourceEstimate estimate) {
            this.estimates.add(estimate);
            return this;
        }

        public Builder estimates(Collection<SourceEstimate> estimates) {
            this.estimates.addAll(estimates);
            return this;
        }

        public Builder candidate(CandidateEntity candidate) {
            this.candidates.add(candidate);
            return this;
        }

        public Builder candidates(Collection<CandidateEntity> candidates) {
            this.candidates.addAll(candidates);
            return this;
        }

        public Builder context(String contextId) {
            this.contextIds.add(contextId);
            return this;
        }

        public Builder require(ValueKind... kinds) {
            this.requiredKinds.addAll(List.of(kinds));
            return this;
        }

        public AggregationTarget build() {
            return new AggregationTarget(targetId, estimates, candidates, contextIds, requiredKinds);
        }
    }
}
