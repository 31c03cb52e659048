package com.evidence.consensus.pipeline;

import com.evidence.consensus.core.model.ConsensusResult;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.Severity;
import com.evidence.consensus.core.model.ValidationIssue;
import com.evidence.consensus.core.model.ValueKind;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * The complete output for one target. Built in full before it is published.
 */
public record TargetAggregate(
        String targetId,
        Map<ValueKind, ConsensusResult> consensus,
        List<MergedEntity> entities,
        List<ValidationIssue> issues
) {
    public TargetAggregate {
        Objects.requireNonNull(targetId, "targetId is required");
        consensus = consensus.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(consensus));
        entities = List.copyOf(entities);
        issues = List.copyOf(issues);
    }

    public Optional<ConsensusResult> consensusFor(ValueKind kind) {
        return Optional.ofNullable(consensus.get(kind));
    }

    public Optional<MergedEntity> entity(String identityKey) {
        return entities.stream()
                .filter(e -> e.identityKey().equals(identityKey))
                .findFirst();
    }

    public List<ValidationIssue> issuesOf(Severity severity) {
        return issues.stream()
                .filter(i -> i.severity() == severity)
                .toList();
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(i -> i.severity() == Severity.ERROR);
    }
}
