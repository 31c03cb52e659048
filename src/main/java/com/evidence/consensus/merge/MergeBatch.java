package com.evidence.consensus.merge;

import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.ValidationIssue;

import java.util.List;
import java.util.Optional;

/**
 * Result of merging a batch of candidates: one entity per identity key, in order of
 * first appearance, and the identity diagnostics raised while grouping.
 */
public record MergeBatch(List<MergedEntity> entities, List<ValidationIssue> issues) {

    private static final MergeBatch EMPTY = new MergeBatch(List.of(), List.of());

    public MergeBatch {
        entities = List.copyOf(entities);
        issues = List.copyOf(issues);
    }

    public static MergeBatch empty() {
        return EMPTY;
    }

    public Optional<MergedEntity> find(String identityKey) {
        return entities.stream()
                .filter(e -> e.identityKey().equals(identityKey))
                .findFirst();
    }

    public boolean isEmpty() {
        return entities.isEmpty();
    }
}
