package com.evidence.consensus.identity;

import com.evidence.consensus.core.model.ValidationIssue;

import java.util.List;

/**
 * Identity resolutions for a batch of candidates, aligned with the input order,
 * plus the batch-level diagnostics (external-id conflicts and links).
 */
public record ResolutionBatch(List<IdentityResolution> resolutions, List<ValidationIssue> issues) {

    public ResolutionBatch {
        resolutions = List.copyOf(resolutions);
        issues = List.copyOf(issues);
    }

    public IdentityResolution get(int index) {
        return resolutions.get(index);
    }

    public int size() {
        return resolutions.size();
    }
}
