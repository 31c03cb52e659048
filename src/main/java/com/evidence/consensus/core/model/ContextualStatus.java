package com.evidence.consensus.core.model;

import java.util.Objects;

/**
 * Approval classification of an entity scoped to one context (e.g. one disease).
 */
public record ContextualStatus(String contextId, ApprovalClassification status, DevelopmentPhase phase) {

    public ContextualStatus {
        Objects.requireNonNull(contextId, "contextId is required");
        Objects.requireNonNull(status, "status is required");
        Objects.requireNonNull(phase, "phase is required");
    }

    public boolean isApproved() {
        return status == ApprovalClassification.APPROVED;
    }
}
