package com.evidence.consensus.core.model;

/**
 * Severity of a {@link ValidationIssue}. None of them blocks a pipeline run.
 */
public enum Severity {
    INFO("info"),
    WARNING("warning"),
    ERROR("error");

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }
}
