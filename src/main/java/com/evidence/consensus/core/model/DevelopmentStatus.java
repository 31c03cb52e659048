package com.evidence.consensus.core.model;

/**
 * Development status of a tracked entity.
 * Every status other than ACTIVE is terminal and sticky across merges.
 */
public enum DevelopmentStatus {
    ACTIVE("active"),
    DISCONTINUED("discontinued"),
    FAILED("failed"),
    ON_HOLD("onHold");

    private final String label;

    DevelopmentStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isTerminal() {
        return this != ACTIVE;
    }
}
