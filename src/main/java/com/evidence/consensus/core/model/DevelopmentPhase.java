package com.evidence.consensus.core.model;

/**
 * Clinical/regulatory development phase of an entity.
 * The default rank orders phases so that a lower rank is more advanced;
 * deployments may override ranks through {@code PhaseRanking}.
 */
public enum DevelopmentPhase {
    APPROVED(1, "Approved"),
    REGULATORY_FILING(2, "Regulatory Filing"),
    PHASE_3(3, "Phase 3"),
    PHASE_2(4, "Phase 2"),
    PHASE_1(5, "Phase 1"),
    PRECLINICAL(6, "Preclinical"),
    UNKNOWN(7, "Unknown");

    private final int defaultRank;
    private final String label;

    DevelopmentPhase(int defaultRank, String label) {
        this.defaultRank = defaultRank;
        this.label = label;
    }

    public int getDefaultRank() {
        return defaultRank;
    }

    public String getLabel() {
        return label;
    }
}
