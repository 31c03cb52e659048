package com.evidence.consensus.core.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of scalar fact a {@link SourceEstimate} reports.
 * A consensus is only ever computed over estimates of a single kind.
 */
public enum ValueKind {
    PREVALENCE("prevalence", false),
    INCIDENCE("incidence", false),
    FAILURE_RATE("failureRate", true),
    TREATMENT_RATE("treatmentRate", true);

    private final String label;
    private final boolean percentage;

    ValueKind(String label, boolean percentage) {
        this.label = label;
        this.percentage = percentage;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Returns true if values of this kind are percentages.
     */
    public boolean isPercentage() {
        return percentage;
    }

    /**
     * Parses a label such as "prevalence", "failure_rate" or "FAILURE_RATE".
     */
    public static Optional<ValueKind> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        String key = label.trim().replace("_", "").replace("-", "").replace(" ", "").toLowerCase(Locale.ROOT);
        for (ValueKind kind : values()) {
            if (kind.label.toLowerCase(Locale.ROOT).equals(key)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
