package com.evidence.consensus.core.model;

import java.util.Locale;

/**
 * Coarse reliability bucket assigned to a source. TIER_1 is the most reliable.
 */
public enum QualityTier {
    TIER_1("Tier 1"),
    TIER_2("Tier 2"),
    TIER_3("Tier 3"),
    UNKNOWN("Unknown");

    private final String label;

    QualityTier(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Parses "Tier 1", "Tier1", "tier_1" or "TIER_1". Anything else is UNKNOWN.
     */
    public static QualityTier fromLabel(String label) {
        if (label == null) {
            return UNKNOWN;
        }
        String key = label.replaceAll("[\\s_\\-]", "").toLowerCase(Locale.ROOT);
        return switch (key) {
            case "tier1" -> TIER_1;
            case "tier2" -> TIER_2;
            case "tier3" -> TIER_3;
            default -> UNKNOWN;
        };
    }
}
