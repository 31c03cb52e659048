package com.evidence.consensus.config;

/**
 * Thresholds used by the plausibility rules.
 *
 * @param wideSpreadRatio            max/min ratio above which a spread is flagged
 * @param roundNumberUnit            unit all values must be divisible by to be flagged as rough
 * @param failureRateSpreadPoints    failure-rate range (percentage points) above which a warning is raised
 * @param lowTreatmentRatePercent    treatment rate below which an info issue is raised
 * @param rareDiseasePrevalenceLimit prevalence above which a "rare" target is flagged
 */
public record ValidationConfig(
        double wideSpreadRatio,
        double roundNumberUnit,
        double failureRateSpreadPoints,
        double lowTreatmentRatePercent,
        double rareDiseasePrevalenceLimit
) {
    public ValidationConfig {
        if (wideSpreadRatio <= 1.0) {
            throw new IllegalArgumentException("wideSpreadRatio must be > 1.0");
        }
        if (roundNumberUnit <= 0.0) {
            throw new IllegalArgumentException("roundNumberUnit must be positive");
        }
        if (failureRateSpreadPoints < 0.0 || lowTreatmentRatePercent < 0.0 || rareDiseasePrevalenceLimit < 0.0) {
            throw new IllegalArgumentException("Validation thresholds must be non-negative");
        }
    }

    public static ValidationConfig defaults() {
        return new ValidationConfig(10.0, 10_000.0, 50.0, 20.0, 200_000.0);
    }
}
