package com.evidence.consensus.validation;

import com.evidence.consensus.config.ConsensusConfig;
import com.evidence.consensus.config.ValidationConfig;
import com.evidence.consensus.config.ValueDomain;
import com.evidence.consensus.core.model.ConsensusResult;
import com.evidence.consensus.core.model.ValidationIssue;
import com.evidence.consensus.core.model.ValueKind;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Built-in rules over consensus results.
 * Issue fields are the value-kind label ("prevalence", "failureRate", ...).
 */
public final class ConsensusRules {

    private ConsensusRules() {
        // Utility class
    }

    /**
     * All built-in consensus rules, in reporting order.
     */
    public static List<ValidationRule<ConsensusResult>> defaults(ValidationConfig config, ConsensusConfig consensusConfig) {
        return List.of(
                domain(consensusConfig),
                missingEstimates(),
                wideSpread(config.wideSpreadRatio()),
                roundNumbers(config.roundNumberUnit()),
                rareDiseasePrevalence(config.rareDiseasePrevalenceLimit()),
                failureRateSpread(config.failureRateSpreadPoints()),
                lowTreatmentRate(config.lowTreatmentRatePercent())
        );
    }

    /**
     * Values outside the kind's declared domain: one error per rejected value, plus one if
     * the recommended value itself lies outside.
     */
    public static ValidationRule<ConsensusResult> domain(ConsensusConfig consensusConfig) {
        return ValidationRule.of("domain", result -> {
            ValueDomain domain = consensusConfig.domainFor(result.valueKind());
            List<ValidationIssue> issues = new ArrayList<>();
            for (Double value : result.rejectedValues()) {
                issues.add(ValidationIssue.error(field(result),
                        "Invalid " + result.valueKind().getLabel() + " value " + format(value)
                                + ", outside " + domain.describe(),
                        "Extraction error - value excluded from consensus"));
            }
            if (result.recommendedValue() != null && !domain.contains(result.recommendedValue())) {
                issues.add(ValidationIssue.error(field(result),
                        "Recommended " + result.valueKind().getLabel() + " " + format(result.recommendedValue())
                                + " outside " + domain.describe(),
                        "Check consensus configuration"));
            }
            return issues;
        });
    }

    public static ValidationRule<ConsensusResult> missingEstimates() {
        return ValidationRule.of("missing-estimates", result -> {
            if (!result.isEmpty()) {
                return List.of();
            }
            return List.of(ValidationIssue.warning(field(result),
                    "No " + result.valueKind().getLabel() + " estimates extracted",
                    "Check search results and extraction prompt"));
        });
    }

    public static ValidationRule<ConsensusResult> wideSpread(double maxRatio) {
        return ValidationRule.of("wide-spread", result -> {
            if (result.values().size() < 2) {
                return List.of();
            }
            double min = Collections.min(result.values());
            double max = Collections.max(result.values());
            if (min <= 0.0 || max / min <= maxRatio) {
                return List.of();
            }
            return List.of(ValidationIssue.warning(field(result),
                    String.format(Locale.ROOT, "Wide %s range: %s to %s (>%sx spread)",
                            result.valueKind().getLabel(), format(min), format(max), format(maxRatio)),
                    "Review sources for methodology differences or extraction errors"));
        });
    }

    public static ValidationRule<ConsensusResult> roundNumbers(double unit) {
        return ValidationRule.of("round-numbers", result -> {
            if (result.values().size() < 2) {
                return List.of();
            }
            for (double value : result.values()) {
                if (value % unit != 0.0) {
                    return List.of();
                }
            }
            return List.of(ValidationIssue.info(field(result),
                    "All estimates are round numbers - may be rough estimates",
                    "Look for more precise data sources"));
        });
    }

    /**
     * Prevalence above the limit for a target whose id marks it as rare.
     */
    public static ValidationRule<ConsensusResult> rareDiseasePrevalence(double limit) {
        return ValidationRule.of("rare-disease-prevalence", result -> {
            if (result.valueKind() != ValueKind.PREVALENCE || result.isEmpty() || result.targetId() == null
                    || !result.targetId().toLowerCase(Locale.ROOT).contains("rare")) {
                return List.of();
            }
            if (result.simpleMedian() <= limit) {
                return List.of();
            }
            return List.of(ValidationIssue.warning(field(result),
                    "High prevalence (" + format(result.simpleMedian()) + ") for disease labeled 'rare'",
                    "Verify disease classification or prevalence data"));
        });
    }

    public static ValidationRule<ConsensusResult> failureRateSpread(double maxPoints) {
        return ValidationRule.of("failure-rate-spread", result -> {
            if (result.valueKind() != ValueKind.FAILURE_RATE || result.values().size() < 2) {
                return List.of();
            }
            double min = Collections.min(result.values());
            double max = Collections.max(result.values());
            if (max - min <= maxPoints) {
                return List.of();
            }
            return List.of(ValidationIssue.warning(field(result),
                    String.format(Locale.ROOT, "High variability in failure rates: %.0f%% to %.0f%%", min, max),
                    "Check if studies use different failure definitions or timepoints"));
        });
    }

    public static ValidationRule<ConsensusResult> lowTreatmentRate(double thresholdPercent) {
        return ValidationRule.of("low-treatment-rate", result -> {
            if (result.valueKind() != ValueKind.TREATMENT_RATE || result.recommendedValue() == null
                    || result.recommendedValue() >= thresholdPercent) {
                return List.of();
            }
            return List.of(ValidationIssue.info(field(result),
                    "Low treatment rate (" + format(result.recommendedValue()) + "%) - verify this is disease-specific",
                    "Confirm data refers to relevant treatment type"));
        });
    }

    private static String field(ConsensusResult result) {
        return result.valueKind().getLabel();
    }

    static String format(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.format(Locale.ROOT, "%,d", (long) value);
        }
        return String.format(Locale.ROOT, "%,.2f", value);
    }
}
