package com.evidence.consensus.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of aggregating the estimates of one {@link ValueKind}.
 * Recomputed from scratch on every aggregation run.
 *
 * <p>Invariants: {@code rangeLow <= recommendedValue <= rangeHigh} whenever
 * {@code estimateCount > 0}; {@code confidence == LOW} whenever {@code estimateCount == 0}.</p>
 *
 * @param targetId               target the consensus was computed for, may be null
 * @param valueKind              kind of the aggregated values
 * @param recommendedValue       weighted median, null when no estimate survived filtering
 * @param simpleMedian           unweighted median of the accepted values
 * @param rangeLow               smallest accepted value
 * @param rangeHigh              largest accepted value
 * @param estimateCount          number of accepted estimates
 * @param tier1Count             number of accepted Tier 1 estimates
 * @param coefficientOfVariation stdev/mean of the accepted values, rounded to 3 decimals
 * @param confidence             confidence classification
 * @param rationale              human-readable explanation of the classification
 * @param values                 accepted raw values in input order
 * @param rejectedValues         values dropped for falling outside the declared domain
 */
public record ConsensusResult(
        String targetId,
        ValueKind valueKind,
        Double recommendedValue,
        Double simpleMedian,
        Double rangeLow,
        Double rangeHigh,
        int estimateCount,
        int tier1Count,
        double coefficientOfVariation,
        ConfidenceLevel confidence,
        String rationale,
        List<Double> values,
        List<Double> rejectedValues
) {
    public static final String NO_ESTIMATES_RATIONALE = "no estimates available";

    public ConsensusResult {
        Objects.requireNonNull(valueKind, "valueKind is required");
        Objects.requireNonNull(confidence, "confidence is required");
        values = values != null ? List.copyOf(values) : List.of();
        rejectedValues = rejectedValues != null ? List.copyOf(rejectedValues) : List.of();
    }

    /**
     * Creates the degraded result for a kind with no usable estimates.
     */
    public static ConsensusResult empty(String targetId, ValueKind valueKind, List<Double> rejectedValues) {
        return new ConsensusResult(targetId, valueKind, null, null, null, null, 0, 0, 0.0,
                ConfidenceLevel.LOW, NO_ESTIMATES_RATIONALE, List.of(), rejectedValues);
    }

    public boolean isEmpty() {
        return estimateCount == 0;
    }

    @Override
    public String toString() {
        return "ConsensusResult{" +
                "targetId='" + targetId + '\'' +
                ", kind=" + valueKind +
                ", recommended=" + recommendedValue +
                ", range=[" + rangeLow + ", " + rangeHigh + "]" +
                ", n=" + estimateCount +
                ", tier1=" + tier1Count +
                ", cv=" + coefficientOfVariation +
                ", confidence=" + confidence +
                ", rejected=" + rejectedValues.size() +
                '}';
    }
}
