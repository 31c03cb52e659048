package com.evidence.consensus.consensus;

import com.evidence.consensus.config.ConsensusConfig;
import com.evidence.consensus.config.ValueDomain;
import com.evidence.consensus.core.model.ConfidenceLevel;
import com.evidence.consensus.core.model.ConsensusResult;
import com.evidence.consensus.core.model.QualityTier;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.ValueKind;
import com.evidence.consensus.scoring.QualityRecencyScorer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Reduces the estimates of one value kind into a recommended value and a confidence level.
 *
 * <p>Algorithm:</p>
 * <ol>
 *   <li>Keep estimates of the requested kind with a value inside the kind's domain.
 *       Out-of-domain values are listed in {@link ConsensusResult#rejectedValues()} and
 *       reported by the plausibility validator, never clamped.</li>
 *   <li>No estimates left: LOW confidence, "no estimates available".</li>
 *   <li>Simple median over the raw values.</li>
 *   <li>Weighted median: each value is repeated {@code round(weight * replicationFactor)}
 *       times and the median of that multiset is taken.</li>
 *   <li>CV = sample stdev / mean when more than one value, else 0.</li>
 *   <li>HIGH if tier1 &gt;= 2 and CV &lt; 0.3; MEDIUM if tier1 &gt;= 1 and CV &lt; 0.5; LOW otherwise.</li>
 * </ol>
 *
 * <p>Never throws on data: a malformed estimate is excluded, not fatal to the batch.</p>
 */
public class WeightedConsensusCalculator {
    private static final Logger log = LoggerFactory.getLogger(WeightedConsensusCalculator.class);

    private final QualityRecencyScorer scorer;
    private final ConsensusConfig config;

    public WeightedConsensusCalculator() {
        this(new QualityRecencyScorer(), ConsensusConfig.defaults());
    }

    public WeightedConsensusCalculator(QualityRecencyScorer scorer, ConsensusConfig config) {
        this.scorer = scorer;
        this.config = config;
    }

    /**
     * Computes the consensus of the estimates matching {@code valueKind}.
     */
    public ConsensusResult consensus(Collection<SourceEstimate> estimates, ValueKind valueKind) {
        return consensus(null, estimates, valueKind);
    }

    /**
     * Computes the consensus of the estimates matching {@code valueKind} for a named target.
     *
     * @param targetId  target the estimates describe (e.g. a disease), may be null
     * @param estimates candidate estimates of any kind; may be empty
     * @param valueKind kind to aggregate
     * @return the consensus; LOW confidence when nothing usable remains
     */
    public ConsensusResult consensus(String targetId, Collection<SourceEstimate> estimates, ValueKind valueKind) {
        ValueDomain domain = config.domainFor(valueKind);
        List<SourceEstimate> accepted = new ArrayList<>();
        List<Double> rejected = new ArrayList<>();

        if (estimates != null) {
            for (SourceEstimate estimate : estimates) {
                if (estimate == null || estimate.valueKind() != valueKind || !estimate.hasValue()) {
                    continue;
                }
                if (!domain.contains(estimate.value())) {
                    rejected.add(estimate.value());
                    log.warn("consensus.excluded kind={} sourceId={} value={} domain={}",
                            valueKind.getLabel(), estimate.sourceId(), estimate.value(), domain.describe());
                    continue;
                }
                accepted.add(estimate);
            }
        }

        if (accepted.isEmpty()) {
            log.debug("consensus.empty targetId={} kind={} rejected={}", targetId, valueKind.getLabel(), rejected.size());
            return ConsensusResult.empty(targetId, valueKind, rejected);
        }

        List<Double> rawValues = accepted.stream().map(SourceEstimate::value).toList();
        double simpleMedian = median(rawValues.stream().mapToDouble(Double::doubleValue).toArray());
        double weightedMedian = weightedMedian(accepted, simpleMedian);

        double cv = coefficientOfVariation(rawValues);
        int tier1Count = (int) accepted.stream()
                .filter(e -> e.qualityTier() == QualityTier.TIER_1)
                .count();

        ConfidenceLevel confidence;
        String rationale;
        if (tier1Count >= config.getHighConfidenceMinTier1() && cv < config.getHighConfidenceMaxCv()) {
            confidence = ConfidenceLevel.HIGH;
            rationale = String.format(Locale.ROOT, "%d Tier-1 sources agree within %s CV",
                    tier1Count, percent(config.getHighConfidenceMaxCv()));
        } else if (tier1Count >= config.getMediumConfidenceMinTier1() && cv < config.getMediumConfidenceMaxCv()) {
            confidence = ConfidenceLevel.MEDIUM;
            rationale = String.format(Locale.ROOT, "Tier-1 source available, %s CV across estimates", percent(cv));
        } else {
            confidence = ConfidenceLevel.LOW;
            rationale = String.format(Locale.ROOT, "No Tier-1 sources or high variability (%s CV)", percent(cv));
        }

        double rangeLow = rawValues.stream().mapToDouble(Double::doubleValue).min().orElseThrow();
        double rangeHigh = rawValues.stream().mapToDouble(Double::doubleValue).max().orElseThrow();

        ConsensusResult result = new ConsensusResult(
                targetId,
                valueKind,
                weightedMedian,
                simpleMedian,
                rangeLow,
                rangeHigh,
                accepted.size(),
                tier1Count,
                Math.round(cv * 1000.0) / 1000.0,
                confidence,
                rationale,
                rawValues,
                rejected
        );
        log.debug("consensus.computed targetId={} kind={} recommended={} n={} tier1={} cv={} confidence={}",
                targetId, valueKind.getLabel(), weightedMedian, accepted.size(), tier1Count, cv, confidence);
        return result;
    }

    /**
     * Median of the multiset where each value appears {@code round(weight * replicationFactor)} times.
     * Falls back to the simple median when every weight rounds to zero copies.
     */
    double weightedMedian(List<SourceEstimate> accepted, double simpleMedian) {
        List<Double> expanded = new ArrayList<>();
        for (SourceEstimate estimate : accepted) {
            long copies = Math.round(scorer.weight(estimate) * config.getReplicationFactor());
            for (long i = 0; i < copies; i++) {
                expanded.add(estimate.value());
            }
        }
        if (expanded.isEmpty()) {
            return simpleMedian;
        }
        return median(expanded.stream().mapToDouble(Double::doubleValue).toArray());
    }

    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        int n = sorted.length;
        if (n % 2 == 1) {
            return sorted[n / 2];
        }
        return (sorted[n / 2 - 1] + sorted[n / 2]) / 2.0;
    }

    static double coefficientOfVariation(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0.0;
        }
        double mean = values.stream().mapToDouble(Double::doubleValue).sum() / n;
        if (mean == 0.0) {
            return 0.0;
        }
        double sumSquares = 0.0;
        for (double v : values) {
            sumSquares += (v - mean) * (v - mean);
        }
        double stdev = Math.sqrt(sumSquares / (n - 1));
        return stdev / Math.abs(mean);
    }

    private static String percent(double fraction) {
        return String.format(Locale.ROOT, "%.0f%%", fraction * 100.0);
    }

    public ConsensusConfig getConfig() {
        return config;
    }

    public QualityRecencyScorer getScorer() {
        return scorer;
    }
}
