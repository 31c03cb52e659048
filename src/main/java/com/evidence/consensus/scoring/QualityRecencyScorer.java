package com.evidence.consensus.scoring;

import com.evidence.consensus.config.SampleSizeThreshold;
import com.evidence.consensus.config.ScoringConfig;
import com.evidence.consensus.core.model.SourceEstimate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Assigns a weight to a source estimate from its metadata.
 *
 * <p>Formula:</p>
 * <pre>
 * weight = tierWeight(qualityTier)
 *        * (year &gt;= recencyCutoffYear ? recencyMultiplier : 1.0)
 *        * sampleSizeMultiplier(sampleSize)
 * </pre>
 *
 * <p>Missing metadata contributes a neutral factor of 1.0. Only the largest sample-size
 * threshold the study exceeds applies. The scorer is a pure function.</p>
 */
public class QualityRecencyScorer {
    private static final Logger log = LoggerFactory.getLogger(QualityRecencyScorer.class);

    private final ScoringConfig config;

    public QualityRecencyScorer() {
        this(ScoringConfig.defaults());
    }

    public QualityRecencyScorer(ScoringConfig config) {
        this.config = config;
    }

    /**
     * Computes the weight of an estimate using this scorer's configuration.
     */
    public double weight(SourceEstimate estimate) {
        return weight(estimate, config);
    }

    /**
     * Computes the weight of an estimate using the given configuration.
     *
     * @param estimate the estimate to score
     * @param config   tier weights, recency and sample-size settings
     * @return the product of all applicable factors
     */
    public double weight(SourceEstimate estimate, ScoringConfig config) {
        double weight = config.tierWeight(estimate.qualityTier());

        if (estimate.year() != null && estimate.year() >= config.recencyCutoffYear()) {
            weight *= config.recencyMultiplier();
        }

        weight *= sampleSizeMultiplier(estimate.sampleSize(), config);

        log.trace("Weight for source {}: tier={} year={} n={} weight={}",
                estimate.sourceId(), estimate.qualityTier(), estimate.year(), estimate.sampleSize(), weight);
        return weight;
    }

    private double sampleSizeMultiplier(Long sampleSize, ScoringConfig config) {
        if (sampleSize == null) {
            return 1.0;
        }
        // thresholds are sorted largest first
        for (SampleSizeThreshold threshold : config.sampleSizeThresholds()) {
            if (sampleSize > threshold.minExclusive()) {
                return threshold.multiplier();
            }
        }
        return 1.0;
    }

    public ScoringConfig getConfig() {
        return config;
    }
}
