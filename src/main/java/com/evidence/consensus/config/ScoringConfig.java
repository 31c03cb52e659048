package com.evidence.consensus.config;

import com.evidence.consensus.core.model.QualityTier;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Weights used by the quality and recency scorer.
 *
 * <p>Defaults: Tier 1 = 3.0, Tier 2 = 2.0, Tier 3 = 1.0, Unknown = 1.0; data from 2020
 * onwards x1.5; studies over 10,000,000 subjects x1.3, over 1,000,000 x1.1.
 * Only the largest matching sample-size threshold applies.</p>
 */
public record ScoringConfig(
        Map<QualityTier, Double> tierWeights,
        int recencyCutoffYear,
        double recencyMultiplier,
        List<SampleSizeThreshold> sampleSizeThresholds
) {
    private static final int DEFAULT_RECENCY_CUTOFF_YEAR = 2020;
    private static final double DEFAULT_RECENCY_MULTIPLIER = 1.5;

    public ScoringConfig {
        EnumMap<QualityTier, Double> weights = new EnumMap<>(QualityTier.class);
        for (QualityTier tier : QualityTier.values()) {
            weights.put(tier, 1.0);
        }
        if (tierWeights != null) {
            tierWeights.forEach((tier, weight) -> {
                if (weight == null || weight < 0.0) {
                    throw new IllegalArgumentException("Tier weight for " + tier + " must be non-negative");
                }
                weights.put(tier, weight);
            });
        }
        tierWeights = Map.copyOf(weights);
        if (recencyMultiplier <= 0.0) {
            throw new IllegalArgumentException("recencyMultiplier must be positive");
        }
        sampleSizeThresholds = sampleSizeThresholds != null
                ? sampleSizeThresholds.stream()
                    .sorted(Comparator.comparingLong(SampleSizeThreshold::minExclusive).reversed())
                    .toList()
                : List.of();
    }

    public double tierWeight(QualityTier tier) {
        return tierWeights.getOrDefault(tier, 1.0);
    }

    public static ScoringConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<QualityTier, Double> tierWeights = new EnumMap<>(Map.of(
                QualityTier.TIER_1, 3.0,
                QualityTier.TIER_2, 2.0,
                QualityTier.TIER_3, 1.0,
                QualityTier.UNKNOWN, 1.0));
        private int recencyCutoffYear = DEFAULT_RECENCY_CUTOFF_YEAR;
        private double recencyMultiplier = DEFAULT_RECENCY_MULTIPLIER;
        private List<SampleSizeThreshold> sampleSizeThresholds = List.of(
                new SampleSizeThreshold(10_000_000L, 1.3),
                new SampleSizeThreshold(1_000_000L, 1.1));

        public Builder tierWeight(QualityTier tier, double weight) {
            this.tierWeights.put(tier, weight);
            return this;
        }

        public Builder recencyCutoffYear(int recencyCutoffYear) {
            this.recencyCutoffYear = recencyCutoffYear;
            return this;
        }

        public Builder recencyMultiplier(double recencyMultiplier) {
            this.recencyMultiplier = recencyMultiplier;
            return this;
        }

        public Builder sampleSizeThresholds(List<SampleSizeThreshold> sampleSizeThresholds) {
            this.sampleSizeThresholds = sampleSizeThresholds;
            return this;
        }

        public ScoringConfig build() {
            return new ScoringConfig(tierWeights, recencyCutoffYear, recencyMultiplier, sampleSizeThresholds);
        }
    }
}
