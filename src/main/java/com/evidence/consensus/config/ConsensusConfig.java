package com.evidence.consensus.config;

import com.evidence.consensus.core.model.ValueKind;

import java.util.EnumMap;
import java.util.Map;

/**
 * Thresholds and domain bounds used by the weighted consensus calculator.
 */
public class ConsensusConfig {

    private static final int DEFAULT_HIGH_MIN_TIER1 = 2;
    private static final double DEFAULT_HIGH_MAX_CV = 0.3;
    private static final int DEFAULT_MEDIUM_MIN_TIER1 = 1;
    private static final double DEFAULT_MEDIUM_MAX_CV = 0.5;
    private static final int DEFAULT_REPLICATION_FACTOR = 10;

    private final int highConfidenceMinTier1;
    private final double highConfidenceMaxCv;
    private final int mediumConfidenceMinTier1;
    private final double mediumConfidenceMaxCv;
    private final int replicationFactor;
    private final Map<ValueKind, ValueDomain> domains;

    private ConsensusConfig(Builder builder) {
        this.highConfidenceMinTier1 = builder.highConfidenceMinTier1;
        this.highConfidenceMaxCv = builder.highConfidenceMaxCv;
        this.mediumConfidenceMinTier1 = builder.mediumConfidenceMinTier1;
        this.mediumConfidenceMaxCv = builder.mediumConfidenceMaxCv;
        this.replicationFactor = builder.replicationFactor;
        this.domains = Map.copyOf(builder.domains);
    }

    public int getHighConfidenceMinTier1() {
        return highConfidenceMinTier1;
    }

    public double getHighConfidenceMaxCv() {
        return highConfidenceMaxCv;
    }

    public int getMediumConfidenceMinTier1() {
        return mediumConfidenceMinTier1;
    }

    public double getMediumConfidenceMaxCv() {
        return mediumConfidenceMaxCv;
    }

    /**
     * Number of copies per unit of weight when expanding the weighted-median multiset.
     */
    public int getReplicationFactor() {
        return replicationFactor;
    }

    public ValueDomain domainFor(ValueKind kind) {
        return domains.getOrDefault(kind,
                kind.isPercentage() ? ValueDomain.percentage() : ValueDomain.nonNegative());
    }

    public Map<ValueKind, ValueDomain> getDomains() {
        return domains;
    }

    public static ConsensusConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int highConfidenceMinTier1 = DEFAULT_HIGH_MIN_TIER1;
        private double highConfidenceMaxCv = DEFAULT_HIGH_MAX_CV;
        private int mediumConfidenceMinTier1 = DEFAULT_MEDIUM_MIN_TIER1;
        private double mediumConfidenceMaxCv = DEFAULT_MEDIUM_MAX_CV;
        private int replicationFactor = DEFAULT_REPLICATION_FACTOR;
        private final Map<ValueKind, ValueDomain> domains = new EnumMap<>(Map.of(
                ValueKind.PREVALENCE, ValueDomain.nonNegative(),
                ValueKind.INCIDENCE, ValueDomain.nonNegative(),
                ValueKind.FAILURE_RATE, ValueDomain.percentage(),
                ValueKind.TREATMENT_RATE, ValueDomain.percentage()));

        public Builder highConfidence(int minTier1, double maxCv) {
            validateCv(maxCv, "highConfidenceMaxCv");
            this.highConfidenceMinTier1 = minTier1;
            this.highConfidenceMaxCv = maxCv;
            return this;
        }

        public Builder mediumConfidence(int minTier1, double maxCv) {
            validateCv(maxCv, "mediumConfidenceMaxCv");
            this.mediumConfidenceMinTier1 = minTier1;
            this.mediumConfidenceMaxCv = maxCv;
            return this;
        }

        public Builder replicationFactor(int replicationFactor) {
            if (replicationFactor <= 0) {
                throw new IllegalArgumentException("replicationFactor must be positive");
            }
            this.replicationFactor = replicationFactor;
            return this;
        }

        public Builder domain(ValueKind kind, ValueDomain domain) {
            this.domains.put(kind, domain);
            return this;
        }

        public ConsensusConfig build() {
            if (highConfidenceMinTier1 < mediumConfidenceMinTier1) {
                throw new IllegalArgumentException("High confidence must require at least as many Tier-1 sources as medium");
            }
            if (highConfidenceMaxCv > mediumConfidenceMaxCv) {
                throw new IllegalArgumentException("highConfidenceMaxCv must be <= mediumConfidenceMaxCv");
            }
            if (highConfidenceMinTier1 < 1) {
                throw new IllegalArgumentException("High confidence must require at least one Tier-1 source");
            }
            return new ConsensusConfig(this);
        }

        private void validateCv(double value, String name) {
            if (value < 0.0) {
                throw new IllegalArgumentException(name + " must be non-negative");
            }
        }
    }

    @Override
    public String toString() {
        return "ConsensusConfig{" +
                "high=(" + highConfidenceMinTier1 + ", cv<" + highConfidenceMaxCv + ")" +
                ", medium=(" + mediumConfidenceMinTier1 + ", cv<" + mediumConfidenceMaxCv + ")" +
                ", replicationFactor=" + replicationFactor +
                ", domains=" + domains +
                '}';
    }
}
