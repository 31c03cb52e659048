package com.evidence.consensus.config;

/**
 * A sample-size boost: estimates from studies larger than {@code minExclusive} get
 * their weight multiplied by {@code multiplier}.
 */
public record SampleSizeThreshold(long minExclusive, double multiplier) {

    public SampleSizeThreshold {
        if (minExclusive < 0) {
            throw new IllegalArgumentException("minExclusive must be non-negative");
        }
        if (multiplier <= 0.0) {
            throw new IllegalArgumentException("multiplier must be positive");
        }
    }
}
