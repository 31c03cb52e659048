package com.evidence.consensus.config;

import com.evidence.consensus.core.model.DevelopmentPhase;

import java.util.Comparator;
import java.util.EnumMap;
import java.util.Map;

/**
 * Rank table for development phases. Lower rank means more advanced.
 * Defaults to {@link DevelopmentPhase#getDefaultRank()}.
 */
public final class PhaseRanking {

    private final Map<DevelopmentPhase, Integer> ranks;

    private PhaseRanking(Map<DevelopmentPhase, Integer> ranks) {
        this.ranks = Map.copyOf(ranks);
    }

    public static PhaseRanking defaults() {
        return builder().build();
    }

    public int rank(DevelopmentPhase phase) {
        return ranks.get(phase != null ? phase : DevelopmentPhase.UNKNOWN);
    }

    /**
     * Orders phases from most to least advanced.
     */
    public Comparator<DevelopmentPhase> mostAdvancedFirst() {
        return Comparator.comparingInt(this::rank);
    }

    /**
     * Returns the more advanced of two phases; on equal rank the first one.
     */
    public DevelopmentPhase moreAdvanced(DevelopmentPhase first, DevelopmentPhase second) {
        return rank(second) < rank(first) ? second : first;
    }

    public Map<DevelopmentPhase, Integer> asMap() {
        return ranks;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<DevelopmentPhase, Integer> ranks = new EnumMap<>(DevelopmentPhase.class);

        private Builder() {
            for (DevelopmentPhase phase : DevelopmentPhase.values()) {
                ranks.put(phase, phase.getDefaultRank());
            }
        }

        public Builder rank(DevelopmentPhase phase, int rank) {
            if (rank < 1) {
                throw new IllegalArgumentException("Phase rank must be >= 1, got " + rank + " for " + phase);
            }
            ranks.put(phase, rank);
            return this;
        }

        public PhaseRanking build() {
            return new PhaseRanking(ranks);
        }
    }

    @Override
    public String toString() {
        return "PhaseRanking" + ranks;
    }
}
