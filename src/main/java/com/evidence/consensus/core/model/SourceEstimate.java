package com.evidence.consensus.core.model;

import java.util.Objects;

/**
 * One scalar observation reported by one source.
 * Immutable; provenance fields (title, identifier, url) are carried through unmodified for audit.
 *
 * @param sourceId    opaque source identifier (PMID, DOI, URL, ...)
 * @param value       reported value, or null when the source did not state one
 * @param valueKind   kind of fact the value describes
 * @param qualityTier reliability bucket of the source
 * @param year        data year, if known
 * @param sampleSize  study population size, if known
 * @param title       source title
 * @param identifier  source identifier as cited (PMID, DOI)
 * @param url         source URL
 */
public record SourceEstimate(
        String sourceId,
        Double value,
        ValueKind valueKind,
        QualityTier qualityTier,
        Integer year,
        Long sampleSize,
        String title,
        String identifier,
        String url
) {
    public SourceEstimate {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(valueKind, "valueKind is required");
        qualityTier = qualityTier != null ? qualityTier : QualityTier.UNKNOWN;
    }

    public boolean hasValue() {
        return value != null;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String sourceId;
        private Double value;
        private ValueKind valueKind;
        private QualityTier qualityTier = QualityTier.UNKNOWN;
        private Integer year;
        private Long sampleSize;
        private String title;
        private String identifier;
        private String url;

        public Builder sourceId(String sourceId) {
            this.sourceId = sourceId;
            return this;
        }

        public Builder value(Double value) {
            this.value = value;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder valueKind(ValueKind valueKind) {
            this.valueKind = valueKind;
            return this;
        }

        public Builder qualityTier(QualityTier qualityTier) {
            this.qualityTier = qualityTier;
            return this;
        }

        public Builder year(Integer year) {
            this.year = year;
            return this;
        }

        public Builder sampleSize(Long sampleSize) {
            this.sampleSize = sampleSize;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder identifier(String identifier) {
            this.identifier = identifier;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public SourceEstimate build() {
            return new SourceEstimate(sourceId, value, valueKind, qualityTier, year, sampleSize,
                    title, identifier, url);
        }
    }
}
