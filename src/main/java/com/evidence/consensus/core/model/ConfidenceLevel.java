package com.evidence.consensus.core.model;

/**
 * Confidence classification of a consensus value.
 */
public enum ConfidenceLevel {
    HIGH,
    MEDIUM,
    LOW
}
