package com.evidence.consensus.core.model;

/**
 * Approval classification of an entity within one context (e.g. one disease).
 */
public enum ApprovalClassification {
    APPROVED,
    INVESTIGATIONAL,
    DISCONTINUED
}
