package com.evidence.consensus.boundary;

import com.evidence.consensus.core.model.ValidationIssue;

import java.util.List;

/**
 * Typed records recovered from extractor output, and the issues raised for records that were skipped.
 */
public record ParseResult<T>(List<T> values, List<ValidationIssue> issues) {

    public ParseResult {
        values = List.copyOf(values);
        issues = List.copyOf(issues);
    }

    public boolean hasIssues() {
        return !issues.isEmpty();
    }
}
