package com.evidence.consensus.core.model;

import java.util.Objects;

/**
 * A non-fatal diagnostic attached to aggregation output.
 *
 * @param severity how serious the issue is
 * @param field    the output field the issue refers to
 * @param message  what was found
 * @param action   what an analyst should do about it
 */
public record ValidationIssue(Severity severity, String field, String message, String action) {

    public ValidationIssue {
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(field, "field is required");
        Objects.requireNonNull(message, "message is required");
    }

    public static ValidationIssue error(String field, String message, String action) {
        return new ValidationIssue(Severity.ERROR, field, message, action);
    }

    public static ValidationIssue warning(String field, String message, String action) {
        return new ValidationIssue(Severity.WARNING, field, message, action);
    }

    public static ValidationIssue info(String field, String message, String action) {
        return new ValidationIssue(Severity.INFO, field, message, action);
    }
}
