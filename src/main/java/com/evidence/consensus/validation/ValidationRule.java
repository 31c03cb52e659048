package com.evidence.consensus.validation;

import com.evidence.consensus.core.model.ValidationIssue;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * One independent plausibility check over a finished output value.
 *
 * @param <T> the checked type ({@code ConsensusResult} or {@code MergedEntity})
 */
public interface ValidationRule<T> {

    String getName();

    /**
     * Checks the subject. Returns an empty list when nothing is wrong.
     */
    List<ValidationIssue> check(T subject);

    static <T> ValidationRule<T> of(String name, Function<T, List<ValidationIssue>> check) {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(check, "check is required");
        return new ValidationRule<>() {
            @Override
            public String getName() {
                return name;
            }

            @Override
            public List<ValidationIssue> check(T subject) {
                return check.apply(subject);
            }

            @Override
            public String toString() {
                return "ValidationRule{" + name + '}';
            }
        };
    }
}
