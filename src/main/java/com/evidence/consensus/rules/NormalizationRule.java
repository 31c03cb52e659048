package com.evidence.consensus.rules;

import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * One regex replacement applied while normalizing a name.
 *
 * @param name        rule name, used in trace logging
 * @param pattern     case-insensitive, Unicode-aware pattern
 * @param replacement replacement text
 * @param kinds       name kinds the rule applies to; empty means every kind
 * @param priority    lower runs first
 */
public record NormalizationRule(
        String name,
        Pattern pattern,
        String replacement,
        Set<NameKind> kinds,
        int priority
) {
    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
        kinds = kinds != null ? Set.copyOf(kinds) : Set.of();
    }

    public static NormalizationRule of(String name, String regex, String replacement, int priority,
                                       NameKind... kinds) {
        Pattern pattern = Pattern.compile(regex,
                Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);
        return new NormalizationRule(name, pattern, replacement, Set.of(kinds), priority);
    }

    public boolean appliesTo(NameKind kind) {
        return kinds.isEmpty() || kinds.contains(kind);
    }

    public String apply(String input) {
        return pattern.matcher(input).replaceAll(replacement);
    }
}
