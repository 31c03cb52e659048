package com.evidence.consensus.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies normalization rules to names in priority order, then lowercases, trims and
 * collapses whitespace. Immutable once built.
 */
public final class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = rules.stream()
                .sorted(Comparator.comparingInt(NormalizationRule::priority))
                .toList();
    }

    /**
     * Normalizes a name of the given kind. Returns "" for null or blank input.
     */
    public String normalize(String name, NameKind kind) {
        if (name == null || name.isBlank()) {
            return "";
        }

        String result = name;
        for (NormalizationRule rule : rules) {
            if (rule.appliesTo(kind)) {
                String before = result;
                result = rule.apply(result);
                if (!before.equals(result)) {
                    log.trace("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
                }
            }
        }

        return result.toLowerCase(Locale.ROOT)
                .trim()
                .replaceAll("\\s+", " ");
    }
}
