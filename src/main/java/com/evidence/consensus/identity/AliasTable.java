package com.evidence.consensus.identity;

import com.evidence.consensus.rules.DefaultNormalizationRules;
import com.evidence.consensus.rules.NameKind;
import com.evidence.consensus.rules.NormalizationEngine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable mapping from raw names and development codes to canonical generic names.
 *
 * <p>Keys are compared after stripping case, whitespace and punctuation, so
 * {@code MEDI-545}, {@code medi545} and {@code "Medi 545"} hit the same entry.
 * Canonical names are stored as given (trimmed).</p>
 */
public final class AliasTable {

    private static final NormalizationEngine KEY_ENGINE =
            new NormalizationEngine(DefaultNormalizationRules.getCodeRules());

    private static final AliasTable EMPTY = new AliasTable(Map.of());

    private final Map<String, String> canonicalByKey;

    private AliasTable(Map<String, String> canonicalByKey) {
        this.canonicalByKey = Collections.unmodifiableMap(new LinkedHashMap<>(canonicalByKey));
    }

    public static AliasTable empty() {
        return EMPTY;
    }

    /**
     * Looks up the canonical name for a raw name or development code.
     */
    public Optional<String> canonicalFor(String nameOrCode) {
        String key = lookupKey(nameOrCode);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(canonicalByKey.get(key));
    }

    public boolean isEmpty() {
        return canonicalByKey.isEmpty();
    }

    public int size() {
        return canonicalByKey.size();
    }

    /**
     * Returns the table keyed by normalized alias.
     */
    public Map<String, String> asMap() {
        return canonicalByKey;
    }

    static String lookupKey(String nameOrCode) {
        return KEY_ENGINE.normalize(nameOrCode, NameKind.DEVELOPMENT_CODE);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, String> canonicalByKey = new LinkedHashMap<>();

        public Builder alias(String alias, String canonicalName) {
            if (canonicalName == null || canonicalName.isBlank()) {
                throw new IllegalArgumentException("Canonical name for alias '" + alias + "' must not be blank");
            }
            String key = lookupKey(alias);
            if (key.isEmpty()) {
                throw new IllegalArgumentException("Alias must contain at least one letter or digit: '" + alias + "'");
            }
            canonicalByKey.put(key, canonicalName.trim());
            return this;
        }

        public Builder aliases(Map<String, String> aliases) {
            aliases.forEach(this::alias);
            return this;
        }

        public AliasTable build() {
            return canonicalByKey.isEmpty() ? EMPTY : new AliasTable(canonicalByKey);
        }
    }

    @Override
    public String toString() {
        return "AliasTable{size=" + canonicalByKey.size() + '}';
    }
}
