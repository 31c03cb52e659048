package com.evidence.consensus.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Helpers for the open attribute maps carried by entities.
 * Null values are never stored; collection values are stored as deduplicated sets.
 */
public final class Attributes {

    public static final String MANUFACTURER = "manufacturer";
    public static final String MECHANISM_OF_ACTION = "mechanismOfAction";
    public static final String TARGET = "target";
    public static final String PHASE_FOR_INDICATION = "phaseForIndication";

    private Attributes() {
        // Utility class
    }

    /**
     * Returns an unmodifiable copy without null values, with collections turned into sets.
     */
    public static Map<String, Object> copyOf(Map<String, ?> attributes) {
        if (attributes == null || attributes.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : attributes.entrySet()) {
            Object value = normalizeValue(entry.getValue());
            if (entry.getKey() != null && value != null) {
                copy.put(entry.getKey(), value);
            }
        }
        return Collections.unmodifiableMap(copy);
    }

    /**
     * Returns an unmodifiable, insertion-ordered copy of the given references without nulls or blanks.
     */
    public static Set<String> copyOfRefs(Collection<String> refs) {
        if (refs == null || refs.isEmpty()) {
            return Set.of();
        }
        Set<String> copy = new LinkedHashSet<>();
        for (String ref : refs) {
            if (ref != null && !ref.isBlank()) {
                copy.add(ref.trim());
            }
        }
        return Collections.unmodifiableSet(copy);
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Collection<?> collection) {
            Set<Object> set = new LinkedHashSet<>();
            collection.stream().filter(Objects::nonNull).forEach(set::add);
            return set.isEmpty() ? null : Collections.unmodifiableSet(set);
        }
        if (value instanceof String s && s.isBlank()) {
            return null;
        }
        return value;
    }
}
