package com.evidence.consensus.verify;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable registry of the canonical names approved in each context (e.g. each disease).
 * Context ids and names are matched case-insensitively with whitespace collapsed.
 */
public final class ApprovalRegistry {

    private static final ApprovalRegistry EMPTY = new ApprovalRegistry(Map.of());

    private final Map<String, Set<String>> approvedByContext;

    private ApprovalRegistry(Map<String, Set<String>> approvedByContext) {
        Map<String, Set<String>> copy = new LinkedHashMap<>();
        approvedByContext.forEach((context, names) ->
                copy.put(context, Collections.unmodifiableSet(new LinkedHashSet<>(names))));
        this.approvedByContext = Collections.unmodifiableMap(copy);
    }

    public static ApprovalRegistry empty() {
        return EMPTY;
    }

    public boolean isApproved(String contextId, String name) {
        Set<String> approved = approvedByContext.get(key(contextId));
        return approved != null && approved.contains(key(name));
    }

    /**
     * Returns the normalized names approved in the context, empty if the context is unknown.
     */
    public Set<String> approvedIn(String contextId) {
        return approvedByContext.getOrDefault(key(contextId), Set.of());
    }

    public Set<String> contexts() {
        return approvedByContext.keySet();
    }

    static String key(String value) {
        if (value == null) {
            return "";
        }
        return value.toLowerCase(Locale.ROOT).trim().replaceAll("\\s+", " ");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Set<String>> approvedByContext = new LinkedHashMap<>();

        public Builder approve(String contextId, String... names) {
            return approve(contextId, Arrays.asList(names));
        }

        public Builder approve(String contextId, Collection<String> names) {
            String context = key(contextId);
            if (context.isEmpty()) {
                throw new IllegalArgumentException("contextId must not be blank");
            }
            Set<String> approved = approvedByContext.computeIfAbsent(context, k -> new LinkedHashSet<>());
            for (String name : names) {
                String normalized = key(name);
                if (!normalized.isEmpty()) {
                    approved.add(normalized);
                }
            }
            return this;
        }

        public ApprovalRegistry build() {
            return approvedByContext.isEmpty() ? EMPTY : new ApprovalRegistry(approvedByContext);
        }
    }

    @Override
    public String toString() {
        return "ApprovalRegistry{contexts=" + approvedByContext.keySet() + '}';
    }
}
