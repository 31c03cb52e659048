package com.evidence.consensus.identity;

import com.evidence.consensus.core.model.CandidateEntity;
import com.evidence.consensus.core.model.ValidationIssue;
import com.evidence.consensus.identity.cache.NoOpResolutionCache;
import com.evidence.consensus.identity.cache.ResolutionCache;
import com.evidence.consensus.rules.DefaultNormalizationRules;
import com.evidence.consensus.rules.NameKind;
import com.evidence.consensus.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Computes stable identity keys for candidate entities.
 *
 * <p>The name key is the trimmed, lowercased, whitespace-collapsed name after alias
 * substitution: the raw name is looked up first, then the development code. When both map
 * to different canonical names the name mapping wins and a warning is attached.</p>
 *
 * <p>External identifiers only change grouping in {@link #resolveAll(List)}, where the whole
 * batch is visible: name groups that agree on one external id are linked under one key,
 * and a name group carrying several different external ids keeps its name key.</p>
 */
public class IdentityResolver {
    private static final Logger log = LoggerFactory.getLogger(IdentityResolver.class);

    public static final List<String> DEFAULT_EXTERNAL_ID_ATTRIBUTES = List.of("pubchemCid", "casNumber", "unii");

    private final AliasTable aliasTable;
    private final NormalizationEngine normalizationEngine;
    private final List<String> externalIdAttributes;
    private final ResolutionCache cache;

    public IdentityResolver(AliasTable aliasTable) {
        this(aliasTable, DefaultNormalizationRules.createDefaultEngine(), DEFAULT_EXTERNAL_ID_ATTRIBUTES,
                new NoOpResolutionCache());
    }

    public IdentityResolver(AliasTable aliasTable,
                            NormalizationEngine normalizationEngine,
                            List<String> externalIdAttributes,
                            ResolutionCache cache) {
        this.aliasTable = Objects.requireNonNull(aliasTable, "aliasTable is required");
        this.normalizationEngine = Objects.requireNonNull(normalizationEngine, "normalizationEngine is required");
        this.externalIdAttributes = List.copyOf(externalIdAttributes);
        this.cache = Objects.requireNonNull(cache, "cache is required");
    }

    /**
     * Identity key of a single candidate under the configured alias table.
     */
    public String identityKey(CandidateEntity candidate) {
        return resolve(candidate).identityKey();
    }

    /**
     * Identity key of a single candidate under the given alias table. Not cached.
     */
    public String identityKey(CandidateEntity candidate, AliasTable aliases) {
        return compute(candidate, aliases).identityKey();
    }

    /**
     * Resolves a single candidate under the configured alias table.
     */
    public IdentityResolution resolve(CandidateEntity candidate) {
        String externalId = externalIdOf(candidate).orElse(null);
        Optional<IdentityResolution> cached =
                cache.get(candidate.canonicalNameRaw(), candidate.aliasCode(), externalId);
        if (cached.isPresent()) {
            return cached.get();
        }
        IdentityResolution resolution = compute(candidate, aliasTable);
        cache.put(candidate.canonicalNameRaw(), candidate.aliasCode(), externalId, resolution);
        return resolution;
    }

    /**
     * Resolves a batch, linking name groups through shared external identifiers.
     *
     * @return resolutions aligned with the input order, plus batch diagnostics
     */
    public ResolutionBatch resolveAll(List<CandidateEntity> candidates) {
        List<IdentityResolution> resolutions = new ArrayList<>(candidates.size());
        for (CandidateEntity candidate : candidates) {
            resolutions.add(resolve(candidate));
        }

        // nameKey -> distinct external ids seen under it
        Map<String, Set<String>> externalIdsByName = new LinkedHashMap<>();
        for (IdentityResolution r : resolutions) {
            Set<String> ids = externalIdsByName.computeIfAbsent(r.nameKey(), k -> new LinkedHashSet<>());
            r.externalIdentifier().ifPresent(ids::add);
        }

        List<ValidationIssue> issues = new ArrayList<>();
        Map<String, Set<String>> namesByExternalId = new LinkedHashMap<>();
        externalIdsByName.forEach((nameKey, ids) -> {
            if (ids.size() > 1) {
                log.warn("identity.conflict nameKey={} externalIds={}", nameKey, ids);
                issues.add(ValidationIssue.warning(
                        "entity:" + nameKey + ".identity",
                        "Name '" + nameKey + "' carries conflicting external identifiers " + ids
                                + "; grouped by name",
                        "Check which identifier belongs to this entity"));
            } else if (ids.size() == 1) {
                namesByExternalId.computeIfAbsent(ids.iterator().next(), k -> new TreeSet<>()).add(nameKey);
            }
        });

        Map<String, String> linkedKey = new LinkedHashMap<>();
        namesByExternalId.forEach((externalId, names) -> {
            if (names.size() > 1) {
                String key = names.iterator().next();
                names.forEach(name -> linkedKey.put(name, key));
                log.debug("identity.linked externalId={} names={} key={}", externalId, names, key);
                issues.add(ValidationIssue.info(
                        "entity:" + key + ".identity",
                        "Names " + names + " share external identifier " + externalId + "; merged as one entity",
                        "None"));
            }
        });

        List<IdentityResolution> linked = new ArrayList<>(resolutions.size());
        Set<ValidationIssue> all = new LinkedHashSet<>();
        for (IdentityResolution r : resolutions) {
            String key = linkedKey.get(r.nameKey());
            linked.add(key != null ? r.withIdentityKey(key) : r);
            all.addAll(r.issues());
        }
        all.addAll(issues);
        return new ResolutionBatch(linked, new ArrayList<>(all));
    }

    /**
     * Returns the first configured external identifier present on the candidate, as {@code attribute:value}.
     */
    public Optional<String> externalIdOf(CandidateEntity candidate) {
        for (String attribute : externalIdAttributes) {
            Optional<Object> value = candidate.attribute(attribute);
            if (value.isPresent()) {
                String text = formatIdentifier(value.get());
                if (!text.isEmpty()) {
                    return Optional.of(attribute + ":" + text);
                }
            }
        }
        return Optional.empty();
    }

    public String normalizeName(String name) {
        return normalizationEngine.normalize(name, NameKind.GENERIC_NAME);
    }

    public ResolutionCache getCache() {
        return cache;
    }

    private IdentityResolution compute(CandidateEntity candidate, AliasTable aliases) {
        String rawName = candidate.canonicalNameRaw();
        Optional<String> byName = aliases.canonicalFor(rawName);
        Optional<String> byCode = candidate.aliasCode() != null
                ? aliases.canonicalFor(candidate.aliasCode())
                : Optional.empty();

        List<ValidationIssue> issues = new ArrayList<>();
        String canonical = rawName.trim();
        if (byName.isPresent()) {
            canonical = byName.get();
            if (byCode.isPresent() && !normalizeName(byCode.get()).equals(normalizeName(canonical))) {
                log.warn("identity.alias.conflict name={} code={} nameAlias={} codeAlias={}",
                        rawName, candidate.aliasCode(), canonical, byCode.get());
                issues.add(ValidationIssue.warning(
                        "entity:" + normalizeName(canonical) + ".aliasCode",
                        "Name '" + rawName + "' maps to '" + canonical + "' but code '" + candidate.aliasCode()
                                + "' maps to '" + byCode.get() + "'; using the name mapping",
                        "Correct the alias table or the extracted development code"));
            }
        } else if (byCode.isPresent()) {
            canonical = byCode.get();
        }

        String nameKey = normalizeName(canonical);
        String externalId = externalIdOf(candidate).orElse(null);
        String drugKey = DrugKeyGenerator.tryGenerate(nameKey, null).orElse(null);
        log.trace("identity.resolved raw={} key={}", rawName, nameKey);
        return new IdentityResolution(nameKey, nameKey, canonical, externalId, drugKey, issues);
    }

    private static String formatIdentifier(Object value) {
        if (value instanceof Collection<?> collection) {
            return collection.isEmpty() ? "" : formatIdentifier(collection.iterator().next());
        }
        if (value instanceof Double d && !d.isInfinite() && d == Math.rint(d)) {
            return String.valueOf(d.longValue());
        }
        return String.valueOf(value).trim();
    }
}
