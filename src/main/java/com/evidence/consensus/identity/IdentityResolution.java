package com.evidence.consensus.identity;

import com.evidence.consensus.core.model.ValidationIssue;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving one candidate's identity.
 *
 * @param identityKey   key used to group sightings; equals {@code nameKey} unless the candidate
 *                      was linked to another name through a shared external identifier
 * @param nameKey       normalized alias-substituted name
 * @param canonicalName alias-substituted name as written in the alias table, or the raw name
 * @param externalId    first configured external identifier found, as {@code attribute:value}, may be null
 * @param drugKey       stable display key of the identity key, null when it has no ASCII letters or digits
 * @param issues        identity diagnostics (alias or external-id conflicts)
 */
public record IdentityResolution(
        String identityKey,
        String nameKey,
        String canonicalName,
        String externalId,
        String drugKey,
        List<ValidationIssue> issues
) {
    public IdentityResolution {
        Objects.requireNonNull(identityKey, "identityKey is required");
        Objects.requireNonNull(nameKey, "nameKey is required");
        issues = issues != null ? List.copyOf(issues) : List.of();
    }

    public Optional<String> externalIdentifier() {
        return Optional.ofNullable(externalId);
    }

    public boolean isLinked() {
        return !identityKey.equals(nameKey);
    }

    /**
     * Re-keys a linked resolution. The drug key follows the identity key so every member
     * of a linked group carries the same one.
     */
    IdentityResolution withIdentityKey(String key) {
        String linkedDrugKey = DrugKeyGenerator.tryGenerate(key, null).orElse(null);
        return new IdentityResolution(key, nameKey, canonicalName, externalId, linkedDrugKey, issues);
    }
}
