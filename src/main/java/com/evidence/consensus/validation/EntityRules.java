package com.evidence.consensus.validation;

import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.ValidationIssue;
import com.evidence.consensus.identity.DrugKeyGenerator;

import java.util.List;
import java.util.Optional;

/**
 * Built-in structural rules over merged entities.
 * Issue fields read {@code entity:<identityKey>.<field>}.
 */
public final class EntityRules {

    private EntityRules() {
        // Utility class
    }

    public static List<ValidationRule<MergedEntity>> defaults() {
        return List.of(blankIdentityKey(), terminalWithoutDetail(), missingSources(), drugKeyMismatch());
    }

    /**
     * A drug key whose NAME part is not the one the identity key generates, e.g. a key kept
     * from before an alias table change. Checksums are not compared since they may be salted.
     */
    public static ValidationRule<MergedEntity> drugKeyMismatch() {
        return ValidationRule.of("drug-key-mismatch", entity -> {
            if (entity.drugKey() == null) {
                return List.of();
            }
            Optional<String> expected = DrugKeyGenerator.tryGenerate(entity.identityKey(), null)
                    .flatMap(DrugKeyGenerator::extractName);
            if (expected.isPresent() && expected.equals(DrugKeyGenerator.extractName(entity.drugKey()))) {
                return List.of();
            }
            return List.of(ValidationIssue.warning(field(entity, "drugKey"),
                    "Drug key '" + entity.drugKey() + "' does not match identity key '" + entity.identityKey() + "'",
                    "Regenerate the drug key from the canonical name"));
        });
    }

    public static ValidationRule<MergedEntity> blankIdentityKey() {
        return ValidationRule.of("blank-identity-key", entity -> {
            if (!entity.identityKey().isBlank()) {
                return List.of();
            }
            return List.of(ValidationIssue.error(field(entity, "identityKey"),
                    "Entity '" + entity.canonicalNameRaw() + "' has a blank identity key",
                    "Extraction error - entity name missing"));
        });
    }

    public static ValidationRule<MergedEntity> terminalWithoutDetail() {
        return ValidationRule.of("terminal-without-detail", entity -> {
            if (!entity.isTerminal()) {
                return List.of();
            }
            if (entity.statusDetail() != null
                    && (entity.statusDetail().date() != null || entity.statusDetail().reason() != null)) {
                return List.of();
            }
            return List.of(ValidationIssue.warning(field(entity, "statusDetail"),
                    "Entity is " + entity.developmentStatus().getLabel() + " but has no date or reason",
                    "Search for the discontinuation announcement"));
        });
    }

    public static ValidationRule<MergedEntity> missingSources() {
        return ValidationRule.of("missing-sources", entity -> {
            if (!entity.mergedSourceRefs().isEmpty()) {
                return List.of();
            }
            return List.of(ValidationIssue.info(field(entity, "sourceRefs"),
                    "Entity has no source references",
                    "Attach trial ids or URLs for provenance"));
        });
    }

    private static String field(MergedEntity entity, String name) {
        return "entity:" + entity.identityKey() + "." + name;
    }
}
