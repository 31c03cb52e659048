package com.evidence.consensus.validation;

import com.evidence.consensus.config.ConsensusConfig;
import com.evidence.consensus.config.ValidationConfig;
import com.evidence.consensus.core.model.ConsensusResult;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Scans finished consensus results and merged entities for implausible values.
 *
 * <p>Stateless and non-blocking: every rule runs independently, and a rule that throws is
 * reported as an error issue rather than aborting the scan.</p>
 */
public class PlausibilityValidator {
    private static final Logger log = LoggerFactory.getLogger(PlausibilityValidator.class);

    private final List<ValidationRule<ConsensusResult>> consensusRules;
    private final List<ValidationRule<MergedEntity>> entityRules;

    public PlausibilityValidator() {
        this(ValidationConfig.defaults(), ConsensusConfig.defaults());
    }

    public PlausibilityValidator(ValidationConfig config, ConsensusConfig consensusConfig) {
        this(ConsensusRules.defaults(config, consensusConfig), EntityRules.defaults());
    }

    public PlausibilityValidator(List<ValidationRule<ConsensusResult>> consensusRules,
                                 List<ValidationRule<MergedEntity>> entityRules) {
        this.consensusRules = List.copyOf(consensusRules);
        this.entityRules = List.copyOf(entityRules);
    }

    public List<ValidationIssue> validate(Collection<ConsensusResult> consensusResults,
                                          Collection<MergedEntity> mergedEntities) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ConsensusResult result : consensusResults) {
            issues.addAll(apply(consensusRules, result, result.valueKind().getLabel()));
        }
        for (MergedEntity entity : mergedEntities) {
            issues.addAll(apply(entityRules, entity, "entity:" + entity.identityKey()));
        }
        log.debug("validation.completed results={} entities={} issues={}",
                consensusResults.size(), mergedEntities.size(), issues.size());
        return issues;
    }

    public List<ValidationIssue> validateConsensus(ConsensusResult result) {
        return validate(List.of(result), List.of());
    }

    public List<ValidationIssue> validateEntity(MergedEntity entity) {
        return validate(List.of(), List.of(entity));
    }

    private static <T> List<ValidationIssue> apply(List<ValidationRule<T>> rules, T subject, String field) {
        List<ValidationIssue> issues = new ArrayList<>();
        for (ValidationRule<T> rule : rules) {
            try {
                List<ValidationIssue> found = rule.check(subject);
                if (!found.isEmpty()) {
                    log.debug("validation.rule.fired rule={} field={} issues={}", rule.getName(), field, found.size());
                    issues.addAll(found);
                }
            } catch (RuntimeException e) {
                log.warn("validation.rule.failed rule={} field={} error={}", rule.getName(), field, e.getMessage(), e);
                issues.add(ValidationIssue.error(field,
                        "Validation rule '" + rule.getName() + "' failed: " + e.getMessage(),
                        "Report this input to the maintainers"));
            }
        }
        return issues;
    }

    public List<ValidationRule<ConsensusResult>> getConsensusRules() {
        return consensusRules;
    }

    public List<ValidationRule<MergedEntity>> getEntityRules() {
        return entityRules;
    }
}
