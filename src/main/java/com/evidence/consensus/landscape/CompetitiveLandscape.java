package com.evidence.consensus.landscape;

import com.evidence.consensus.core.model.MergedEntity;

import java.util.List;
import java.util.Objects;

/**
 * Merged entities of one context grouped by development stage.
 *
 * @param contextId           the context (disease) the landscape describes
 * @param approved            approved in this context, by manufacturer
 * @param phase3              Phase 3 and regulatory filing, by manufacturer
 * @param phase2              Phase 2, by manufacturer
 * @param phase1              Phase 1, by manufacturer
 * @param preclinical         preclinical or unknown phase, by manufacturer
 * @param discontinued        terminal status, most recent first
 * @param keyMechanismClasses up to 10 target or mechanism classes of the active entities
 * @param excludedComparators established comparator drugs left out of the landscape
 */
public record CompetitiveLandscape(
        String contextId,
        List<MergedEntity> approved,
        List<MergedEntity> phase3,
        List<MergedEntity> phase2,
        List<MergedEntity> phase1,
        List<MergedEntity> preclinical,
        List<MergedEntity> discontinued,
        List<String> keyMechanismClasses,
        List<String> excludedComparators
) {
    public CompetitiveLandscape {
        Objects.requireNonNull(contextId, "contextId is required");
        approved = List.copyOf(approved);
        phase3 = List.copyOf(phase3);
        phase2 = List.copyOf(phase2);
        phase1 = List.copyOf(phase1);
        preclinical = List.copyOf(preclinical);
        discontinued = List.copyOf(discontinued);
        keyMechanismClasses = List.copyOf(keyMechanismClasses);
        excludedComparators = List.copyOf(excludedComparators);
    }

    /**
     * Count of active (non-discontinued) entities.
     */
    public int activeCount() {
        return approved.size() + phase3.size() + phase2.size() + phase1.size() + preclinical.size();
    }

    public int totalCount() {
        return activeCount() + discontinued.size();
    }
}
