package com.evidence.consensus.landscape;

import com.evidence.consensus.core.model.ApprovalClassification;
import com.evidence.consensus.core.model.Attributes;
import com.evidence.consensus.core.model.ContextualStatus;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.StatusDetail;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups the merged entities of one context into a competitive landscape.
 *
 * <p>A context's verified status is used when present; otherwise the entity's own status and
 * phase. Established comparator drugs (standard-of-care generics) are left out unless they
 * are approved in the context.</p>
 */
public class LandscapeBuilder {
    private static final Logger log = LoggerFactory.getLogger(LandscapeBuilder.class);

    private static final int MAX_MECHANISM_CLASSES = 10;

    private static final Comparator<MergedEntity> BY_MANUFACTURER = Comparator.comparing(
            (MergedEntity e) -> e.attributeAsString(Attributes.MANUFACTURER)
                    .map(m -> m.toLowerCase(Locale.ROOT))
                    .orElse(null),
            Comparator.nullsLast(Comparator.naturalOrder()));

    private static final Comparator<MergedEntity> MOST_RECENT_FIRST = Comparator.comparing(
            (MergedEntity e) -> e.statusDetail() != null ? e.statusDetail() : StatusDetail.of(null, null),
            StatusDetail.BY_DATE.reversed());

    private final Set<String> establishedDrugs;

    /**
     * A builder that excludes no comparators.
     */
    public LandscapeBuilder() {
        this(Set.of());
    }

    public LandscapeBuilder(Collection<String> establishedDrugs) {
        this.establishedDrugs = establishedDrugs.stream()
                .map(name -> name.toLowerCase(Locale.ROOT).trim())
                .collect(Collectors.toUnmodifiableSet());
    }

    public CompetitiveLandscape build(String contextId, Collection<MergedEntity> entities) {
        List<MergedEntity> approved = new ArrayList<>();
        List<MergedEntity> phase3 = new ArrayList<>();
        List<MergedEntity> phase2 = new ArrayList<>();
        List<MergedEntity> phase1 = new ArrayList<>();
        List<MergedEntity> preclinical = new ArrayList<>();
        List<MergedEntity> discontinued = new ArrayList<>();
        List<String> excluded = new ArrayList<>();

        for (MergedEntity entity : entities) {
            Optional<ContextualStatus> contextual = entity.statusIn(contextId);
            boolean approvedHere = contextual.map(ContextualStatus::isApproved).orElse(false);
            if (!approvedHere && isEstablished(entity)) {
                excluded.add(entity.canonicalNameRaw());
                continue;
            }

            if (isDiscontinued(entity, contextual)) {
                discontinued.add(entity);
                continue;
            }
            DevelopmentPhase phase = contextual.map(ContextualStatus::phase).orElse(entity.phase());
            switch (phase) {
                case APPROVED -> approved.add(entity);
                case REGULATORY_FILING, PHASE_3 -> phase3.add(entity);
                case PHASE_2 -> phase2.add(entity);
                case PHASE_1 -> phase1.add(entity);
                default -> preclinical.add(entity);
            }
        }

        approved.sort(BY_MANUFACTURER);
        phase3.sort(BY_MANUFACTURER);
        phase2.sort(BY_MANUFACTURER);
        phase1.sort(BY_MANUFACTURER);
        preclinical.sort(BY_MANUFACTURER);
        discontinued.sort(MOST_RECENT_FIRST);

        List<MergedEntity> active = new ArrayList<>(approved);
        active.addAll(phase3);
        active.addAll(phase2);
        active.addAll(phase1);

        CompetitiveLandscape landscape = new CompetitiveLandscape(contextId, approved, phase3, phase2, phase1,
                preclinical, discontinued, mechanismClasses(active), excluded);
        log.info("landscape.built context={} active={} discontinued={} excluded={}",
                contextId, landscape.activeCount(), discontinued.size(), excluded.size());
        return landscape;
    }

    /**
     * Derives mechanism classes: the target attribute, or the mechanism text of an inhibitor
     * with "inhibitor" removed ("IL-17A inhibitor" gives "IL-17A").
     */
    static List<String> mechanismClasses(List<MergedEntity> active) {
        Set<String> classes = new LinkedHashSet<>();
        for (MergedEntity entity : active) {
            Optional<String> target = entity.attributeAsString(Attributes.TARGET);
            if (target.isPresent()) {
                classes.add(target.get());
                continue;
            }
            entity.attributeAsString(Attributes.MECHANISM_OF_ACTION)
                    .map(moa -> moa.toLowerCase(Locale.ROOT))
                    .filter(moa -> moa.contains("inhibitor"))
                    .map(moa -> moa.replace("inhibitor", "").trim().toUpperCase(Locale.ROOT))
                    .filter(moa -> !moa.isEmpty())
                    .ifPresent(classes::add);
        }
        return classes.stream().limit(MAX_MECHANISM_CLASSES).collect(Collectors.toList());
    }

    private boolean isEstablished(MergedEntity entity) {
        return establishedDrugs.contains(entity.identityKey())
                || establishedDrugs.contains(entity.canonicalNameRaw().toLowerCase(Locale.ROOT).trim());
    }

    private static boolean isDiscontinued(MergedEntity entity, Optional<ContextualStatus> contextual) {
        if (contextual.isPresent()) {
            return contextual.get().status() == ApprovalClassification.DISCONTINUED;
        }
        return entity.isTerminal();
    }

    public Set<String> getEstablishedDrugs() {
        return establishedDrugs;
    }
}
