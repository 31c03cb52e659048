package com.evidence.consensus.merge;

import com.evidence.consensus.config.PhaseRanking;
import com.evidence.consensus.core.model.CandidateEntity;
import com.evidence.consensus.core.model.ContextualStatus;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.DevelopmentStatus;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.StatusDetail;
import com.evidence.consensus.identity.IdentityResolution;
import com.evidence.consensus.identity.IdentityResolver;
import com.evidence.consensus.identity.ResolutionBatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Merges entity sightings that share an identity key into one canonical record.
 *
 * <p>Merge is associative and idempotent, so any grouping of a fixed sequence of
 * sightings yields the same record:</p>
 * <ol>
 *   <li>Status: an explicit override source beats a terminal status, which beats plain
 *       active. Between two terminal statuses the later or more specific
 *       {@code statusDetail.date} wins, otherwise the existing record.</li>
 *   <li>Phase: {@code highestPhaseReached} is the most advanced phase of all inputs. An active
 *       result takes it as {@code phase}; a terminal result keeps the phase of the record
 *       whose status won.</li>
 *   <li>Attributes: nulls never overwrite values. Set-valued attributes are unioned and
 *       take precedence over scalars; between scalars the existing value is kept.</li>
 *   <li>Provenance: source references are unioned.</li>
 * </ol>
 *
 * <p>Recency is deliberately not a tie-break here.</p>
 */
public class EntityMergeEngine {
    private static final Logger log = LoggerFactory.getLogger(EntityMergeEngine.class);

    private final PhaseRanking phaseRanking;
    private final IdentityResolver identityResolver;

    public EntityMergeEngine(PhaseRanking phaseRanking, IdentityResolver identityResolver) {
        this.phaseRanking = Objects.requireNonNull(phaseRanking, "phaseRanking is required");
        this.identityResolver = Objects.requireNonNull(identityResolver, "identityResolver is required");
    }

    /**
     * Merges an incoming sighting into an existing record. The sighting is taken to belong
     * to the existing record's identity key.
     */
    public MergedEntity merge(MergedEntity existing, CandidateEntity incoming) {
        return merge(existing, MergedEntity.from(incoming, existing.identityKey()));
    }

    /**
     * Merges two records of the same identity key.
     *
     * @throws IllegalArgumentException if the identity keys differ
     */
    public MergedEntity merge(MergedEntity existing, MergedEntity incoming) {
        if (!existing.identityKey().equals(incoming.identityKey())) {
            throw new IllegalArgumentException("Cannot merge entities with different identity keys: '"
                    + existing.identityKey() + "' and '" + incoming.identityKey() + "'");
        }

        MergedEntity statusWinner = statusWinner(existing, incoming);
        boolean overridden = claim(statusWinner) == StatusClaim.OVERRIDE;
        DevelopmentPhase highest = phaseRanking.moreAdvanced(
                existing.highestPhaseReached(), incoming.highestPhaseReached());

        DevelopmentStatus status;
        DevelopmentPhase phase;
        StatusDetail detail;
        if (statusWinner.isTerminal()) {
            status = statusWinner.developmentStatus();
            phase = statusWinner.phase();
            detail = statusWinner.statusDetail();
        } else {
            status = DevelopmentStatus.ACTIVE;
            phase = highest;
            detail = null;
        }

        if (existing.isTerminal() && status == DevelopmentStatus.ACTIVE) {
            log.info("merge.status.overridden identityKey={} from={}", existing.identityKey(),
                    existing.developmentStatus());
        }

        Map<String, ContextualStatus> contexts = new LinkedHashMap<>(incoming.contextualStatus());
        contexts.putAll(existing.contextualStatus());

        Set<String> refs = new LinkedHashSet<>(existing.mergedSourceRefs());
        refs.addAll(incoming.mergedSourceRefs());

        return new MergedEntity(
                existing.identityKey(),
                existing.drugKey() != null ? existing.drugKey() : incoming.drugKey(),
                existing.canonicalNameRaw(),
                existing.aliasCode() != null ? existing.aliasCode() : incoming.aliasCode(),
                phase,
                highest,
                status,
                detail,
                overridden,
                mergeAttributes(existing.attributes(), incoming.attributes()),
                refs,
                contexts
        );
    }

    /**
     * Resolves identities across the batch and merges each group.
     *
     * @return merged entities in order of first appearance, plus identity diagnostics
     */
    public MergeBatch mergeAll(List<CandidateEntity> candidates) {
        if (candidates.isEmpty()) {
            return MergeBatch.empty();
        }
        ResolutionBatch resolutions = identityResolver.resolveAll(candidates);

        Map<String, MergedEntity> merged = new LinkedHashMap<>();
        Map<String, Integer> inputsPerKey = new LinkedHashMap<>();
        for (int i = 0; i < candidates.size(); i++) {
            IdentityResolution resolution = resolutions.get(i);
            String key = resolution.identityKey();
            MergedEntity sighting = MergedEntity.from(candidates.get(i), key, resolution.drugKey());
            merged.merge(key, sighting, this::merge);
            inputsPerKey.merge(key, 1, Integer::sum);
        }

        merged.forEach((key, entity) -> log.debug("merge.completed identityKey={} inputs={} status={} phase={}",
                key, inputsPerKey.get(key), entity.developmentStatus(), entity.phase()));
        log.info("merge.batch.completed candidates={} entities={} issues={}",
                candidates.size(), merged.size(), resolutions.issues().size());
        return new MergeBatch(new ArrayList<>(merged.values()), resolutions.issues());
    }

    private MergedEntity statusWinner(MergedEntity existing, MergedEntity incoming) {
        int cmp = claim(incoming).compareTo(claim(existing));
        if (cmp != 0) {
            return cmp > 0 ? incoming : existing;
        }
        if (existing.isTerminal() && incoming.isTerminal()) {
            return StatusDetail.BY_DATE.compare(detailOf(incoming), detailOf(existing)) > 0 ? incoming : existing;
        }
        return existing;
    }

    private static StatusDetail detailOf(MergedEntity entity) {
        return entity.statusDetail() != null ? entity.statusDetail() : StatusDetail.of(null, null);
    }

    private static StatusClaim claim(MergedEntity entity) {
        if (entity.statusOverridden() && !entity.isTerminal()) {
            return StatusClaim.OVERRIDE;
        }
        return entity.isTerminal() ? StatusClaim.TERMINAL : StatusClaim.ACTIVE;
    }

    static Map<String, Object> mergeAttributes(Map<String, Object> existing, Map<String, Object> incoming) {
        Map<String, Object> result = new LinkedHashMap<>(existing);
        incoming.forEach((name, value) -> result.merge(name, value, EntityMergeEngine::mergeValue));
        return result;
    }

    private static Object mergeValue(Object existing, Object incoming) {
        boolean existingSet = existing instanceof Collection<?>;
        boolean incomingSet = incoming instanceof Collection<?>;
        if (existingSet && incomingSet) {
            Set<Object> union = new LinkedHashSet<>((Collection<?>) existing);
            union.addAll((Collection<?>) incoming);
            return union;
        }
        if (incomingSet) {
            return incoming;
        }
        return existing;
    }

    /**
     * Strength of a record's claim on the merged status, weakest first.
     */
    private enum StatusClaim {
        ACTIVE,
        TERMINAL,
        OVERRIDE
    }
}
