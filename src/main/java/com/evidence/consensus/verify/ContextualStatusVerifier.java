package com.evidence.consensus.verify;

import com.evidence.consensus.boundary.PhaseParser;
import com.evidence.consensus.core.model.ApprovalClassification;
import com.evidence.consensus.core.model.Attributes;
import com.evidence.consensus.core.model.ContextualStatus;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.identity.AliasTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Classifies a merged entity's approval status within one context.
 *
 * <p>Order of checks:</p>
 * <ol>
 *   <li>approved in the context's registry entry: APPROVED / Approved</li>
 *   <li>terminal development status: DISCONTINUED at the entity's phase</li>
 *   <li>approved in some other context: INVESTIGATIONAL at the phase reported for this
 *       indication, else the fallback phase (Phase 3)</li>
 *   <li>otherwise INVESTIGATIONAL at the entity's phase</li>
 * </ol>
 *
 * <p>The canonical entity is never changed; the result is a per-context view.</p>
 */
public class ContextualStatusVerifier {
    private static final Logger log = LoggerFactory.getLogger(ContextualStatusVerifier.class);

    public static final DevelopmentPhase DEFAULT_FALLBACK_PHASE = DevelopmentPhase.PHASE_3;

    private final ApprovalRegistry approvalRegistry;
    private final AliasTable aliasTable;
    private final DevelopmentPhase fallbackPhase;

    public ContextualStatusVerifier(ApprovalRegistry approvalRegistry, AliasTable aliasTable) {
        this(approvalRegistry, aliasTable, DEFAULT_FALLBACK_PHASE);
    }

    public ContextualStatusVerifier(ApprovalRegistry approvalRegistry, AliasTable aliasTable,
                                    DevelopmentPhase fallbackPhase) {
        this.approvalRegistry = Objects.requireNonNull(approvalRegistry, "approvalRegistry is required");
        this.aliasTable = Objects.requireNonNull(aliasTable, "aliasTable is required");
        if (fallbackPhase == DevelopmentPhase.APPROVED || fallbackPhase == DevelopmentPhase.UNKNOWN) {
            throw new IllegalArgumentException("Fallback phase must be a development phase, got " + fallbackPhase);
        }
        this.fallbackPhase = fallbackPhase;
    }

    /**
     * Verifies against the configured registry and alias table.
     */
    public ContextualStatus verify(MergedEntity entity, String contextId) {
        return verify(entity, contextId, approvalRegistry, aliasTable);
    }

    public ContextualStatus verify(MergedEntity entity, String contextId,
                                   ApprovalRegistry registry, AliasTable aliases) {
        ContextualStatus status;
        if (isApprovedIn(entity, contextId, registry, aliases)) {
            status = new ContextualStatus(contextId, ApprovalClassification.APPROVED, DevelopmentPhase.APPROVED);
        } else if (entity.isTerminal()) {
            status = new ContextualStatus(contextId, ApprovalClassification.DISCONTINUED, entity.phase());
        } else if (entity.phase() == DevelopmentPhase.APPROVED
                || entity.highestPhaseReached() == DevelopmentPhase.APPROVED) {
            status = new ContextualStatus(contextId, ApprovalClassification.INVESTIGATIONAL, phaseForContext(entity));
            log.debug("status.downgraded identityKey={} context={} phase={}",
                    entity.identityKey(), contextId, status.phase());
        } else {
            status = new ContextualStatus(contextId, ApprovalClassification.INVESTIGATIONAL, entity.phase());
        }
        log.trace("status.verified identityKey={} context={} status={}", entity.identityKey(), contextId, status.status());
        return status;
    }

    /**
     * Returns a copy of the entity with its status verified in every given context.
     */
    public MergedEntity verifyAll(MergedEntity entity, Collection<String> contextIds) {
        MergedEntity result = entity;
        for (String contextId : contextIds) {
            result = result.withContextualStatus(verify(entity, contextId));
        }
        return result;
    }

    public List<MergedEntity> verifyAll(List<MergedEntity> entities, Collection<String> contextIds) {
        List<MergedEntity> verified = new ArrayList<>(entities.size());
        for (MergedEntity entity : entities) {
            verified.add(verifyAll(entity, contextIds));
        }
        return verified;
    }

    private boolean isApprovedIn(MergedEntity entity, String contextId,
                                 ApprovalRegistry registry, AliasTable aliases) {
        for (String name : candidateNames(entity, aliases)) {
            if (registry.isApproved(contextId, name)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> candidateNames(MergedEntity entity, AliasTable aliases) {
        Set<String> names = new LinkedHashSet<>();
        names.add(aliases.canonicalFor(entity.canonicalNameRaw()).orElse(entity.canonicalNameRaw()));
        names.add(entity.identityKey());
        names.add(entity.canonicalNameRaw());
        if (entity.aliasCode() != null) {
            aliases.canonicalFor(entity.aliasCode()).ifPresent(names::add);
        }
        return names;
    }

    private DevelopmentPhase phaseForContext(MergedEntity entity) {
        DevelopmentPhase reported = entity.attributeAsString(Attributes.PHASE_FOR_INDICATION)
                .map(PhaseParser::parsePhase)
                .orElse(DevelopmentPhase.UNKNOWN);
        if (reported != DevelopmentPhase.APPROVED && reported != DevelopmentPhase.UNKNOWN) {
            return reported;
        }
        if (entity.phase() != DevelopmentPhase.APPROVED && entity.phase() != DevelopmentPhase.UNKNOWN) {
            return entity.phase();
        }
        return fallbackPhase;
    }

    public ApprovalRegistry getApprovalRegistry() {
        return approvalRegistry;
    }

    public AliasTable getAliasTable() {
        return aliasTable;
    }
}
