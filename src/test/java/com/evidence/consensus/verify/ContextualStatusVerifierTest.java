package com.evidence.consensus.verify;

import com.evidence.consensus.core.model.ApprovalClassification;
import com.evidence.consensus.core.model.Attributes;
import com.evidence.consensus.core.model.CandidateEntity;
import com.evidence.consensus.core.model.ContextualStatus;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.DevelopmentStatus;
import com.evidence.consensus.core.model.MergedEntity;
import com.evidence.consensus.core.model.StatusDetail;
import com.evidence.consensus.identity.AliasTable;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ContextualStatusVerifierTest {

    private static final String RA = "Rheumatoid Arthritis";
    private static final String LN = "Lupus Nephritis";

    private ContextualStatusVerifier verifier;

    @BeforeEach
    void setUp() {
        ApprovalRegistry registry = ApprovalRegistry.builder()
                .approve(RA, "upadacitinib", "baricitinib")
                .approve("Systemic Lupus Erythematosus", "anifrolumab")
                .build();
        AliasTable aliases = AliasTable.builder().alias("MEDI-545", "anifrolumab").build();
        verifier = new ContextualStatusVerifier(registry, aliases);
    }

    private static MergedEntity entity(String name, DevelopmentPhase phase) {
        return MergedEntity.from(CandidateEntity.builder().canonicalNameRaw(name).phase(phase).build(),
                name.toLowerCase());
    }

    @Test
    @DisplayName("Approved in one context, investigational in another")
    void testApprovedOnlyInItsContext() {
        MergedEntity upadacitinib = entity("Upadacitinib", DevelopmentPhase.APPROVED);

        MergedEntity verified = verifier.verifyAll(upadacitinib, List.of(RA, LN));

        ContextualStatus ra = verified.statusIn(RA).orElseThrow();
        assertEquals(ApprovalClassification.APPROVED, ra.status());
        assertEquals(DevelopmentPhase.APPROVED, ra.phase());
        ContextualStatus ln = verified.statusIn(LN).orElseThrow();
        assertEquals(ApprovalClassification.INVESTIGATIONAL, ln.status());
        assertEquals(DevelopmentPhase.PHASE_3, ln.phase());
    }

    @Test
    @DisplayName("Verification never changes the canonical fields")
    void testCanonicalFieldsUnchanged() {
        MergedEntity upadacitinib = entity("Upadacitinib", DevelopmentPhase.APPROVED);

        MergedEntity verified = verifier.verifyAll(upadacitinib, List.of(LN));

        assertEquals(DevelopmentPhase.APPROVED, verified.phase());
        assertEquals(upadacitinib.developmentStatus(), verified.developmentStatus());
        assertTrue(upadacitinib.contextualStatus().isEmpty());
    }

    @Test
    @DisplayName("Phase reported for the indication replaces the fallback")
    void testPhaseForIndication() {
        MergedEntity baricitinib = MergedEntity.from(CandidateEntity.builder()
                .canonicalNameRaw("baricitinib")
                .phase(DevelopmentPhase.APPROVED)
                .attribute(Attributes.PHASE_FOR_INDICATION, "Phase 2")
                .build(), "baricitinib");

        ContextualStatus status = verifier.verify(baricitinib, LN);

        assertEquals(ApprovalClassification.INVESTIGATIONAL, status.status());
        assertEquals(DevelopmentPhase.PHASE_2, status.phase());
    }

    @Test
    @DisplayName("Entity whose highest phase was approval but now trials elsewhere keeps its trial phase")
    void testHighestApprovedWithTrialPhase() {
        MergedEntity entity = new MergedEntity("deucravacitinib", null, "deucravacitinib", null,
                DevelopmentPhase.PHASE_2, DevelopmentPhase.APPROVED, DevelopmentStatus.ACTIVE, null, false,
                null, null, null);

        assertEquals(DevelopmentPhase.PHASE_2, verifier.verify(entity, LN).phase());
    }

    @Test
    void testCustomFallbackPhase() {
        ContextualStatusVerifier custom = new ContextualStatusVerifier(ApprovalRegistry.empty(), AliasTable.empty(),
                DevelopmentPhase.PHASE_2);

        assertEquals(DevelopmentPhase.PHASE_2, custom.verify(entity("x", DevelopmentPhase.APPROVED), LN).phase());
        assertThrows(IllegalArgumentException.class, () -> new ContextualStatusVerifier(
                ApprovalRegistry.empty(), AliasTable.empty(), DevelopmentPhase.APPROVED));
    }

    @Test
    @DisplayName("Terminal entities are discontinued at the phase they stopped")
    void testTerminalIsDiscontinued() {
        MergedEntity failed = MergedEntity.from(CandidateEntity.builder()
                .canonicalNameRaw("iscalimab")
                .phase(DevelopmentPhase.PHASE_2)
                .developmentStatus(DevelopmentStatus.FAILED)
                .statusDetail(StatusDetail.of("2023", "Lack of efficacy"))
                .build(), "iscalimab");

        ContextualStatus status = verifier.verify(failed, LN);

        assertEquals(ApprovalClassification.DISCONTINUED, status.status());
        assertEquals(DevelopmentPhase.PHASE_2, status.phase());
    }

    @Test
    @DisplayName("Registry approval wins over a terminal status elsewhere")
    void testApprovalWinsOverTerminal() {
        MergedEntity withdrawnElsewhere = MergedEntity.from(CandidateEntity.builder()
                .canonicalNameRaw("baricitinib")
                .phase(DevelopmentPhase.PHASE_3)
                .developmentStatus(DevelopmentStatus.DISCONTINUED)
                .build(), "baricitinib");

        assertEquals(ApprovalClassification.APPROVED, verifier.verify(withdrawnElsewhere, RA).status());
    }

    @Test
    @DisplayName("Development codes are resolved through the alias table")
    void testAliasedName() {
        MergedEntity code = entity("MEDI-545", DevelopmentPhase.APPROVED);

        ContextualStatus status = verifier.verify(code, "systemic lupus  erythematosus");

        assertEquals(ApprovalClassification.APPROVED, status.status());
    }

    @Test
    void testInvestigationalKeepsOwnPhase() {
        ContextualStatus status = verifier.verify(entity("ianalumab", DevelopmentPhase.PHASE_3), LN);

        assertEquals(ApprovalClassification.INVESTIGATIONAL, status.status());
        assertEquals(DevelopmentPhase.PHASE_3, status.phase());
    }

    @Test
    void testExplicitRegistryOverridesConfigured() {
        ApprovalRegistry other = ApprovalRegistry.builder().approve(LN, "voclosporin").build();

        ContextualStatus status = verifier.verify(entity("Voclosporin", DevelopmentPhase.APPROVED), LN,
                other, AliasTable.empty());

        assertEquals(ApprovalClassification.APPROVED, status.status());
    }

    @Test
    void testVerifyAllOverList() {
        List<MergedEntity> verified = verifier.verifyAll(
                List.of(entity("upadacitinib", DevelopmentPhase.APPROVED), entity("obexelimab", DevelopmentPhase.PHASE_2)),
                List.of(RA));

        assertEquals(2, verified.size());
        assertTrue(verified.get(0).statusIn(RA).orElseThrow().isApproved());
        assertFalse(verified.get(1).statusIn(RA).orElseThrow().isApproved());
    }

    @Test
    void testRegistryMatchingIsCaseInsensitive() {
        ApprovalRegistry registry = ApprovalRegistry.builder().approve(" Rheumatoid  arthritis", "Upadacitinib").build();

        assertTrue(registry.isApproved("rheumatoid arthritis", "UPADACITINIB"));
        assertEquals(1, registry.contexts().size());
        assertTrue(registry.approvedIn("unknown").isEmpty());
        assertThrows(IllegalArgumentException.class, () -> ApprovalRegistry.builder().approve(" ", "x"));
    }
}
