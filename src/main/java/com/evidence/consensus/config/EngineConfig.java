package com.evidence.consensus.config;

import com.evidence.consensus.identity.AliasTable;
import com.evidence.consensus.identity.IdentityResolver;
import com.evidence.consensus.identity.cache.CacheConfig;
import com.evidence.consensus.verify.ApprovalRegistry;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Complete engine configuration, built once at process start and shared read-only.
 */
public class EngineConfig {

    private static final int DEFAULT_CONCURRENCY = 3;

    private final ScoringConfig scoring;
    private final ConsensusConfig consensus;
    private final PhaseRanking phaseRanking;
    private final AliasTable aliasTable;
    private final ApprovalRegistry approvalRegistry;
    private final ValidationConfig validation;
    private final List<String> externalIdAttributes;
    private final Set<String> establishedDrugs;
    private final int concurrency;
    private final CacheConfig cache;

    private EngineConfig(Builder builder) {
        this.scoring = builder.scoring;
        this.consensus = builder.consensus;
        this.phaseRanking = builder.phaseRanking;
        this.aliasTable = builder.aliasTable;
        this.approvalRegistry = builder.approvalRegistry;
        this.validation = builder.validation;
        this.externalIdAttributes = List.copyOf(builder.externalIdAttributes);
        this.establishedDrugs = Set.copyOf(builder.establishedDrugs);
        this.concurrency = builder.concurrency;
        this.cache = builder.cache;
    }

    public static EngineConfig defaults() {
        return builder().build();
    }

    public ScoringConfig getScoring() {
        return scoring;
    }

    public ConsensusConfig getConsensus() {
        return consensus;
    }

    public PhaseRanking getPhaseRanking() {
        return phaseRanking;
    }

    public AliasTable getAliasTable() {
        return aliasTable;
    }

    public ApprovalRegistry getApprovalRegistry() {
        return approvalRegistry;
    }

    public ValidationConfig getValidation() {
        return validation;
    }

    /**
     * Attribute names checked, in order, for an external identifier (PubChem CID, CAS number...).
     */
    public List<String> getExternalIdAttributes() {
        return externalIdAttributes;
    }

    public Set<String> getEstablishedDrugs() {
        return establishedDrugs;
    }

    /**
     * Maximum number of targets aggregated in parallel.
     */
    public int getConcurrency() {
        return concurrency;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringConfig scoring = ScoringConfig.defaults();
        private ConsensusConfig consensus = ConsensusConfig.defaults();
        private PhaseRanking phaseRanking = PhaseRanking.defaults();
        private AliasTable aliasTable = AliasTable.empty();
        private ApprovalRegistry approvalRegistry = ApprovalRegistry.empty();
        private ValidationConfig validation = ValidationConfig.defaults();
        private List<String> externalIdAttributes = IdentityResolver.DEFAULT_EXTERNAL_ID_ATTRIBUTES;
        private Set<String> establishedDrugs = Set.of();
        private int concurrency = DEFAULT_CONCURRENCY;
        private CacheConfig cache = CacheConfig.defaults();

        public Builder scoring(ScoringConfig scoring) {
            this.scoring = scoring;
            return this;
        }

        public Builder consensus(ConsensusConfig consensus) {
            this.consensus = consensus;
            return this;
        }

        public Builder phaseRanking(PhaseRanking phaseRanking) {
            this.phaseRanking = phaseRanking;
            return this;
        }

        public Builder aliasTable(AliasTable aliasTable) {
            this.aliasTable = aliasTable;
            return this;
        }

        public Builder approvalRegistry(ApprovalRegistry approvalRegistry) {
            this.approvalRegistry = approvalRegistry;
            return this;
        }

        public Builder validation(ValidationConfig validation) {
            this.validation = validation;
            return this;
        }

        public Builder externalIdAttributes(List<String> externalIdAttributes) {
            this.externalIdAttributes = externalIdAttributes;
            return this;
        }

        public Builder establishedDrugs(Collection<String> establishedDrugs) {
            this.establishedDrugs = new LinkedHashSet<>(establishedDrugs);
            return this;
        }

        public Builder concurrency(int concurrency) {
            if (concurrency <= 0) {
                throw new IllegalArgumentException("concurrency must be > 0");
            }
            this.concurrency = concurrency;
            return this;
        }

        public Builder cache(CacheConfig cache) {
            this.cache = cache;
            return this;
        }

        public EngineConfig build() {
            if (scoring == null || consensus == null || phaseRanking == null || aliasTable == null
                    || approvalRegistry == null || validation == null || cache == null) {
                throw new IllegalArgumentException("EngineConfig sections must not be null");
            }
            return new EngineConfig(this);
        }
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "scoring=" + scoring +
                ", consensus=" + consensus +
                ", phaseRanking=" + phaseRanking +
                ", aliasTable=" + aliasTable +
                ", approvalRegistry=" + approvalRegistry +
                ", concurrency=" + concurrency +
                ", cache=" + cache +
                '}';
    }
}
