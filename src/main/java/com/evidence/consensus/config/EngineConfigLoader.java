package com.evidence.consensus.config;

import com.evidence.consensus.boundary.PhaseParser;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.QualityTier;
import com.evidence.consensus.core.model.ValueKind;
import com.evidence.consensus.identity.AliasTable;
import com.evidence.consensus.identity.cache.CacheConfig;
import com.evidence.consensus.verify.ApprovalRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads an {@link EngineConfig} from JSON. Every section is optional and falls back to the
 * built-in defaults:
 *
 * <pre>
 * {
 *   "scoring":    {"tierWeights": {"Tier 1": 3.0}, "recencyCutoffYear": 2020, "recencyMultiplier": 1.5,
 *                  "sampleSizeThresholds": [{"minExclusive": 10000000, "multiplier": 1.3}]},
 *   "consensus":  {"highConfidence": {"minTier1": 2, "maxCv": 0.3},
 *                  "mediumConfidence": {"minTier1": 1, "maxCv": 0.5},
 *                  "replicationFactor": 10, "domains": {"failureRate": {"min": 0, "max": 100}}},
 *   "phaseRanks": {"PHASE_3": 3},
 *   "aliases":    {"MEDI-545": "anifrolumab"},
 *   "approvals":  {"Rheumatoid Arthritis": ["upadacitinib"]},
 *   "externalIdAttributes": ["pubchemCid", "casNumber"],
 *   "establishedDrugs": ["methotrexate"],
 *   "concurrency": 3,
 *   "cache":      {"maxSize": 10000, "ttlSeconds": 600, "enabled": true},
 *   "validation": {"wideSpreadRatio": 10, "roundNumberUnit": 10000, "failureRateSpreadPoints": 50,
 *                  "lowTreatmentRatePercent": 20, "rareDiseasePrevalenceLimit": 200000}
 * }
 * </pre>
 *
 * <p>Read failures and invalid values surface as {@link ConfigurationException}.</p>
 */
public class EngineConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(EngineConfigLoader.class);

    public static final String DEFAULT_RESOURCE = "evidence-consensus.json";

    private final ObjectMapper objectMapper;

    public EngineConfigLoader() {
        this(new ObjectMapper());
    }

    public EngineConfigLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Loads the configuration shipped on the classpath.
     */
    public EngineConfig loadDefault() {
        return loadResource(DEFAULT_RESOURCE);
    }

    public EngineConfig loadResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = EngineConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new ConfigurationException("Configuration resource not found: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration resource " + resource, e);
        }
    }

    public EngineConfig load(Path path) {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read configuration file " + path, e);
        }
    }

    public EngineConfig load(InputStream in, String source) {
        JsonNode root;
        try {
            root = objectMapper.readTree(in);
        } catch (IOException e) {
            throw new ConfigurationException("Malformed configuration in " + source, e);
        }
        if (root == null || root.isMissingNode() || root.isNull()) {
            log.warn("config.empty source={}", source);
            return EngineConfig.defaults();
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Configuration root must be a JSON object in " + source);
        }
        try {
            EngineConfig config = parse(root);
            log.info("config.loaded source={} aliases={} approvalContexts={} concurrency={}",
                    source, config.getAliasTable().size(), config.getApprovalRegistry().contexts().size(),
                    config.getConcurrency());
            return config;
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    EngineConfig parse(JsonNode root) {
        EngineConfig.Builder builder = EngineConfig.builder();
        if (root.has("scoring")) {
            builder.scoring(parseScoring(root.get("scoring")));
        }
        if (root.has("consensus")) {
            builder.consensus(parseConsensus(root.get("consensus")));
        }
        if (root.has("phaseRanks")) {
            builder.phaseRanking(parsePhaseRanks(root.get("phaseRanks")));
        }
        if (root.has("aliases")) {
            AliasTable.Builder aliases = AliasTable.builder();
            fields(root.get("aliases")).forEachRemaining(e -> aliases.alias(e.getKey(), e.getValue().asText()));
            builder.aliasTable(aliases.build());
        }
        if (root.has("approvals")) {
            ApprovalRegistry.Builder approvals = ApprovalRegistry.builder();
            fields(root.get("approvals")).forEachRemaining(e -> approvals.approve(e.getKey(), strings(e.getValue())));
            builder.approvalRegistry(approvals.build());
        }
        if (root.has("externalIdAttributes")) {
            builder.externalIdAttributes(strings(root.get("externalIdAttributes")));
        }
        if (root.has("establishedDrugs")) {
            builder.establishedDrugs(strings(root.get("establishedDrugs")));
        }
        if (root.has("concurrency")) {
            builder.concurrency(root.get("concurrency").asInt());
        }
        if (root.has("cache")) {
            JsonNode cache = root.get("cache");
            CacheConfig defaults = CacheConfig.defaults();
            builder.cache(new CacheConfig(
                    cache.path("maxSize").asInt(defaults.maxSize()),
                    cache.path("ttlSeconds").asInt(defaults.ttlSeconds()),
                    cache.path("enabled").asBoolean(defaults.enabled())));
        }
        if (root.has("validation")) {
            JsonNode validation = root.get("validation");
            ValidationConfig defaults = ValidationConfig.defaults();
            builder.validation(new ValidationConfig(
                    validation.path("wideSpreadRatio").asDouble(defaults.wideSpreadRatio()),
                    validation.path("roundNumberUnit").asDouble(defaults.roundNumberUnit()),
                    validation.path("failureRateSpreadPoints").asDouble(defaults.failureRateSpreadPoints()),
                    validation.path("lowTreatmentRatePercent").asDouble(defaults.lowTreatmentRatePercent()),
                    validation.path("rareDiseasePrevalenceLimit").asDouble(defaults.rareDiseasePrevalenceLimit())));
        }
        return builder.build();
    }

    private ScoringConfig parseScoring(JsonNode node) {
        ScoringConfig.Builder builder = ScoringConfig.builder();
        fields(node.path("tierWeights")).forEachRemaining(e -> {
            QualityTier tier = QualityTier.fromLabel(e.getKey());
            if (tier == QualityTier.UNKNOWN && !e.getKey().equalsIgnoreCase("unknown")) {
                throw new IllegalArgumentException("Unknown quality tier '" + e.getKey() + "'");
            }
            builder.tierWeight(tier, e.getValue().asDouble());
        });
        if (node.has("recencyCutoffYear")) {
            builder.recencyCutoffYear(node.get("recencyCutoffYear").asInt());
        }
        if (node.has("recencyMultiplier")) {
            builder.recencyMultiplier(node.get("recencyMultiplier").asDouble());
        }
        if (node.has("sampleSizeThresholds")) {
            List<SampleSizeThreshold> thresholds = new ArrayList<>();
            for (JsonNode threshold : node.get("sampleSizeThresholds")) {
                thresholds.add(new SampleSizeThreshold(
                        threshold.path("minExclusive").asLong(),
                        threshold.path("multiplier").asDouble()));
            }
            builder.sampleSizeThresholds(thresholds);
        }
        return builder.build();
    }

    private ConsensusConfig parseConsensus(JsonNode node) {
        ConsensusConfig defaults = ConsensusConfig.defaults();
        ConsensusConfig.Builder builder = ConsensusConfig.builder();
        JsonNode high = node.path("highConfidence");
        builder.highConfidence(
                high.path("minTier1").asInt(defaults.getHighConfidenceMinTier1()),
                high.path("maxCv").asDouble(defaults.getHighConfidenceMaxCv()));
        JsonNode medium = node.path("mediumConfidence");
        builder.mediumConfidence(
                medium.path("minTier1").asInt(defaults.getMediumConfidenceMinTier1()),
                medium.path("maxCv").asDouble(defaults.getMediumConfidenceMaxCv()));
        if (node.has("replicationFactor")) {
            builder.replicationFactor(node.get("replicationFactor").asInt());
        }
        fields(node.path("domains")).forEachRemaining(e -> {
            ValueKind kind = ValueKind.fromLabel(e.getKey())
                    .orElseThrow(() -> new IllegalArgumentException("Unknown value kind '" + e.getKey() + "'"));
            JsonNode domain = e.getValue();
            builder.domain(kind, new ValueDomain(
                    domain.path("min").asDouble(0.0),
                    domain.has("max") ? domain.get("max").asDouble() : Double.POSITIVE_INFINITY));
        });
        return builder.build();
    }

    private PhaseRanking parsePhaseRanks(JsonNode node) {
        PhaseRanking.Builder builder = PhaseRanking.builder();
        fields(node).forEachRemaining(e -> {
            DevelopmentPhase phase = PhaseParser.parsePhase(e.getKey());
            if (phase == DevelopmentPhase.UNKNOWN && !e.getKey().toLowerCase(Locale.ROOT).contains("unknown")) {
                throw new IllegalArgumentException("Unknown phase '" + e.getKey() + "'");
            }
            builder.rank(phase, e.getValue().asInt());
        });
        return builder.build();
    }

    private static Iterator<Map.Entry<String, JsonNode>> fields(JsonNode node) {
        if (!node.isObject()) {
            return Collections.emptyIterator();
        }
        return node.fields();
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode element : node) {
                values.add(element.asText());
            }
        } else if (node.isTextual()) {
            values.add(node.asText());
        }
        return values;
    }
}
