package com.evidence.consensus.boundary;

import com.evidence.consensus.core.model.Attributes;
import com.evidence.consensus.core.model.CandidateEntity;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.DevelopmentStatus;
import com.evidence.consensus.core.model.QualityTier;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.StatusDetail;
import com.evidence.consensus.core.model.ValidationIssue;
import com.evidence.consensus.core.model.ValueKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Converts loosely-typed extractor records (JSON objects with optional keys, in camelCase
 * or snake_case) into {@link SourceEstimate} and {@link CandidateEntity}.
 *
 * <p>Missing, blank and non-numeric fields are treated as absent. A record missing a
 * required field is skipped with a warning; nothing here throws on bad data.</p>
 */
public class ExtractionRecordParser {
    private static final Logger log = LoggerFactory.getLogger(ExtractionRecordParser.class);

    private static final String[] SOURCE_ID = {"sourceId", "source_id", "pmid", "identifier", "nctId", "nct_id", "url"};
    private static final String[] VALUE = {"value", "totalPatients", "total_patients", "failRatePct", "fail_rate_pct",
            "pctTreated", "pct_treated"};
    private static final String[] VALUE_KIND = {"valueKind", "value_kind", "estimateType", "estimate_type"};
    private static final String[] QUALITY_TIER = {"qualityTier", "quality_tier"};
    private static final String[] YEAR = {"year", "dataYear", "data_year"};
    private static final String[] SAMPLE_SIZE = {"sampleSize", "sample_size", "studyPopulationN", "study_population_n"};

    private static final String[] NAME = {"genericName", "generic_name", "name", "drugName", "drug_name"};
    private static final String[] ALIAS_CODE = {"aliasCode", "alias_code", "developmentCode", "development_code",
            "researchCode", "research_code"};
    private static final String[] PHASE = {"phase", "highestPhase", "highest_phase"};
    private static final String[] STATUS = {"developmentStatus", "development_status", "status"};

    private final ObjectMapper objectMapper;

    public ExtractionRecordParser() {
        this(new ObjectMapper());
    }

    public ExtractionRecordParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parses a JSON array (or single object) of estimates.
     *
     * @param defaultKind kind used when a record names none, may be null
     */
    public ParseResult<SourceEstimate> parseEstimates(String json, ValueKind defaultKind) {
        if (json == null || json.isBlank()) {
            return new ParseResult<>(List.of(), List.of());
        }
        Optional<JsonNode> root = readTree(json);
        if (root.isEmpty()) {
            return new ParseResult<>(List.of(), List.of(malformed("estimates")));
        }
        return parseEstimates(root.get(), defaultKind);
    }

    public ParseResult<SourceEstimate> parseEstimates(JsonNode records, ValueKind defaultKind) {
        List<SourceEstimate> estimates = new ArrayList<>();
        List<ValidationIssue> issues = new ArrayList<>();
        int index = 0;
        for (JsonNode record : elements(records)) {
            parseEstimate(record, index++, defaultKind, issues).ifPresent(estimates::add);
        }
        log.debug("extraction.parsed type=estimates records={} accepted={} skipped={}",
                index, estimates.size(), index - estimates.size());
        return new ParseResult<>(estimates, issues);
    }

    public ParseResult<CandidateEntity> parseCandidates(String json) {
        if (json == null || json.isBlank()) {
            return new ParseResult<>(List.of(), List.of());
        }
        Optional<JsonNode> root = readTree(json);
        if (root.isEmpty()) {
            return new ParseResult<>(List.of(), List.of(malformed("candidates")));
        }
        return parseCandidates(root.get());
    }

    public ParseResult<CandidateEntity> parseCandidates(JsonNode records) {
        List<CandidateEntity> candidates = new ArrayList<>();
        List<ValidationIssue> issues = new ArrayList<>();
        int index = 0;
        for (JsonNode record : elements(records)) {
            parseCandidate(record, index++, issues).ifPresent(candidates::add);
        }
        log.debug("extraction.parsed type=candidates records={} accepted={} skipped={}",
                index, candidates.size(), index - candidates.size());
        return new ParseResult<>(candidates, issues);
    }

    private Optional<SourceEstimate> parseEstimate(JsonNode record, int index, ValueKind defaultKind,
                                                   List<ValidationIssue> issues) {
        String field = "estimates[" + index + "]";
        if (!record.isObject()) {
            issues.add(skipped(field, "record is not an object"));
            return Optional.empty();
        }
        Optional<String> sourceId = text(record, SOURCE_ID);
        if (sourceId.isEmpty()) {
            issues.add(skipped(field + ".sourceId", "missing source reference"));
            return Optional.empty();
        }
        Optional<String> kindLabel = text(record, VALUE_KIND);
        ValueKind kind = kindLabel.isPresent() ? ValueKind.fromLabel(kindLabel.get()).orElse(null) : defaultKind;
        if (kind == null) {
            issues.add(skipped(field + ".valueKind",
                    kindLabel.map(l -> "unknown value kind '" + l + "'").orElse("missing value kind")));
            return Optional.empty();
        }
        Optional<Double> value = number(record, VALUE);
        if (value.isEmpty()) {
            issues.add(skipped(field + ".value", "missing or non-numeric value"));
            return Optional.empty();
        }
        return Optional.of(SourceEstimate.builder()
                .sourceId(sourceId.get())
                .value(value.get())
                .valueKind(kind)
                .qualityTier(text(record, QUALITY_TIER).map(QualityTier::fromLabel).orElse(QualityTier.UNKNOWN))
                .year(number(record, YEAR).map(Double::intValue).orElse(null))
                .sampleSize(number(record, SAMPLE_SIZE).map(Double::longValue).orElse(null))
                .title(text(record, "title").orElse(null))
                .identifier(text(record, "identifier", "pmid", "doi").orElse(null))
                .url(text(record, "url").orElse(null))
                .build());
    }

    private Optional<CandidateEntity> parseCandidate(JsonNode record, int index, List<ValidationIssue> issues) {
        String field = "candidates[" + index + "]";
        if (!record.isObject()) {
            issues.add(skipped(field, "record is not an object"));
            return Optional.empty();
        }
        Optional<String> aliasCode = text(record, ALIAS_CODE);
        Optional<String> name = text(record, NAME).or(() -> aliasCode);
        if (name.isEmpty()) {
            issues.add(skipped(field + ".name", "missing name and development code"));
            return Optional.empty();
        }

        Optional<String> phaseText = text(record, PHASE);
        DevelopmentPhase phase = phaseText.map(PhaseParser::parsePhase).orElse(DevelopmentPhase.UNKNOWN);
        // "Discontinued" reported in the phase field still marks the status
        DevelopmentStatus status = text(record, STATUS).flatMap(PhaseParser::parseStatus)
                .or(() -> phaseText.flatMap(PhaseParser::parseStatus).filter(DevelopmentStatus::isTerminal))
                .orElse(DevelopmentStatus.ACTIVE);

        StatusDetail detail = new StatusDetail(
                text(record, "discontinuationDate", "discontinuation_date", "statusDate", "status_date").orElse(null),
                text(record, "discontinuationReason", "discontinuation_reason", "statusReason", "status_reason")
                        .orElse(null),
                text(record, "failureStage", "failure_stage").map(PhaseParser::parsePhase)
                        .filter(p -> p != DevelopmentPhase.UNKNOWN).orElse(null));

        List<String> nctIds = textList(record, "sourceNctIds", "source_nct_ids");
        List<String> urls = textList(record, "sourceUrls", "source_urls");

        CandidateEntity.Builder builder = CandidateEntity.builder()
                .canonicalNameRaw(name.get())
                .aliasCode(aliasCode.orElse(null))
                .phase(phase)
                .developmentStatus(status)
                .statusDetail(detail)
                .attribute(Attributes.MANUFACTURER, text(record, "manufacturer", "sponsor").orElse(null))
                .attribute(Attributes.MECHANISM_OF_ACTION,
                        text(record, "mechanismOfAction", "mechanism_of_action").orElse(null))
                .attribute(Attributes.TARGET, text(record, "target").orElse(null))
                .attribute(Attributes.PHASE_FOR_INDICATION,
                        text(record, "phaseForIndication", "phase_for_indication").orElse(null))
                .attribute("drugType", text(record, "drugType", "drug_type").orElse(null))
                .attribute("pubchemCid", text(record, "pubchemCid", "pubchem_cid").orElse(null))
                .attribute("casNumber", text(record, "casNumber", "cas_number").orElse(null))
                .attribute("unii", text(record, "unii").orElse(null))
                .sourceRefs(textList(record, "sourceRefs", "source_refs"))
                .sourceRefs(nctIds)
                .sourceRefs(urls)
                .statusOverride(flag(record, "statusOverride", "status_override"));
        if (!nctIds.isEmpty()) {
            builder.attribute("sourceNctIds", nctIds);
        }
        if (!urls.isEmpty()) {
            builder.attribute("sourceUrls", urls);
        }
        return Optional.of(builder.build());
    }

    private Optional<JsonNode> readTree(String json) {
        try {
            return Optional.of(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("extraction.malformed error={}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static Iterable<JsonNode> elements(JsonNode records) {
        if (records == null || records.isNull() || records.isMissingNode()) {
            return List.of();
        }
        return records.isArray() ? records : List.of(records);
    }

    static Optional<String> text(JsonNode record, String... names) {
        for (String name : names) {
            JsonNode node = record.get(name);
            if (node == null || node.isNull() || node.isContainerNode()) {
                continue;
            }
            String value = scalarText(node);
            if (!value.isBlank()) {
                return Optional.of(value.trim());
            }
        }
        return Optional.empty();
    }

    /**
     * Reads a number from a numeric node or from text such as "1,200,000" or "35%".
     */
    static Optional<Double> number(JsonNode record, String... names) {
        for (String name : names) {
            JsonNode node = record.get(name);
            if (node == null || node.isNull()) {
                continue;
            }
            if (node.isNumber()) {
                double value = node.doubleValue();
                if (Double.isFinite(value)) {
                    return Optional.of(value);
                }
                continue;
            }
            if (node.isTextual()) {
                String cleaned = node.textValue().replace(",", "").replace("%", "").trim();
                try {
                    double value = Double.parseDouble(cleaned);
                    if (Double.isFinite(value)) {
                        return Optional.of(value);
                    }
                } catch (NumberFormatException e) {
                    log.trace("extraction.nonNumeric field={} value={}", name, node.textValue());
                }
            }
        }
        return Optional.empty();
    }

    private static List<String> textList(JsonNode record, String... names) {
        Set<String> values = new LinkedHashSet<>();
        for (String name : names) {
            JsonNode node = record.get(name);
            if (node == null || node.isNull()) {
                continue;
            }
            Iterable<JsonNode> elements = node.isArray() ? node : List.of(node);
            for (JsonNode element : elements) {
                if (element.isValueNode() && !element.isNull()) {
                    String value = scalarText(element).trim();
                    if (!value.isEmpty()) {
                        values.add(value);
                    }
                }
            }
        }
        return new ArrayList<>(values);
    }

    private static boolean flag(JsonNode record, String... names) {
        for (String name : names) {
            JsonNode node = record.get(name);
            if (node != null && (node.isBoolean() || node.isTextual())) {
                return node.isBoolean() ? node.booleanValue() : Boolean.parseBoolean(node.textValue().trim());
            }
        }
        return false;
    }

    private static String scalarText(JsonNode node) {
        if (node.isFloatingPointNumber() && node.doubleValue() == Math.rint(node.doubleValue())
                && Math.abs(node.doubleValue()) < 1e15) {
            return String.valueOf(node.longValue());
        }
        return node.asText();
    }

    private static ValidationIssue skipped(String field, String reason) {
        return ValidationIssue.warning(field, "Skipped extracted record: " + reason,
                "Check extraction output for this record");
    }

    private static ValidationIssue malformed(String field) {
        return ValidationIssue.error(field, "Extractor output is not valid JSON",
                "Re-run extraction for this batch");
    }
}
