package com.evidence.consensus.boundary;

import com.evidence.consensus.core.model.Attributes;
import com.evidence.consensus.core.model.CandidateEntity;
import com.evidence.consensus.core.model.DevelopmentPhase;
import com.evidence.consensus.core.model.DevelopmentStatus;
import com.evidence.consensus.core.model.QualityTier;
import com.evidence.consensus.core.model.Severity;
import com.evidence.consensus.core.model.SourceEstimate;
import com.evidence.consensus.core.model.ValueKind;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionRecordParserTest {

    private ObjectMapper objectMapper;
    private ExtractionRecordParser parser;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        parser = new ExtractionRecordParser(objectMapper);
    }

    @Nested
    @DisplayName("Estimates")
    class EstimateTests {

        @Test
        @DisplayName("Reads camelCase and snake_case records")
        void testParsesBothNamingStyles() {
            String json = """
                    [
                      {"source_id": "pmid:111", "value": "1,200,000", "quality_tier": "Tier 1",
                       "year": 2022, "sample_size": 5000, "title": "US claims analysis"},
                      {"sourceId": "pmid:222", "value": 950000, "qualityTier": "tier2", "dataYear": "2018"}
                    ]
                    """;

            ParseResult<SourceEstimate> result = parser.parseEstimates(json, ValueKind.PREVALENCE);

            assertFalse(result.hasIssues());
            assertEquals(2, result.values().size());
            SourceEstimate first = result.values().get(0);
            assertEquals("pmid:111", first.sourceId());
            assertEquals(1_200_000.0, first.value(), 1e-9);
            assertEquals(QualityTier.TIER_1, first.qualityTier());
            assertEquals(2022, first.year());
            assertEquals(5000L, first.sampleSize());
            assertEquals(ValueKind.PREVALENCE, first.valueKind());
            assertEquals(2018, result.values().get(1).year());
        }

        @Test
        void testPercentValueAndExplicitKind() {
            String json = """
                    {"pmid": "31234567", "fail_rate_pct": "35%", "estimate_type": "failure_rate"}
                    """;

            ParseResult<SourceEstimate> result = parser.parseEstimates(json, ValueKind.PREVALENCE);

            assertEquals(1, result.values().size());
            assertEquals(ValueKind.FAILURE_RATE, result.values().get(0).valueKind());
            assertEquals(35.0, result.values().get(0).value(), 1e-9);
            assertEquals(QualityTier.UNKNOWN, result.values().get(0).qualityTier());
        }

        @Test
        @DisplayName("Incomplete records are skipped with a warning, the rest are kept")
        void testSkipsIncompleteRecords() {
            String json = """
                    [
                      {"value": 10},
                      {"sourceId": "a", "value": "n/a"},
                      {"sourceId": "b", "value": 5, "valueKind": "mortality"},
                      "not an object",
                      {"sourceId": "c", "value": 7}
                    ]
                    """;

            ParseResult<SourceEstimate> result = parser.parseEstimates(json, ValueKind.INCIDENCE);

            assertEquals(1, result.values().size());
            assertEquals("c", result.values().get(0).sourceId());
            assertEquals(4, result.issues().size());
            assertTrue(result.issues().stream().allMatch(i -> i.severity() == Severity.WARNING));
            assertEquals("estimates[0].sourceId", result.issues().get(0).field());
            assertEquals("estimates[1].value", result.issues().get(1).field());
            assertEquals("estimates[2].valueKind", result.issues().get(2).field());
            assertEquals("estimates[3]", result.issues().get(3).field());
            assertTrue(result.issues().get(0).message().startsWith("Skipped extracted record"));
        }

        @Test
        void testMissingKindWithoutDefault() {
            ParseResult<SourceEstimate> result = parser.parseEstimates("[{\"sourceId\": \"a\", \"value\": 1}]", null);

            assertTrue(result.values().isEmpty());
            assertEquals("estimates[0].valueKind", result.issues().get(0).field());
        }

        @Test
        void testMalformedJson() {
            ParseResult<SourceEstimate> result = parser.parseEstimates("[{\"sourceId\": ", ValueKind.PREVALENCE);

            assertTrue(result.values().isEmpty());
            assertEquals(1, result.issues().size());
            assertEquals(Severity.ERROR, result.issues().get(0).severity());
            assertEquals("estimates", result.issues().get(0).field());
        }

        @Test
        void testBlankInputIsEmpty() {
            ParseResult<SourceEstimate> result = parser.parseEstimates("  ", ValueKind.PREVALENCE);

            assertTrue(result.values().isEmpty());
            assertFalse(result.hasIssues());
        }
    }

    @Nested
    @DisplayName("Candidates")
    class CandidateTests {

        @Test
        void testFullRecord() {
            String json = """
                    [{
                      "generic_name": "Anifrolumab",
                      "development_code": "MEDI-546",
                      "phase": "Phase 3",
                      "status": "Recruiting",
                      "manufacturer": "AstraZeneca",
                      "mechanism_of_action": "Type I IFN receptor antagonist",
                      "target": "IFNAR1",
                      "unii": "38RL9AE51Q",
                      "source_nct_ids": ["NCT05138133", "NCT05138133", "NCT04877691"],
                      "source_urls": "https://clinicaltrials.gov/study/NCT05138133"
                    }]
                    """;

            ParseResult<CandidateEntity> result = parser.parseCandidates(json);

            assertFalse(result.hasIssues());
            CandidateEntity candidate = result.values().get(0);
            assertEquals("Anifrolumab", candidate.canonicalNameRaw());
            assertEquals("MEDI-546", candidate.aliasCode());
            assertEquals(DevelopmentPhase.PHASE_3, candidate.phase());
            assertEquals(DevelopmentStatus.ACTIVE, candidate.developmentStatus());
            assertEquals("AstraZeneca", candidate.attribute(Attributes.MANUFACTURER).orElseThrow());
            assertEquals("IFNAR1", candidate.attribute(Attributes.TARGET).orElseThrow());
            assertEquals("38RL9AE51Q", candidate.attribute("unii").orElseThrow());
            assertEquals(Set.of("NCT05138133", "NCT04877691"), candidate.attribute("sourceNctIds").orElseThrow());
            assertEquals(Set.of("NCT05138133", "NCT04877691", "https://clinicaltrials.gov/study/NCT05138133"),
                    candidate.sourceRefs());
            assertFalse(candidate.statusOverride());
        }

        @Test
        @DisplayName("A terminal status written in the phase field still marks the candidate")
        void testDiscontinuedInPhaseField() {
            String json = """
                    {"name": "iscalimab", "phase": "Discontinued (Phase 2)",
                     "discontinuation_date": "2023-06", "discontinuation_reason": "Lack of efficacy"}
                    """;

            CandidateEntity candidate = parser.parseCandidates(json).values().get(0);

            assertEquals(DevelopmentStatus.DISCONTINUED, candidate.developmentStatus());
            assertEquals(DevelopmentPhase.PHASE_2, candidate.phase());
            assertEquals("2023-06", candidate.statusDetail().date());
            assertEquals("Lack of efficacy", candidate.statusDetail().reason());
        }

        @Test
        void testDetailDroppedForActiveCandidate() {
            CandidateEntity candidate = parser.parseCandidates(
                    "{\"name\": \"x\", \"status\": \"active\", \"status_reason\": \"none\"}").values().get(0);

            assertNull(candidate.statusDetail());
        }

        @Test
        void testCodeOnlyRecordUsesCodeAsName() {
            CandidateEntity candidate = parser.parseCandidates(
                    "{\"research_code\": \"CFZ533\", \"phase\": \"Phase 2\", \"statusOverride\": \"true\"}")
                    .values().get(0);

            assertEquals("CFZ533", candidate.canonicalNameRaw());
            assertEquals("CFZ533", candidate.aliasCode());
            assertTrue(candidate.statusOverride());
        }

        @Test
        void testNamelessRecordSkipped() {
            ParseResult<CandidateEntity> result = parser.parseCandidates("[{\"phase\": \"Phase 1\"}, {\"name\": \"y\"}]");

            assertEquals(1, result.values().size());
            assertEquals("candidates[0].name", result.issues().get(0).field());
        }

        @Test
        void testParsesTree() {
            ObjectNode record = objectMapper.createObjectNode()
                    .put("drugName", "obexelimab")
                    .put("highestPhase", "Phase 2")
                    .put("pubchemCid", 123456.0);

            CandidateEntity candidate = parser.parseCandidates(record).values().get(0);

            assertEquals("obexelimab", candidate.canonicalNameRaw());
            assertEquals("123456", candidate.attribute("pubchemCid").orElseThrow());
        }

        @Test
        void testMalformedJson() {
            ParseResult<CandidateEntity> result = parser.parseCandidates("{oops");

            assertEquals("candidates", result.issues().get(0).field());
            assertEquals(Severity.ERROR, result.issues().get(0).severity());
        }
    }

    @Test
    void testNumberHelper() throws Exception {
        JsonNode node = objectMapper.readTree("{\"a\": \"12.5%\", \"b\": \"abc\", \"c\": 3}");

        assertEquals(12.5, ExtractionRecordParser.number(node, "a").orElseThrow(), 1e-9);
        assertTrue(ExtractionRecordParser.number(node, "b").isEmpty());
        assertEquals(3.0, ExtractionRecordParser.number(node, "b", "c").orElseThrow(), 1e-9);
        assertEquals("3", ExtractionRecordParser.text(node, "c").orElseThrow());
    }
}
