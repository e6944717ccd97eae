package com.threatattribution.engine.stix;

import com.fasterxml.jackson.databind.JsonNode;
import com.threatattribution.engine.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class IntrusionSetParserTest {

    private IntrusionSetParser parser;

    @BeforeEach
    void setUp() {
        parser = new IntrusionSetParser();
    }

    @Test
    void shouldParseExampleCorpus() {
        Map<String, IntrusionSetProfile> profiles = parser.parseAll(TestData.intrusionSets());

        assertEquals(List.of(TestData.AGGAH, TestData.KIPPIS, TestData.UNC2891), List.copyOf(profiles.keySet()));
        profiles.values().forEach(profile -> assertTrue(profile.hasWellFormedLabel(), profile.getLabel()));
    }

    @Test
    void shouldGroupRelatedEntitiesByType() {
        IntrusionSetProfile aggah = parser.parse(TestData.intrusionSets().get(0)).orElseThrow();

        assertEquals("intrusion-set--088d7359-97fb-591b-aeed-be46caf1027d", aggah.getStixId());
        assertEquals(4, aggah.getAttackPatterns().size());
        assertEquals(3, aggah.getMalwares().size());
        assertEquals(1, aggah.getTools().size());
        assertEquals(2, aggah.getOthers().size());
        assertEquals(10, aggah.entityCount());
        assertEquals("attack-pattern-T1566", aggah.getAttackPatterns().get(0).semanticId());
        assertEquals("uses", aggah.getAttackPatterns().get(0).relation());
    }

    @Test
    void shouldMarkEntitiesPointingAtIntrusionSetAsSubjects() {
        IntrusionSetProfile aggah = parser.parse(TestData.intrusionSets().get(0)).orElseThrow();

        StixEntity indicator = aggah.entitiesOf(StixEntityType.INDICATOR).get(0);
        assertTrue(indicator.subject());
        assertEquals("indicates", indicator.relation());
        assertFalse(aggah.getMalwares().get(0).subject());
    }

    @Test
    void shouldIgnoreEntitiesWithoutRelationship() {
        String bundle = "{\"objects\":["
                + "{\"type\":\"intrusion-set\",\"id\":\"intrusion-set--1\",\"name\":\"Lonely\"},"
                + "{\"type\":\"malware\",\"id\":\"malware--1\",\"name\":\"Orphan\"}]}";

        IntrusionSetProfile profile = parser.parse(read(bundle)).orElseThrow();

        assertTrue(profile.isEmpty());
        assertEquals("", profile.descriptiveText());
    }

    @Test
    void shouldDeduplicateRepeatedRelationships() {
        String bundle = "{\"objects\":["
                + "{\"type\":\"intrusion-set\",\"id\":\"intrusion-set--1\",\"name\":\"Dup\"},"
                + "{\"type\":\"tool\",\"id\":\"tool--1\",\"name\":\"Net Scan\"},"
                + "{\"type\":\"relationship\",\"id\":\"relationship--1\",\"relationship_type\":\"uses\","
                + "\"source_ref\":\"intrusion-set--1\",\"target_ref\":\"tool--1\"},"
                + "{\"type\":\"relationship\",\"id\":\"relationship--2\",\"relationship_type\":\"uses\","
                + "\"source_ref\":\"intrusion-set--1\",\"target_ref\":\"tool--1\"}]}";

        IntrusionSetProfile profile = parser.parse(read(bundle)).orElseThrow();

        assertEquals(1, profile.entityCount());
        assertEquals("tool-NetScan", profile.descriptiveText());
        assertEquals("Dup_intrusion-set--1", profile.getLabel());
        assertFalse(profile.hasWellFormedLabel());
    }

    @Test
    void shouldReturnEmptyWithoutIntrusionSet() {
        Optional<IntrusionSetProfile> profile = parser.parse(TestData.incident());

        assertTrue(profile.isEmpty());
    }

    @Test
    void corpusBundleWithoutIntrusionSetShouldBeRejected() {
        List<JsonNode> corpus = new ArrayList<>(TestData.intrusionSets());
        corpus.add(read("{\"type\":\"bundle\",\"objects\":[{\"type\":\"malware\",\"id\":\"malware--1\",\"name\":\"X\"}]}"));

        InputFormatException error = assertThrows(InputFormatException.class, () -> parser.parseAll(corpus));
        assertTrue(error.getMessage().contains("#3"), error.getMessage());
    }

    @Test
    void laterBundleShouldReplaceEarlierWithSameLabel() {
        JsonNode first = read("{\"objects\":["
                + "{\"type\":\"intrusion-set\",\"id\":\"intrusion-set--1\",\"name\":\"Twice\"},"
                + "{\"type\":\"tool\",\"id\":\"tool--1\",\"name\":\"Old\"},"
                + "{\"type\":\"relationship\",\"id\":\"relationship--1\",\"relationship_type\":\"uses\","
                + "\"source_ref\":\"intrusion-set--1\",\"target_ref\":\"tool--1\"}]}");
        JsonNode second = read("{\"objects\":["
                + "{\"type\":\"intrusion-set\",\"id\":\"intrusion-set--1\",\"name\":\"Twice\"},"
                + "{\"type\":\"tool\",\"id\":\"tool--2\",\"name\":\"New\"},"
                + "{\"type\":\"relationship\",\"id\":\"relationship--2\",\"relationship_type\":\"uses\","
                + "\"source_ref\":\"intrusion-set--1\",\"target_ref\":\"tool--2\"}]}");

        Map<String, IntrusionSetProfile> profiles = parser.parseAll(List.of(first, second));

        assertEquals(1, profiles.size());
        assertEquals("tool-New", profiles.get("Twice_intrusion-set--1").descriptiveText());
    }

    @Test
    void shouldRejectIntrusionSetWithoutName() {
        JsonNode bundle = read("{\"objects\":[{\"type\":\"intrusion-set\",\"id\":\"intrusion-set--1\"}]}");

        assertThrows(InputFormatException.class, () -> parser.parse(bundle));
    }

    @Test
    void shouldRejectNonBundle() {
        assertThrows(InputFormatException.class, () -> parser.parse(read("[]")));
    }

    private static JsonNode read(String json) {
        try {
            return TestData.MAPPER.readTree(json);
        } catch (Exception e) {
            throw new IllegalStateException(e);
        }
    }
}
