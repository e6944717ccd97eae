package com.threatattribution.engine.stix;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.function.Function;

/**
 * STIX2 object types that contribute tokens to an incident feature string.
 *
 * <p>
 * Each type knows its STIX identifier prefix and how to derive a
 * <em>semantic id</em> from the raw STIX object. Semantic ids are the
 * vocabulary of the attribution classifier, so their rules must stay stable
 * across training and prediction.
 * </p>
 *
 * <pre>
 * Type            Semantic id
 * --------------  --------------------------------------------
 * attack-pattern  attack-pattern-&lt;x_mitre_id without .sub&gt;
 * malware         malware-&lt;name without spaces&gt;
 * tool            tool-&lt;name without spaces&gt;
 * identity        &lt;id&gt;
 * location        &lt;id&gt;
 * vulnerability   &lt;id&gt;
 * indicator       &lt;id&gt;
 * </pre>
 *
 * @author Naveed Gung
 */
public enum StixEntityType {

    ATTACK_PATTERN("attack-pattern", StixEntityType::attackPatternSemanticId),
    MALWARE("malware", object -> "malware-" + stripWhitespace(object.path("name").asText(""))),
    TOOL("tool", object -> "tool-" + stripWhitespace(object.path("name").asText(""))),
    IDENTITY("identity", StixEntityType::idSemanticId),
    LOCATION("location", StixEntityType::idSemanticId),
    VULNERABILITY("vulnerability", StixEntityType::idSemanticId),
    INDICATOR("indicator", StixEntityType::idSemanticId);

    private final String stixType;
    private final Function<JsonNode, String> semanticIdRule;

    StixEntityType(String stixType, Function<JsonNode, String> semanticIdRule) {
        this.stixType = stixType;
        this.semanticIdRule = semanticIdRule;
    }

    public String getStixType() {
        return stixType;
    }

    /**
     * Derive the semantic id of a STIX object of this type.
     *
     * @param object the raw STIX object
     * @return the semantic id, never null (may be a bare prefix when the
     *         source attribute is missing)
     */
    public String semanticId(JsonNode object) {
        return semanticIdRule.apply(object);
    }

    /**
     * Resolve a type from the {@code type} attribute of a STIX object.
     *
     * @param stixType the STIX type name, e.g. {@code "malware"}
     * @return the matching type, or empty for types that carry no features
     */
    public static Optional<StixEntityType> fromStixType(String stixType) {
        for (StixEntityType type : values()) {
            if (type.stixType.equals(stixType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolve a type from the prefix of a STIX identifier such as
     * {@code malware--5f9a...}.
     *
     * @param stixId the STIX identifier
     * @return the matching type, or empty when the prefix is not a feature type
     */
    public static Optional<StixEntityType> fromStixId(String stixId) {
        if (stixId == null) {
            return Optional.empty();
        }
        for (StixEntityType type : values()) {
            if (stixId.startsWith(type.stixType)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }

    private static String attackPatternSemanticId(JsonNode object) {
        String mitreId = object.path("x_mitre_id").asText("");
        int dot = mitreId.indexOf('.');
        String technique = dot >= 0 ? mitreId.substring(0, dot) : mitreId;
        return "attack-pattern-" + stripWhitespace(technique);
    }

    private static String idSemanticId(JsonNode object) {
        return stripWhitespace(object.path("id").asText(""));
    }

    static String stripWhitespace(String value) {
        return value.replaceAll("\\s+", "");
    }
}
