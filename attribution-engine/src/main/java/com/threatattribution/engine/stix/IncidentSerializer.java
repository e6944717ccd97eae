package com.threatattribution.engine.stix;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Converts a STIX2 incident bundle into the feature string consumed by the
 * attribution classifier.
 *
 * <p>
 * The bundle's {@code objects} array is walked in order. Every object whose
 * identifier prefix is one of the {@link StixEntityType feature types}
 * contributes its semantic id; all other objects (relationships, reports,
 * intrusion sets) are skipped. Tokens are joined by a single space with no
 * leading or trailing whitespace, so the output depends only on the incident
 * content and never on JSON key order.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class IncidentSerializer {

    private final ObjectMapper objectMapper;

    public IncidentSerializer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Parse and serialize a JSON incident.
     *
     * @param incidentJson the raw incident document
     * @return the feature string
     * @throws InputFormatException if the text is not a well-formed incident
     */
    public String serialize(String incidentJson) {
        if (incidentJson == null || incidentJson.isBlank()) {
            throw new InputFormatException("Incident document is empty");
        }
        JsonNode incident;
        try {
            incident = objectMapper.readTree(incidentJson);
        } catch (JsonProcessingException e) {
            throw new InputFormatException("Incident is not valid JSON: " + e.getOriginalMessage(), e);
        }
        return serialize(incident);
    }

    /**
     * Serialize an already parsed incident.
     *
     * @param incident the incident bundle
     * @return the feature string, possibly empty when no object carries features
     * @throws InputFormatException if the incident is not a bundle-shaped object
     */
    public String serialize(JsonNode incident) {
        List<String> tokens = new ArrayList<>();
        for (JsonNode object : objectsOf(incident)) {
            String stixId = object.get("id").asText();
            Optional<StixEntityType> type = StixEntityType.fromStixId(stixId);
            if (type.isEmpty()) {
                continue;
            }
            String semanticId = type.get().semanticId(object);
            if (!semanticId.isBlank()) {
                tokens.add(semanticId);
            }
        }
        return String.join(" ", tokens);
    }

    /**
     * Validate the bundle shape and return its {@code objects} array.
     */
    static JsonNode objectsOf(JsonNode incident) {
        if (incident == null || incident.isNull() || incident.isMissingNode()) {
            throw new InputFormatException("Incident is null");
        }
        if (!incident.isObject()) {
            throw new InputFormatException("Incident must be a JSON object, got " + incident.getNodeType());
        }
        JsonNode objects = incident.get("objects");
        if (objects == null || !objects.isArray()) {
            throw new InputFormatException("Incident has no 'objects' array");
        }
        int index = 0;
        for (JsonNode object : objects) {
            if (!object.isObject()) {
                throw new InputFormatException("objects[" + index + "] is not a JSON object");
            }
            JsonNode id = object.get("id");
            if (id == null || !id.isTextual()) {
                throw new InputFormatException("objects[" + index + "] has no textual 'id'");
            }
            index++;
        }
        return objects;
    }

    /**
     * Collapse arbitrary whitespace in a prebuilt feature string to single
     * spaces.
     *
     * @param features the feature string
     * @return the normalized string, empty for null input
     */
    public static String normalize(String features) {
        if (features == null) {
            return "";
        }
        return features.trim().replaceAll("\\s+", " ");
    }
}
