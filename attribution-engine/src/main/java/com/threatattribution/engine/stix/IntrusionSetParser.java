package com.threatattribution.engine.stix;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Builds {@link IntrusionSetProfile intrusion set profiles} from STIX2 bundles.
 *
 * <p>
 * Assumptions about each bundle:
 * </p>
 * <ul>
 * <li>it describes a single intrusion set (the first one found is used);</li>
 * <li>it only holds entities connected to that intrusion set;</li>
 * <li>it only holds relationships between those entities and the intrusion
 * set.</li>
 * </ul>
 *
 * @author Naveed Gung
 */
@Component
public class IntrusionSetParser {

    private static final Logger log = LoggerFactory.getLogger(IntrusionSetParser.class);

    private static final String INTRUSION_SET = "intrusion-set";
    private static final String RELATIONSHIP = "relationship";

    /**
     * Parse one bundle.
     *
     * @param bundle the STIX2 bundle
     * @return the profile, or empty when the bundle carries no intrusion set
     * @throws InputFormatException if the bundle or its intrusion set is malformed
     */
    public Optional<IntrusionSetProfile> parse(JsonNode bundle) {
        JsonNode objects = IncidentSerializer.objectsOf(bundle);

        JsonNode intrusionSet = null;
        for (JsonNode object : objects) {
            if (INTRUSION_SET.equals(object.path("type").asText())) {
                intrusionSet = object;
                break;
            }
        }
        if (intrusionSet == null) {
            return Optional.empty();
        }

        String intrusionSetId = intrusionSet.get("id").asText();
        JsonNode name = intrusionSet.get("name");
        if (name == null || !name.isTextual() || name.asText().isBlank()) {
            throw new InputFormatException("Intrusion set " + intrusionSetId + " has no name");
        }
        IntrusionSetProfile profile = new IntrusionSetProfile(labelOf(name.asText(), intrusionSetId), intrusionSetId);

        Map<String, RelatedObject> related = new HashMap<>();
        for (JsonNode object : objects) {
            StixEntityType.fromStixType(object.path("type").asText())
                    .ifPresent(type -> related.put(object.get("id").asText(),
                            new RelatedObject(type, type.semanticId(object))));
        }

        for (JsonNode object : objects) {
            if (!RELATIONSHIP.equals(object.path("type").asText())) {
                continue;
            }
            String sourceRef = object.path("source_ref").asText(null);
            String targetRef = object.path("target_ref").asText(null);
            String relation = object.path("relationship_type").asText("");

            if (intrusionSetId.equals(sourceRef)) {
                addRelated(profile, related, targetRef, false, relation);
            } else if (intrusionSetId.equals(targetRef)) {
                addRelated(profile, related, sourceRef, true, relation);
            }
        }

        log.debug("Parsed {}", profile);
        return Optional.of(profile);
    }

    /**
     * Parse every bundle of a corpus, keyed by label. Every bundle must carry
     * an intrusion set. When two bundles carry the same label the later one
     * replaces the earlier one.
     *
     * @param bundles the STIX2 bundles
     * @return profiles in corpus order
     * @throws InputFormatException if a bundle is malformed or carries no
     *                              intrusion set
     */
    public Map<String, IntrusionSetProfile> parseAll(List<JsonNode> bundles) {
        Map<String, IntrusionSetProfile> profiles = new LinkedHashMap<>();
        for (int i = 0; i < bundles.size(); i++) {
            int index = i;
            IntrusionSetProfile profile = parse(bundles.get(i)).orElseThrow(
                    () -> new InputFormatException("Bundle #" + index + " carries no intrusion set"));
            IntrusionSetProfile previous = profiles.put(profile.getLabel(), profile);
            if (previous != null) {
                log.warn("Bundle #{} redefines intrusion set {}; the earlier definition is replaced",
                        index, previous.getLabel());
            }
        }
        return profiles;
    }

    /**
     * Classifier label of an intrusion set.
     *
     * @param name   the intrusion set name, e.g. {@code Aggah}
     * @param stixId the intrusion set identifier
     * @return {@code <name>_<stixId>}
     */
    public static String labelOf(String name, String stixId) {
        return name + "_" + stixId;
    }

    private static void addRelated(IntrusionSetProfile profile, Map<String, RelatedObject> related,
            String ref, boolean subject, String relation) {
        if (ref == null) {
            return;
        }
        RelatedObject object = related.get(ref);
        if (object != null) {
            profile.addRelatedEntity(new StixEntity(ref, object.type(), object.semanticId(), subject, relation));
        }
    }

    private record RelatedObject(StixEntityType type, String semanticId) {
    }
}
