package com.threatattribution.engine.stix;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Parsed view of one intrusion set: its classifier label and the entities it
 * is related to, grouped by type.
 *
 * @author Naveed Gung
 */
public class IntrusionSetProfile {

    /** {@code <name>_intrusion-set--<uuid>}. */
    public static final Pattern LABEL_PATTERN = Pattern.compile(
            "^\\S.*_intrusion-set--[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

    private final String label;
    private final String stixId;
    private final Map<StixEntityType, Set<StixEntity>> entities = new EnumMap<>(StixEntityType.class);

    public IntrusionSetProfile(String label, String stixId) {
        this.label = label;
        this.stixId = stixId;
        for (StixEntityType type : StixEntityType.values()) {
            entities.put(type, new LinkedHashSet<>());
        }
    }

    /**
     * Add a related entity, ignoring duplicates.
     *
     * @param entity the entity to add
     * @return true if the entity was not yet known
     */
    public boolean addRelatedEntity(StixEntity entity) {
        return entities.get(entity.type()).add(entity);
    }

    public String getLabel() {
        return label;
    }

    public String getStixId() {
        return stixId;
    }

    public boolean hasWellFormedLabel() {
        return label != null && LABEL_PATTERN.matcher(label).matches();
    }

    public boolean isEmpty() {
        return entityCount() == 0;
    }

    public int entityCount() {
        return entities.values().stream().mapToInt(Set::size).sum();
    }

    /** Entities of one type in insertion order. */
    public List<StixEntity> entitiesOf(StixEntityType type) {
        return Collections.unmodifiableList(new ArrayList<>(entities.get(type)));
    }

    public List<StixEntity> getAttackPatterns() {
        return entitiesOf(StixEntityType.ATTACK_PATTERN);
    }

    public List<StixEntity> getMalwares() {
        return entitiesOf(StixEntityType.MALWARE);
    }

    public List<StixEntity> getTools() {
        return entitiesOf(StixEntityType.TOOL);
    }

    /** Indicators, vulnerabilities, identities and locations, in that order. */
    public List<StixEntity> getOthers() {
        List<StixEntity> others = new ArrayList<>();
        others.addAll(entities.get(StixEntityType.INDICATOR));
        others.addAll(entities.get(StixEntityType.VULNERABILITY));
        others.addAll(entities.get(StixEntityType.IDENTITY));
        others.addAll(entities.get(StixEntityType.LOCATION));
        return others;
    }

    /**
     * Space-joined semantic ids of every related entity. This is the
     * descriptive text of the intrusion set.
     */
    public String descriptiveText() {
        List<String> tokens = new ArrayList<>();
        for (Set<StixEntity> group : entities.values()) {
            for (StixEntity entity : group) {
                if (!entity.semanticId().isBlank()) {
                    tokens.add(entity.semanticId());
                }
            }
        }
        return String.join(" ", tokens);
    }

    @Override
    public String toString() {
        return "IntrusionSetProfile{label=" + label + ", entities=" + entityCount() + "}";
    }
}
