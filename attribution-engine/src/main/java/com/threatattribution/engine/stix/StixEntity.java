package com.threatattribution.engine.stix;

import java.util.Objects;

/**
 * An entity related to an intrusion set through a STIX relationship.
 *
 * @param identifier the STIX identifier of the entity
 * @param type       the feature type of the entity
 * @param semanticId the classifier token derived from the entity
 * @param subject    true when the entity is the source of the relationship
 * @param relation   the STIX relationship type, e.g. {@code uses}
 *
 * @author Naveed Gung
 */
public record StixEntity(
        String identifier,
        StixEntityType type,
        String semanticId,
        boolean subject,
        String relation) {

    /** Entities are the same when type and identifier match, whatever the relation. */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof StixEntity that)) {
            return false;
        }
        return type == that.type && Objects.equals(identifier, that.identifier);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, identifier);
    }
}
