package com.threatattribution.engine.version;

import com.threatattribution.engine.model.AttributionModel;

import java.time.Instant;

/**
 * A trained model paired with the database version it was produced for.
 *
 * <p>
 * The pairing is trusted as supplied; nothing verifies that the model was
 * actually trained on that version.
 * </p>
 *
 * @param model        the trained model
 * @param version      the database version
 * @param registeredAt when the pair was created or loaded
 *
 * @author Naveed Gung
 */
public record VersionedModel(AttributionModel model, DatabaseVersion version, Instant registeredAt) {

    public static VersionedModel of(AttributionModel model, DatabaseVersion version) {
        return new VersionedModel(model, version, Instant.now());
    }
}
