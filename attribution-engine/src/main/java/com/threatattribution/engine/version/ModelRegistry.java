package com.threatattribution.engine.version;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the model currently used for attribution together with its database
 * version.
 *
 * <p>
 * Versions only move forward: registering a model whose version is not
 * strictly newer than the current one is rejected. The current pair is
 * swapped atomically, so readers always see a consistent model and version.
 * </p>
 *
 * @author Naveed Gung
 */
@Component
public class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private final AtomicReference<VersionedModel> current = new AtomicReference<>();

    /**
     * Make a model current.
     *
     * @param candidate the model and its version
     * @throws IllegalStateException if the version does not advance
     */
    public void register(VersionedModel candidate) {
        current.updateAndGet(existing -> {
            if (existing != null && !candidate.version().isNewerThan(existing.version())) {
                throw new IllegalStateException(String.format(
                        "Database version %s is not newer than registered version %s",
                        candidate.version(), existing.version()));
            }
            return candidate;
        });
        log.info("Registered attribution model for database version {} ({} labels)",
                candidate.version(), candidate.model().classes().size());
    }

    /** The current model, if one has been registered. */
    public Optional<VersionedModel> current() {
        return Optional.ofNullable(current.get());
    }

    /** The current version, if a model has been registered. */
    public Optional<DatabaseVersion> currentVersion() {
        return current().map(VersionedModel::version);
    }

    /**
     * Whether a version matches the registered model.
     *
     * @param version the version a caller intends to use
     * @return true when a model is registered under exactly this version
     */
    public boolean isCompatible(DatabaseVersion version) {
        return currentVersion().map(v -> v.equals(version)).orElse(false);
    }
}
