package com.threatattribution.engine.version;

/**
 * Granularity of a {@link DatabaseVersion} bump on retraining.
 *
 * @author Naveed Gung
 */
public enum VersionIncrement {

    /** Incompatible label space or feature encoding. */
    MAJOR,
    /** New intrusion sets added to the corpus. */
    MINOR,
    /** Routine refit on refreshed data. */
    PATCH
}
