package com.threatattribution.engine.version;

import java.util.Comparator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Version of the intrusion-set database a model was trained on, rendered as
 * {@code "(major, minor, patch)"}.
 *
 * @param major major component, non-negative
 * @param minor minor component, non-negative
 * @param patch patch component, non-negative
 *
 * @author Naveed Gung
 */
public record DatabaseVersion(int major, int minor, int patch) implements Comparable<DatabaseVersion> {

    public static final DatabaseVersion DEFAULT = new DatabaseVersion(0, 0, 1);

    private static final Pattern FORMAT = Pattern.compile("^\\(\\s*(\\d+)\\s*,\\s*(\\d+)\\s*,\\s*(\\d+)\\s*\\)$");

    private static final Comparator<DatabaseVersion> ORDER = Comparator
            .comparingInt(DatabaseVersion::major)
            .thenComparingInt(DatabaseVersion::minor)
            .thenComparingInt(DatabaseVersion::patch);

    public DatabaseVersion {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException(
                    String.format("Version components must be non-negative: (%d, %d, %d)", major, minor, patch));
        }
    }

    /**
     * Parse the {@code "(a, b, c)"} string form.
     *
     * @param value the version string
     * @return the parsed version
     * @throws IllegalArgumentException if the string is not a version tuple
     */
    public static DatabaseVersion parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Database version is null");
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            throw new IllegalArgumentException("Malformed database version: '" + value + "'");
        }
        try {
            return new DatabaseVersion(
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Database version component out of range: '" + value + "'", e);
        }
    }

    /**
     * Return the next version. Lower components are reset to zero.
     *
     * @param increment which component to bump
     * @return a version strictly greater than this one
     */
    public DatabaseVersion increment(VersionIncrement increment) {
        return switch (increment) {
            case MAJOR -> new DatabaseVersion(Math.addExact(major, 1), 0, 0);
            case MINOR -> new DatabaseVersion(major, Math.addExact(minor, 1), 0);
            case PATCH -> new DatabaseVersion(major, minor, Math.addExact(patch, 1));
        };
    }

    public boolean isNewerThan(DatabaseVersion other) {
        return compareTo(other) > 0;
    }

    @Override
    public int compareTo(DatabaseVersion other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + major + ", " + minor + ", " + patch + ")";
    }
}
