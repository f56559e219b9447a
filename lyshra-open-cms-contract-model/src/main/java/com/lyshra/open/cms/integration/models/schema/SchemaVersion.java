package com.lyshra.open.cms.integration.models.schema;

import com.lyshra.open.cms.integration.enumerations.SchemaChangeLevel;
import com.lyshra.open.cms.integration.exception.InvalidSchemaVersionException;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.io.Serializable;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Semantic version tag embedded in content type schemas and content snapshots.
 *
 * <p>Canonical form is {@code slug@vMAJOR.MINOR.PATCH}, e.g. {@code article@v2.0.0}. The slug
 * prefix is optional ({@code v1.0.0}) and the leading {@code v} may be omitted when parsing.
 * Ordering considers major, minor and patch only; the slug takes no part in it.</p>
 *
 * <p>The natural ordering is inconsistent with {@code equals}: {@code article@v1.0.0} and
 * {@code post@v1.0.0} compare as 0 but are not equal, since equality includes the slug. Use
 * {@link #sameNumbers(SchemaVersion)} to compare numbers only, and avoid sorted sets keyed on
 * versions of different slugs.</p>
 */
@Getter
@Builder(toBuilder = true)
@EqualsAndHashCode
public final class SchemaVersion implements Comparable<SchemaVersion>, Serializable {

    private static final long serialVersionUID = 1L;

    public static final String SLUG_SEPARATOR = "@";

    private static final Pattern VERSION_PATTERN = Pattern.compile("^v?(0|[1-9]\\d*)\\.(0|[1-9]\\d*)\\.(0|[1-9]\\d*)$");

    private final String slug;
    private final int major;
    private final int minor;
    private final int patch;

    /**
     * Parses a version string.
     *
     * @param value version string, e.g. {@code article@v1.2.0}, {@code article@1.2.0} or {@code v1.2.0}
     * @return parsed version
     * @throws InvalidSchemaVersionException if the value is blank or malformed
     */
    public static SchemaVersion parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidSchemaVersionException(String.valueOf(value), "version is empty");
        }
        String trimmed = value.trim();
        String slug = null;
        String numeric = trimmed;
        int separator = trimmed.indexOf(SLUG_SEPARATOR);
        if (separator >= 0) {
            if (separator != trimmed.lastIndexOf(SLUG_SEPARATOR)) {
                throw new InvalidSchemaVersionException(value, "expected a single '@' separator");
            }
            slug = trimmed.substring(0, separator).trim();
            numeric = trimmed.substring(separator + 1).trim();
            if (slug.isEmpty()) {
                throw new InvalidSchemaVersionException(value, "slug is empty");
            }
        }
        Matcher matcher = VERSION_PATTERN.matcher(numeric);
        if (!matcher.matches()) {
            throw new InvalidSchemaVersionException(value, "expected vMAJOR.MINOR.PATCH");
        }
        try {
            return new SchemaVersion(slug,
                    Integer.parseInt(matcher.group(1)),
                    Integer.parseInt(matcher.group(2)),
                    Integer.parseInt(matcher.group(3)));
        } catch (NumberFormatException e) {
            throw new InvalidSchemaVersionException(value, "version component out of range");
        }
    }

    /**
     * Creates a version with the given components.
     */
    public static SchemaVersion of(String slug, int major, int minor, int patch) {
        if (major < 0 || minor < 0 || patch < 0) {
            throw new IllegalArgumentException("Version components must not be negative");
        }
        return new SchemaVersion(slug, major, minor, patch);
    }

    /**
     * @return {@code slug@v1.0.0}, the version assigned to schemas that carry no tag
     */
    public static SchemaVersion defaultFor(String slug) {
        return of(slug, 1, 0, 0);
    }

    public boolean hasSlug() {
        return slug != null && !slug.isEmpty();
    }

    public SchemaVersion withSlug(String newSlug) {
        return new SchemaVersion(newSlug, major, minor, patch);
    }

    /**
     * Returns the version this one becomes after a change of the given level.
     */
    public SchemaVersion bump(SchemaChangeLevel level) {
        switch (level) {
            case MAJOR:
                return new SchemaVersion(slug, major + 1, 0, 0);
            case MINOR:
                return new SchemaVersion(slug, major, minor + 1, 0);
            case PATCH:
                return new SchemaVersion(slug, major, minor, patch + 1);
            default:
                return this;
        }
    }

    /**
     * @return {@code vMAJOR.MINOR.PATCH} without the slug
     */
    public String toNumericString() {
        return "v" + major + "." + minor + "." + patch;
    }

    /**
     * True when both versions carry the same numbers, regardless of slug.
     */
    public boolean sameNumbers(SchemaVersion other) {
        return other != null && compareTo(other) == 0;
    }

    @Override
    public int compareTo(SchemaVersion other) {
        Objects.requireNonNull(other, "other");
        int result = Integer.compare(major, other.major);
        if (result != 0) return result;
        result = Integer.compare(minor, other.minor);
        if (result != 0) return result;
        return Integer.compare(patch, other.patch);
    }

    @Override
    public String toString() {
        return hasSlug() ? slug + SLUG_SEPARATOR + toNumericString() : toNumericString();
    }

    /**
     * Compares two version strings.
     *
     * <p>Equal strings compare 0 and an empty string sorts before a non-empty one. When either
     * side cannot be parsed the strings are compared lexically; this keeps legacy tags ordered
     * but is not semantic ordering.</p>
     *
     * @return -1, 0 or 1
     */
    public static int compareStrings(String a, String b) {
        String left = a == null ? "" : a.trim();
        String right = b == null ? "" : b.trim();
        if (left.equals(right)) {
            return 0;
        }
        if (left.isEmpty()) {
            return -1;
        }
        if (right.isEmpty()) {
            return 1;
        }
        SchemaVersion leftVersion;
        SchemaVersion rightVersion;
        try {
            leftVersion = parse(left);
            rightVersion = parse(right);
        } catch (InvalidSchemaVersionException e) {
            return Integer.signum(left.compareTo(right));
        }
        return Integer.signum(leftVersion.compareTo(rightVersion));
    }
}
