package com.lyshra.open.cms.integration.enumerations;

/**
 * Semantic version component a schema change calls for.
 * Ordered from least to most significant.
 */
public enum SchemaChangeLevel {

    /**
     * Schemas are equivalent, ignoring the version tag.
     */
    NONE,

    /**
     * Cosmetic difference (titles, descriptions, defaults).
     */
    PATCH,

    /**
     * Backward compatible structural change: additions, optional removals, widened types.
     */
    MINOR,

    /**
     * Breaking change that can invalidate existing payloads.
     */
    MAJOR;

    public SchemaChangeLevel max(SchemaChangeLevel other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }
}
