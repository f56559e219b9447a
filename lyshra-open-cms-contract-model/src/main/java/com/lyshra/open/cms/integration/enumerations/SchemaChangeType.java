package com.lyshra.open.cms.integration.enumerations;

/**
 * Classification of a single field-level difference between two schemas.
 */
public enum SchemaChangeType {

    /**
     * Optional field added.
     */
    FIELD_ADDED,

    /**
     * Field removed. Breaking only when the field was required.
     */
    FIELD_REMOVED,

    /**
     * Declared type changed incompatibly.
     */
    TYPE_CHANGED,

    /**
     * Declared type widened to a superset (e.g. string to string or null).
     */
    TYPE_WIDENED,

    /**
     * A field became required, either newly added or previously optional.
     */
    REQUIRED_ADDED,

    /**
     * A previously required field became optional.
     */
    REQUIRED_RELAXED
}
