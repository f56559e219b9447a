package com.lyshra.open.cms.integration.enumerations;

/**
 * Outcome of a single promotion item.
 */
public enum PromotionStatus {

    /**
     * A new counterpart was created in the target environment.
     */
    CREATED,

    /**
     * An existing counterpart (matched by slug) was updated.
     */
    UPDATED,

    /**
     * Nothing was done, e.g. source and target environments are the same.
     */
    SKIPPED
}
