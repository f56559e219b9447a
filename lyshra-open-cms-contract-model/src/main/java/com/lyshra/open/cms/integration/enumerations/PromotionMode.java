package com.lyshra.open.cms.integration.enumerations;

/**
 * How a content entry promotion treats an existing entry with the same slug in the target.
 */
public enum PromotionMode {

    /**
     * Fail when an entry with the same slug already exists in the target.
     */
    STRICT,

    /**
     * Write a new version onto the existing target entry.
     */
    MERGE
}
