package com.lyshra.open.cms.integration.enumerations;

/**
 * Lifecycle status of a content type within an environment.
 */
public enum ContentTypeStatus {

    /**
     * Type is being authored and is not yet usable for new entries.
     */
    DRAFT,

    /**
     * Type is live; entries may be created and promoted against it.
     */
    ACTIVE
}
