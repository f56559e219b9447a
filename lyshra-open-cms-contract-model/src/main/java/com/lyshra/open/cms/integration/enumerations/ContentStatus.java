package com.lyshra.open.cms.integration.enumerations;

/**
 * Status shared by content entries and their versions.
 * An entry has at most one {@link #PUBLISHED} version at any time.
 */
public enum ContentStatus {

    DRAFT,

    PUBLISHED,

    /**
     * Previously published, superseded by a newer published version. Never deleted.
     */
    ARCHIVED
}
