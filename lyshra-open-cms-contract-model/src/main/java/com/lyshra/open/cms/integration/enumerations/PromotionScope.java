package com.lyshra.open.cms.integration.enumerations;

/**
 * What a whole-environment promotion copies.
 */
public enum PromotionScope {
    CONTENT_TYPES,
    CONTENT_ENTRIES,
    ALL;

    public boolean includesContentTypes() {
        return this == CONTENT_TYPES || this == ALL;
    }

    public boolean includesContentEntries() {
        return this == CONTENT_ENTRIES || this == ALL;
    }
}
