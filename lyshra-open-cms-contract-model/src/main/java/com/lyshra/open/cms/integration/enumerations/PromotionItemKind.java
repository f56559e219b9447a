package com.lyshra.open.cms.integration.enumerations;

/**
 * Kind of record a promotion item or error refers to.
 */
public enum PromotionItemKind {
    CONTENT_TYPE("content_type"),
    CONTENT_ENTRY("content_entry");

    private final String objectType;

    PromotionItemKind(String objectType) {
        this.objectType = objectType;
    }

    /**
     * @return the object type name used in activity events
     */
    public String getObjectType() {
        return objectType;
    }
}
