package com.lyshra.open.cms.integration.enumerations;

public enum BlockDefinitionStatus {
    DRAFT,
    ACTIVE,
    DEPRECATED
}
