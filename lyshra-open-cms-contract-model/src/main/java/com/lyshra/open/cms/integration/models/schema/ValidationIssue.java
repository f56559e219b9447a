package com.lyshra.open.cms.integration.models.schema;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;

/**
 * A payload constraint violation found while validating against a schema.
 */
@Data
@Builder
public class ValidationIssue implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * JSON-pointer style location, {@code /} for the root.
     */
    private final String location;
    private final String message;

    @Override
    public String toString() {
        return location + ": " + message;
    }
}
