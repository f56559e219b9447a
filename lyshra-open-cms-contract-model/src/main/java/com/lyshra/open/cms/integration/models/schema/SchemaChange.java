package com.lyshra.open.cms.integration.models.schema;

import com.lyshra.open.cms.integration.enumerations.SchemaChangeType;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;

/**
 * A single field-level difference between two schemas.
 */
@Data
@Builder
public class SchemaChange implements Serializable {

    private static final long serialVersionUID = 1L;

    private final SchemaChangeType type;
    /**
     * Dotted field path, e.g. {@code author.name} or {@code tags[]}.
     */
    private final String path;
    private final String description;
    private final boolean breaking;

    public static SchemaChange breaking(SchemaChangeType type, String path, String description) {
        return SchemaChange.builder().type(type).path(path).description(description).breaking(true).build();
    }

    public static SchemaChange compatible(SchemaChangeType type, String path, String description) {
        return SchemaChange.builder().type(type).path(path).description(description).breaking(false).build();
    }
}
