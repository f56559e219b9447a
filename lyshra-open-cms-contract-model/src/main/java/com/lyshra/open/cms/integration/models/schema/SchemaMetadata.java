package com.lyshra.open.cms.integration.models.schema;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.List;

/**
 * Auxiliary metadata stored under the reserved {@code metadata} key of a content type schema.
 */
@Data
@Builder(toBuilder = true)
public class SchemaMetadata implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String slug;
    private final String schemaVersion;
    @Builder.Default
    private final List<String> uiOverlays = List.of();
    @Builder.Default
    private final BlockAvailability blockAvailability = BlockAvailability.none();

    public static SchemaMetadata empty() {
        return SchemaMetadata.builder().build();
    }
}
