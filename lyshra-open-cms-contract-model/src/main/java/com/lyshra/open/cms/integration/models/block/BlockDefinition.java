package com.lyshra.open.cms.integration.models.block;

import com.lyshra.open.cms.integration.enumerations.BlockDefinitionStatus;
import com.lyshra.open.cms.integration.models.document.Document;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.UUID;

/**
 * Reusable block type that content type schemas may allow or deny.
 * Block schemas carry their own version tag, independent of content types.
 */
@Data
@Builder(toBuilder = true)
public class BlockDefinition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final UUID id;
    private final String slug;
    private final String name;
    private final String description;
    private final String icon;
    private final String category;
    @Builder.Default
    private final BlockDefinitionStatus status = BlockDefinitionStatus.DRAFT;
    private final Document.ObjectValue schema;
    private final String schemaVersion;
    private final Document.ObjectValue uiSchema;
    private final Document.ObjectValue defaults;
    private final String editorStyleUrl;
    private final String frontendStyleUrl;
    private final String environmentKey;
}
