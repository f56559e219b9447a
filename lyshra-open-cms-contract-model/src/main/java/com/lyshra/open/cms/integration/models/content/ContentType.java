package com.lyshra.open.cms.integration.models.content;

import com.lyshra.open.cms.integration.enumerations.ContentTypeStatus;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.SchemaHistorySnapshot;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Structural definition of a kind of content within one environment.
 *
 * <p>{@code schemaVersion} always matches the tag stored in the schema's metadata, and
 * {@code schemaHistory} only grows; see the schema normalization helpers in the core engine.</p>
 */
@Data
@Builder(toBuilder = true)
public class ContentType implements Serializable {

    private static final long serialVersionUID = 1L;

    private final UUID id;
    private final String slug;
    private final String name;
    private final String description;
    private final Document.ObjectValue schema;
    private final Document.ObjectValue uiSchema;
    private final Document.ObjectValue capabilities;
    private final String icon;
    private final String schemaVersion;
    @Builder.Default
    private final List<SchemaHistorySnapshot> schemaHistory = List.of();
    @Builder.Default
    private final ContentTypeStatus status = ContentTypeStatus.DRAFT;
    private final UUID environmentId;
    private final Instant createdAt;
    private final Instant updatedAt;
}
