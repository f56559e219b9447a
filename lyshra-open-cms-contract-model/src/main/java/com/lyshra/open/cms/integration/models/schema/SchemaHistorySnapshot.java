package com.lyshra.open.cms.integration.models.schema;

import com.lyshra.open.cms.integration.enumerations.ContentTypeStatus;
import com.lyshra.open.cms.integration.models.document.Document;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;

/**
 * One entry of a content type's schema history.
 */
@Data
@Builder(toBuilder = true)
public class SchemaHistorySnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String version;
    private final Document.ObjectValue schema;
    private final Document.ObjectValue uiSchema;
    private final Document.ObjectValue capabilities;
    private final ContentTypeStatus status;
    private final Instant updatedAt;
    private final String updatedBy;
}
