package com.lyshra.open.cms.core.engine.schema;

import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.SchemaVersion;

/**
 * A schema whose metadata carries a canonical version tag, and that version.
 */
public record NormalizedSchema(Document.ObjectValue schema, SchemaVersion version) {

    public String versionString() {
        return version.toString();
    }
}
