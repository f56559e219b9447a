package com.lyshra.open.cms.integration.contract.schema;

import com.lyshra.open.cms.integration.models.document.Document;

/**
 * Pure payload transform between two adjacent schema versions.
 * Input and output never contain the schema version tag; the caller re-attaches it.
 */
@FunctionalInterface
public interface ISchemaTransform {

    Document.ObjectValue apply(Document.ObjectValue payload) throws Exception;
}
