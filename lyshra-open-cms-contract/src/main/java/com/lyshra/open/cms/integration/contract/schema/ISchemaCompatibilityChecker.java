package com.lyshra.open.cms.integration.contract.schema;

import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.CompatibilityReport;

public interface ISchemaCompatibilityChecker {

    /**
     * Classifies the differences from {@code oldSchema} to {@code newSchema}.
     */
    CompatibilityReport check(Document.ObjectValue oldSchema, Document.ObjectValue newSchema);
}
