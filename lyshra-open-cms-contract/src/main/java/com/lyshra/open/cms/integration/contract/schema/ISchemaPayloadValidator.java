package com.lyshra.open.cms.integration.contract.schema;

import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.ValidationIssue;

import java.util.List;

public interface ISchemaPayloadValidator {

    /**
     * @return every violation found; empty when the payload conforms
     */
    List<ValidationIssue> validate(Document.ObjectValue schema, Document.ObjectValue payload);
}
