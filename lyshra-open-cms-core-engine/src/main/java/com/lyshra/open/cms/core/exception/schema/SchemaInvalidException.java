package com.lyshra.open.cms.core.exception.schema;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.models.schema.ValidationIssue;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when a payload does not conform to the schema it is validated against.
 */
public class SchemaInvalidException extends LyshraOpenCmsException {

    private final String schemaVersion;
    private final List<ValidationIssue> issues;

    public SchemaInvalidException(String schemaVersion, List<ValidationIssue> issues) {
        super(LyshraOpenCmsErrorKind.SCHEMA_INVALID, "Payload invalid for schema [" + schemaVersion + "]: "
                + issues.stream().map(ValidationIssue::toString).collect(Collectors.joining("; ")));
        this.schemaVersion = schemaVersion;
        this.issues = List.copyOf(issues);
    }

    public String getSchemaVersion() {
        return schemaVersion;
    }

    public List<ValidationIssue> getIssues() {
        return issues;
    }
}
