package com.lyshra.open.cms.integration.enumerations;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Error taxonomy of the content engine.
 * Each kind carries a stable code and the HTTP status an API layer should map it to.
 */
@AllArgsConstructor
@Getter
public enum LyshraOpenCmsErrorKind {

    INVALID_FORMAT("LYSHRA_CMS_ERR_0001", 400, "Malformed schema version"),
    DUPLICATE_MIGRATION("LYSHRA_CMS_ERR_0002", 409, "Migration already registered"),
    NO_MIGRATION_PATH("LYSHRA_CMS_ERR_0003", 422, "No migration registered between versions"),
    MIGRATION_FAILED("LYSHRA_CMS_ERR_0004", 422, "Migration transform failed"),
    ENVIRONMENT_NOT_FOUND("LYSHRA_CMS_ERR_0005", 404, "Environment not found or inactive"),
    CONTENT_TYPE_REQUIRED("LYSHRA_CMS_ERR_0006", 400, "Content type required"),
    CONTENT_TYPE_ENVIRONMENT_MISMATCH("LYSHRA_CMS_ERR_0007", 400, "Content type does not belong to environment"),
    TARGET_AHEAD_OF_SOURCE("LYSHRA_CMS_ERR_0008", 409, "Target schema version is newer than source"),
    BREAKING_SCHEMA_CHANGE("LYSHRA_CMS_ERR_0009", 409, "Breaking schema change"),
    SCHEMA_MIGRATION_REQUIRED("LYSHRA_CMS_ERR_0010", 409, "Schema migration required"),
    SCHEMA_INVALID("LYSHRA_CMS_ERR_0011", 422, "Payload does not match schema"),
    SLUG_EXISTS("LYSHRA_CMS_ERR_0012", 409, "Slug already exists"),
    UNKNOWN_LOCALE("LYSHRA_CMS_ERR_0013", 400, "Unknown locale"),
    CONTENT_VERSION_REQUIRED("LYSHRA_CMS_ERR_0014", 409, "No promotable content version"),
    CANCELLED("LYSHRA_CMS_ERR_0015", 499, "Operation cancelled"),
    NOT_FOUND("LYSHRA_CMS_ERR_0016", 404, "Record not found"),
    CONFLICT("LYSHRA_CMS_ERR_0017", 409, "Record conflict"),
    CONTENT_TYPE_INACTIVE("LYSHRA_CMS_ERR_0018", 409, "Content type is not active"),
    BLOCK_DEFINITION_NOT_FOUND("LYSHRA_CMS_ERR_0019", 404, "Block definition not found"),
    INVALID_REQUEST("LYSHRA_CMS_ERR_0020", 400, "Invalid request"),
    INTERNAL("LYSHRA_CMS_ERR_0021", 500, "Unexpected failure");

    private final String errorCode;
    private final int httpStatus;
    private final String description;
}
