package com.lyshra.open.cms.core.exception.schema;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

/**
 * Thrown when a payload is tagged with a schema version other than the target's
 * and cannot be migrated: migration disabled, no registry, unknown recorded version or a failed transform.
 */
public class SchemaMigrationRequiredException extends LyshraOpenCmsException {

    private final String fromVersion;
    private final String toVersion;

    public SchemaMigrationRequiredException(String fromVersion, String toVersion, String reason) {
        super(LyshraOpenCmsErrorKind.SCHEMA_MIGRATION_REQUIRED, message(fromVersion, toVersion, reason));
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    public SchemaMigrationRequiredException(String fromVersion, String toVersion, Throwable cause) {
        super(LyshraOpenCmsErrorKind.SCHEMA_MIGRATION_REQUIRED, message(fromVersion, toVersion, cause.getMessage()), cause);
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    private static String message(String fromVersion, String toVersion, String reason) {
        return "Schema migration required from [" + fromVersion + "] to [" + toVersion + "]: " + reason;
    }

    public String getFromVersion() {
        return fromVersion;
    }

    public String getToVersion() {
        return toVersion;
    }
}
