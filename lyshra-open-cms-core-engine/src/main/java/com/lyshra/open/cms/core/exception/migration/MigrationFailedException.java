package com.lyshra.open.cms.core.exception.migration;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.models.schema.SchemaMigrationKey;

/**
 * Wraps an exception thrown by a migration transform. Never retried.
 */
public class MigrationFailedException extends LyshraOpenCmsException {

    private final SchemaMigrationKey key;

    public MigrationFailedException(SchemaMigrationKey key, String reason, Throwable cause) {
        super(LyshraOpenCmsErrorKind.MIGRATION_FAILED, "Migration " + key + " failed: " + reason, cause);
        this.key = key;
    }

    public SchemaMigrationKey getKey() {
        return key;
    }
}
