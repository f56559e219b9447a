package com.lyshra.open.cms.core.exception.migration;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.models.schema.SchemaMigrationKey;

/**
 * Thrown when a migration is registered for a key that already has one.
 */
public class DuplicateMigrationException extends LyshraOpenCmsException {

    private final SchemaMigrationKey key;

    public DuplicateMigrationException(SchemaMigrationKey key) {
        super(LyshraOpenCmsErrorKind.DUPLICATE_MIGRATION, "Migration already registered: " + key);
        this.key = key;
    }

    public SchemaMigrationKey getKey() {
        return key;
    }
}
