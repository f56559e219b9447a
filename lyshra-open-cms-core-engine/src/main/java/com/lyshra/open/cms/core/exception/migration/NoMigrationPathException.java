package com.lyshra.open.cms.core.exception.migration;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class NoMigrationPathException extends LyshraOpenCmsException {

    private final String typeSlug;
    private final String fromVersion;
    private final String toVersion;

    public NoMigrationPathException(String typeSlug, String fromVersion, String toVersion) {
        super(LyshraOpenCmsErrorKind.NO_MIGRATION_PATH,
                "No migration registered for [" + typeSlug + "] from [" + fromVersion + "] to [" + toVersion + "]");
        this.typeSlug = typeSlug;
        this.fromVersion = fromVersion;
        this.toVersion = toVersion;
    }

    public String getTypeSlug() {
        return typeSlug;
    }

    public String getFromVersion() {
        return fromVersion;
    }

    public String getToVersion() {
        return toVersion;
    }
}
