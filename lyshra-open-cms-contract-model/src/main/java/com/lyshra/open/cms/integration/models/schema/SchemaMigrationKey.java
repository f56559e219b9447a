package com.lyshra.open.cms.integration.models.schema;

import java.util.Objects;

/**
 * Identity of a registered migration edge. Versions are in canonical string form.
 */
public record SchemaMigrationKey(String typeSlug, String fromVersion, String toVersion) {

    public SchemaMigrationKey {
        Objects.requireNonNull(typeSlug, "typeSlug");
        Objects.requireNonNull(fromVersion, "fromVersion");
        Objects.requireNonNull(toVersion, "toVersion");
    }

    @Override
    public String toString() {
        return typeSlug + ":" + fromVersion + "->" + toVersion;
    }
}
