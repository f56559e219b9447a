package com.lyshra.open.cms.core.engine.migration;

import com.lyshra.open.cms.core.engine.migration.impl.MigrationPathResolver;
import com.lyshra.open.cms.integration.contract.schema.ISchemaMigrationRegistry;
import com.lyshra.open.cms.integration.models.document.Document;

/**
 * Applies registered migrations to untagged payloads, either through a single direct edge or,
 * when path search is enabled, along the shortest registered chain.
 */
public class SchemaPayloadMigrator {

    private final ISchemaMigrationRegistry registry;
    private final MigrationPathResolver pathResolver;

    public SchemaPayloadMigrator(ISchemaMigrationRegistry registry, boolean pathSearchEnabled) {
        this.registry = registry;
        this.pathResolver = pathSearchEnabled ? new MigrationPathResolver(registry) : null;
    }

    public Document.ObjectValue migrate(String typeSlug, String fromVersion, String toVersion, Document.ObjectValue payload) {
        if (pathResolver != null) {
            return pathResolver.migrateAlongPath(typeSlug, fromVersion, toVersion, payload);
        }
        return registry.migrate(typeSlug, fromVersion, toVersion, payload);
    }

    public boolean isPathSearchEnabled() {
        return pathResolver != null;
    }
}
