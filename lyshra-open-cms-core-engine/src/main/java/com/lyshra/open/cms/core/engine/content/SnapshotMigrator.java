package com.lyshra.open.cms.core.engine.content;

import com.lyshra.open.cms.core.engine.migration.SchemaPayloadMigrator;
import com.lyshra.open.cms.core.engine.schema.NormalizedSchema;
import com.lyshra.open.cms.core.engine.schema.SchemaVersions;
import com.lyshra.open.cms.core.engine.schema.impl.SchemaPayloadValidatorImpl;
import com.lyshra.open.cms.core.exception.schema.SchemaMigrationRequiredException;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.models.content.ContentSnapshot;
import com.lyshra.open.cms.integration.models.content.VersionedPayload;
import com.lyshra.open.cms.integration.models.document.Document;
import lombok.extern.slf4j.Slf4j;

/**
 * Brings every payload of a content snapshot to a target schema version.
 *
 * <p>Payloads already on the target version are only re-stamped with its canonical tag. Others
 * are migrated through the registry, validated against the target schema and re-stamped.
 * Untagged payloads are assumed to be on {@code fallbackVersion}.</p>
 */
@Slf4j
public class SnapshotMigrator {

    /**
     * @param snapshot migrated snapshot
     * @param migrated true when at least one payload went through a migration
     */
    public record Outcome(ContentSnapshot snapshot, boolean migrated) {
    }

    private final SchemaPayloadMigrator migrator;
    private final SchemaPayloadValidatorImpl validator;

    /**
     * @param migrator payload migrator, or null when no migrations are available
     */
    public SnapshotMigrator(SchemaPayloadMigrator migrator, SchemaPayloadValidatorImpl validator) {
        this.migrator = migrator;
        this.validator = validator;
    }

    /**
     * @param snapshot         snapshot to migrate
     * @param typeSlug         content type slug the migrations are registered under
     * @param fallbackVersion  version assumed for untagged payloads, may be null
     * @param target           normalized target schema
     * @param migrationAllowed false to fail instead of migrating
     * @throws SchemaMigrationRequiredException when a payload cannot be migrated
     * @throws com.lyshra.open.cms.core.exception.schema.SchemaInvalidException when a migrated payload fails validation
     */
    public Outcome migrate(ContentSnapshot snapshot, String typeSlug, String fallbackVersion,
                           NormalizedSchema target, boolean migrationAllowed) {
        String targetVersion = target.versionString();
        String recorded = snapshot.recordedSchemaVersion().orElse(fallbackVersion);
        boolean[] migrated = {false};
        ContentSnapshot result = snapshot.mapPayloads(payload -> {
            String current = payload.version().orElse(recorded);
            if (current != null && SchemaVersions.compare(current, targetVersion) == 0) {
                return payload.withVersion(targetVersion);
            }
            if (!migrationAllowed) {
                throw new SchemaMigrationRequiredException(current, targetVersion, "migration on promote is disabled");
            }
            if (migrator == null) {
                throw new SchemaMigrationRequiredException(current, targetVersion, "no migration registry is configured");
            }
            if (current == null) {
                throw new SchemaMigrationRequiredException(null, targetVersion, "payload carries no schema version");
            }
            migrated[0] = true;
            return migratePayload(payload, typeSlug, current, target);
        });
        return new Outcome(result, migrated[0]);
    }

    private VersionedPayload migratePayload(VersionedPayload payload, String typeSlug, String current, NormalizedSchema target) {
        Document.ObjectValue migrated;
        try {
            migrated = migrator.migrate(typeSlug, current, target.versionString(), payload.payload());
        } catch (LyshraOpenCmsException e) {
            throw new SchemaMigrationRequiredException(current, target.versionString(), e);
        }
        VersionedPayload stamped = VersionedPayload.untagged(migrated.without(VersionedPayload.SCHEMA_TAG_KEY))
                .withVersion(target.versionString());
        validator.validateOrThrow(target.schema(), stamped.payload());
        log.debug("Migrated payload of [{}] from [{}] to [{}]", typeSlug, current, target.versionString());
        return stamped;
    }
}
