package com.lyshra.open.cms.integration.contract.schema;

import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.SchemaMigrationKey;

import java.util.List;

/**
 * Table of payload transforms keyed by (content type slug, from version, to version).
 *
 * <p>Only direct edges are applied; {@link #migrate} never composes several transforms.
 * Implementations must allow concurrent {@code migrate} calls alongside registration.</p>
 */
public interface ISchemaMigrationRegistry {

    /**
     * Registers a direct migration.
     *
     * @param typeSlug    content type slug; may be blank when the versions carry a slug
     * @param fromVersion source version string
     * @param toVersion   target version string
     * @param transform   payload transform
     * @throws com.lyshra.open.cms.integration.exception.InvalidSchemaVersionException if a version is malformed
     * @throws com.lyshra.open.cms.integration.exception.LyshraOpenCmsException with kind DUPLICATE_MIGRATION when the key exists
     */
    void register(String typeSlug, String fromVersion, String toVersion, ISchemaTransform transform);

    /**
     * Applies the direct migration between two versions. Equal versions return the payload unchanged.
     *
     * @throws com.lyshra.open.cms.integration.exception.LyshraOpenCmsException with kind NO_MIGRATION_PATH
     *         when no direct edge exists, or MIGRATION_FAILED when the transform throws
     */
    Document.ObjectValue migrate(String typeSlug, String fromVersion, String toVersion, Document.ObjectValue payload);

    boolean hasMigration(String typeSlug, String fromVersion, String toVersion);

    boolean unregister(String typeSlug, String fromVersion, String toVersion);

    /**
     * @return registered edges for the slug, ordered by from version then to version
     */
    List<SchemaMigrationKey> getRegisteredMigrations(String typeSlug);

    /**
     * Monotonic counter bumped on every registration change, used to invalidate derived caches.
     */
    long getRevision();
}
