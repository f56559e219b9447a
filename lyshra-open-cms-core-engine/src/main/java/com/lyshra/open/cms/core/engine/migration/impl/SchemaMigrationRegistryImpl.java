package com.lyshra.open.cms.core.engine.migration.impl;

import com.lyshra.open.cms.core.exception.migration.DuplicateMigrationException;
import com.lyshra.open.cms.core.exception.migration.MigrationFailedException;
import com.lyshra.open.cms.core.exception.migration.NoMigrationPathException;
import com.lyshra.open.cms.integration.contract.schema.ISchemaMigrationRegistry;
import com.lyshra.open.cms.integration.contract.schema.ISchemaTransform;
import com.lyshra.open.cms.integration.exception.InvalidSchemaVersionException;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.SchemaMigrationKey;
import com.lyshra.open.cms.integration.models.schema.SchemaVersion;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Registry of direct payload migrations between schema versions.
 *
 * <p>Keys are canonicalized: versions are parsed and rendered without slug, the type slug is
 * trimmed and, when blank, taken from the version strings. Registration takes the write lock;
 * lookups take the read lock. Transforms run outside the lock so a slow transform never blocks
 * registration.</p>
 */
@Slf4j
public class SchemaMigrationRegistryImpl implements ISchemaMigrationRegistry {

    private final Map<SchemaMigrationKey, ISchemaTransform> migrations;
    private final ReadWriteLock lock;
    private final AtomicLong revision;

    private SchemaMigrationRegistryImpl() {
        this.migrations = new ConcurrentHashMap<>();
        this.lock = new ReentrantReadWriteLock();
        this.revision = new AtomicLong();
    }

    private static final class SingletonHelper {
        private static final SchemaMigrationRegistryImpl INSTANCE = new SchemaMigrationRegistryImpl();
    }

    /**
     * Gets the process-wide registry.
     *
     * @return registry instance
     */
    public static ISchemaMigrationRegistry getInstance() {
        return SingletonHelper.INSTANCE;
    }

    /**
     * Creates an isolated registry (for testing and embedding).
     *
     * @return new registry instance
     */
    public static ISchemaMigrationRegistry create() {
        return new SchemaMigrationRegistryImpl();
    }

    // === Registration ===

    @Override
    public void register(String typeSlug, String fromVersion, String toVersion, ISchemaTransform transform) {
        Objects.requireNonNull(transform, "transform");
        SchemaMigrationKey key = canonicalKey(typeSlug, fromVersion, toVersion);
        lock.writeLock().lock();
        try {
            if (migrations.containsKey(key)) {
                throw new DuplicateMigrationException(key);
            }
            migrations.put(key, transform);
            revision.incrementAndGet();
            log.info("Registered schema migration for [{}]: {} -> {}", key.typeSlug(), key.fromVersion(), key.toVersion());
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean unregister(String typeSlug, String fromVersion, String toVersion) {
        SchemaMigrationKey key = canonicalKey(typeSlug, fromVersion, toVersion);
        lock.writeLock().lock();
        try {
            boolean removed = migrations.remove(key) != null;
            if (removed) {
                revision.incrementAndGet();
                log.info("Unregistered schema migration for [{}]: {} -> {}", key.typeSlug(), key.fromVersion(), key.toVersion());
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // === Lookup ===

    @Override
    public Document.ObjectValue migrate(String typeSlug, String fromVersion, String toVersion, Document.ObjectValue payload) {
        SchemaVersion from = SchemaVersion.parse(fromVersion);
        SchemaVersion to = SchemaVersion.parse(toVersion);
        if (from.sameNumbers(to)) {
            return payload;
        }
        SchemaMigrationKey key = canonicalKey(typeSlug, fromVersion, toVersion);
        ISchemaTransform transform;
        lock.readLock().lock();
        try {
            transform = migrations.get(key);
        } finally {
            lock.readLock().unlock();
        }
        if (transform == null) {
            throw new NoMigrationPathException(key.typeSlug(), key.fromVersion(), key.toVersion());
        }
        Document.ObjectValue migrated;
        try {
            migrated = transform.apply(payload);
        } catch (Exception e) {
            throw new MigrationFailedException(key, e.getMessage(), e);
        }
        if (migrated == null) {
            throw new MigrationFailedException(key, "transform returned no payload", null);
        }
        log.debug("Migrated payload of [{}] from {} to {}", key.typeSlug(), key.fromVersion(), key.toVersion());
        return migrated;
    }

    @Override
    public boolean hasMigration(String typeSlug, String fromVersion, String toVersion) {
        SchemaMigrationKey key = canonicalKey(typeSlug, fromVersion, toVersion);
        lock.readLock().lock();
        try {
            return migrations.containsKey(key);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SchemaMigrationKey> getRegisteredMigrations(String typeSlug) {
        String slug = StringUtils.trimToEmpty(typeSlug);
        lock.readLock().lock();
        try {
            return migrations.keySet().stream()
                    .filter(key -> key.typeSlug().equals(slug))
                    .sorted(Comparator.<SchemaMigrationKey, SchemaVersion>comparing(key -> SchemaVersion.parse(key.fromVersion()))
                            .thenComparing(key -> SchemaVersion.parse(key.toVersion())))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public long getRevision() {
        return revision.get();
    }

    /**
     * Builds the canonical key for a migration.
     *
     * @throws InvalidSchemaVersionException when a version is malformed, the slugs disagree or no slug is known
     */
    static SchemaMigrationKey canonicalKey(String typeSlug, String fromVersion, String toVersion) {
        SchemaVersion from = SchemaVersion.parse(fromVersion);
        SchemaVersion to = SchemaVersion.parse(toVersion);
        String slug = StringUtils.trimToEmpty(typeSlug);
        for (SchemaVersion version : List.of(from, to)) {
            if (!version.hasSlug()) {
                continue;
            }
            if (slug.isEmpty()) {
                slug = version.getSlug();
            } else if (!slug.equals(version.getSlug())) {
                throw new InvalidSchemaVersionException(version.toString(), "slug does not match [" + slug + "]");
            }
        }
        if (slug.isEmpty()) {
            throw new InvalidSchemaVersionException(fromVersion, "type slug is required");
        }
        return new SchemaMigrationKey(slug, from.toNumericString(), to.toNumericString());
    }
}
