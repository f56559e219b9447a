package com.lyshra.open.cms.core.engine.migration.impl;

import com.lyshra.open.cms.core.exception.migration.NoMigrationPathException;
import com.lyshra.open.cms.integration.contract.schema.ISchemaMigrationRegistry;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.SchemaMigrationKey;
import com.lyshra.open.cms.integration.models.schema.SchemaVersion;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Finds the shortest chain of registered direct migrations between two versions.
 *
 * <p>Breadth-first search over the registry's edges for one content type slug. Edges leaving a
 * version are visited in ascending target version order, so equal-length chains resolve the same
 * way every time. Results are cached per registry revision and key, so a chain computed before a
 * registration is never served after it. Entries of older revisions are evicted lazily.</p>
 */
@Slf4j
public class MigrationPathResolver {

    private final ISchemaMigrationRegistry registry;
    private final Map<CacheKey, List<SchemaMigrationKey>> cache;
    private final AtomicLong latestRevision;

    public MigrationPathResolver(ISchemaMigrationRegistry registry) {
        this.registry = registry;
        this.cache = new ConcurrentHashMap<>();
        this.latestRevision = new AtomicLong(registry.getRevision());
    }

    /**
     * Resolves the migration chain.
     *
     * @return edges to apply in order; empty when both versions carry the same numbers
     * @throws NoMigrationPathException when the versions are not connected
     */
    public List<SchemaMigrationKey> resolve(String typeSlug, String fromVersion, String toVersion) {
        SchemaMigrationKey key = SchemaMigrationRegistryImpl.canonicalKey(typeSlug, fromVersion, toVersion);
        if (key.fromVersion().equals(key.toVersion())) {
            return List.of();
        }
        long revision = registry.getRevision();
        long previous = latestRevision.getAndAccumulate(revision, Math::max);
        if (revision > previous) {
            cache.keySet().removeIf(cached -> cached.revision() < revision);
        }
        List<SchemaMigrationKey> chain = cache.computeIfAbsent(new CacheKey(revision, key), cached -> search(key));
        if (chain.isEmpty()) {
            throw new NoMigrationPathException(key.typeSlug(), key.fromVersion(), key.toVersion());
        }
        return chain;
    }

    /**
     * Applies the resolved chain hop by hop.
     */
    public Document.ObjectValue migrateAlongPath(String typeSlug, String fromVersion, String toVersion,
                                                 Document.ObjectValue payload) {
        Document.ObjectValue current = payload;
        for (SchemaMigrationKey hop : resolve(typeSlug, fromVersion, toVersion)) {
            current = registry.migrate(hop.typeSlug(), hop.fromVersion(), hop.toVersion(), current);
        }
        return current;
    }

    private List<SchemaMigrationKey> search(SchemaMigrationKey target) {
        Map<String, List<SchemaMigrationKey>> outgoing = new HashMap<>();
        for (SchemaMigrationKey edge : registry.getRegisteredMigrations(target.typeSlug())) {
            outgoing.computeIfAbsent(edge.fromVersion(), k -> new ArrayList<>()).add(edge);
        }
        outgoing.values().forEach(edges -> edges.sort(
                (a, b) -> SchemaVersion.parse(a.toVersion()).compareTo(SchemaVersion.parse(b.toVersion()))));

        Map<String, SchemaMigrationKey> reachedBy = new HashMap<>();
        Set<String> visited = new HashSet<>();
        Queue<String> queue = new ArrayDeque<>();
        queue.add(target.fromVersion());
        visited.add(target.fromVersion());

        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(target.toVersion())) {
                List<SchemaMigrationKey> chain = new ArrayList<>();
                String step = current;
                while (reachedBy.containsKey(step)) {
                    SchemaMigrationKey edge = reachedBy.get(step);
                    chain.add(0, edge);
                    step = edge.fromVersion();
                }
                log.debug("Resolved migration chain for [{}]: {}", target.typeSlug(), chain);
                return List.copyOf(chain);
            }
            for (SchemaMigrationKey edge : outgoing.getOrDefault(current, List.of())) {
                if (visited.add(edge.toVersion())) {
                    reachedBy.put(edge.toVersion(), edge);
                    queue.add(edge.toVersion());
                }
            }
        }
        return List.of();
    }

    int cachedChains() {
        return cache.size();
    }

    private record CacheKey(long revision, SchemaMigrationKey key) {
    }
}
