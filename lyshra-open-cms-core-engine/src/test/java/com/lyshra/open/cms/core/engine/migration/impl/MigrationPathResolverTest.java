package com.lyshra.open.cms.core.engine.migration.impl;

import com.lyshra.open.cms.core.engine.migration.SchemaPayloadMigrator;
import com.lyshra.open.cms.core.exception.migration.NoMigrationPathException;
import com.lyshra.open.cms.integration.contract.schema.ISchemaMigrationRegistry;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.SchemaMigrationKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MigrationPathResolverTest {

    private ISchemaMigrationRegistry registry;
    private MigrationPathResolver resolver;

    @BeforeEach
    void setUp() {
        registry = SchemaMigrationRegistryImpl.create();
        registry.register("article", "v1.0.0", "v1.1.0", payload -> payload.with("step", "1.1"));
        registry.register("article", "v1.1.0", "v2.0.0", payload -> payload.with("step", "2.0"));
        registry.register("article", "v2.0.0", "v3.0.0", payload -> payload.with("step", "3.0"));
        resolver = new MigrationPathResolver(registry);
    }

    @Test
    @DisplayName("should find the chain through intermediate versions")
    void shouldResolveChain() {
        List<SchemaMigrationKey> chain = resolver.resolve("article", "article@v1.0.0", "article@v3.0.0");

        assertEquals(List.of("v1.1.0", "v2.0.0", "v3.0.0"), chain.stream().map(SchemaMigrationKey::toVersion).toList());
    }

    @Test
    @DisplayName("should prefer a shorter chain once a shortcut is registered")
    void shouldPickUpShortcut() {
        // Given
        resolver.resolve("article", "v1.0.0", "v3.0.0");

        // When
        registry.register("article", "v1.0.0", "v3.0.0", payload -> payload.with("step", "direct"));
        List<SchemaMigrationKey> chain = resolver.resolve("article", "v1.0.0", "v3.0.0");

        // Then
        assertEquals(1, chain.size());
    }

    @Test
    @DisplayName("should drop chains cached under an older registry revision")
    void shouldEvictStaleRevisions() {
        // Given
        resolver.resolve("article", "v1.0.0", "v3.0.0");
        resolver.resolve("article", "v1.1.0", "v3.0.0");
        assertEquals(2, resolver.cachedChains());

        // When
        registry.register("article", "v3.0.0", "v4.0.0", payload -> payload);
        List<SchemaMigrationKey> chain = resolver.resolve("article", "v1.0.0", "v4.0.0");

        // Then
        assertEquals(4, chain.size());
        assertEquals(1, resolver.cachedChains());
    }

    @Test
    @DisplayName("should never serve a chain resolved before a concurrent registration")
    void shouldResolveConsistentlyWhileRegistering() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> resolvers = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                resolvers.add(executor.submit(() -> {
                    start.await();
                    boolean shortcutSeen = false;
                    for (int round = 0; round < 500; round++) {
                        int hops = resolver.resolve("article", "v1.0.0", "v3.0.0").size();
                        assertTrue(hops == 3 || hops == 1, "unexpected chain length " + hops);
                        if (shortcutSeen) {
                            assertEquals(1, hops);
                        }
                        shortcutSeen |= hops == 1;
                    }
                    return null;
                }));
            }
            Future<?> registrations = executor.submit(() -> {
                start.await();
                for (int minor = 1; minor <= 50; minor++) {
                    registry.register("page", "v1." + (minor - 1) + ".0", "v1." + minor + ".0", payload -> payload);
                }
                registry.register("article", "v1.0.0", "v3.0.0", payload -> payload);
                return null;
            });

            start.countDown();
            registrations.get(10, TimeUnit.SECONDS);
            for (Future<?> future : resolvers) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(1, resolver.resolve("article", "v1.0.0", "v3.0.0").size());
        assertEquals(50, resolver.resolve("page", "v1.0.0", "v1.50.0").size());
    }

    @Test
    @DisplayName("should return an empty chain for equal versions")
    void shouldReturnEmptyForSameVersion() {
        assertTrue(resolver.resolve("article", "v2.0.0", "article@v2.0.0").isEmpty());
    }

    @Test
    @DisplayName("should fail for disconnected versions and never walk backwards")
    void shouldFailWhenDisconnected() {
        assertThrows(NoMigrationPathException.class, () -> resolver.resolve("article", "v3.0.0", "v1.0.0"));
        assertThrows(NoMigrationPathException.class, () -> resolver.resolve("article", "v1.0.0", "v4.0.0"));
    }

    @Test
    @DisplayName("should apply every hop in order")
    void shouldMigrateAlongPath() {
        Document.ObjectValue migrated = resolver.migrateAlongPath("article", "v1.0.0", "v3.0.0",
                Document.object(Map.of("title", "Hello")));

        assertEquals("3.0", migrated.getString("step").orElseThrow());
        assertEquals("Hello", migrated.getString("title").orElseThrow());
    }

    @Test
    @DisplayName("should only search paths when enabled on the payload migrator")
    void shouldGatePathSearch() {
        Document.ObjectValue payload = Document.object(Map.of("title", "Hello"));

        SchemaPayloadMigrator direct = new SchemaPayloadMigrator(registry, false);
        SchemaPayloadMigrator searching = new SchemaPayloadMigrator(registry, true);

        assertThrows(NoMigrationPathException.class, () -> direct.migrate("article", "v1.0.0", "v3.0.0", payload));
        assertEquals("3.0", searching.migrate("article", "v1.0.0", "v3.0.0", payload).getString("step").orElseThrow());
        assertTrue(searching.isPathSearchEnabled());
    }
}
