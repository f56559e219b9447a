package com.lyshra.open.cms.core.engine.promotion;

import com.lyshra.open.cms.core.engine.repository.impl.InMemoryEnvironmentService;
import com.lyshra.open.cms.integration.exception.EnvironmentNotFoundException;
import com.lyshra.open.cms.integration.models.environment.Environment;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class EnvironmentResolverTest {

    private InMemoryEnvironmentService environments;
    private EnvironmentResolver resolver;
    private Environment defaultEnvironment;
    private Environment staging;

    @BeforeEach
    void setUp() {
        environments = new InMemoryEnvironmentService();
        defaultEnvironment = environments.register("default", "Default");
        staging = environments.register("Staging", "Staging");
        resolver = new EnvironmentResolver(environments, Environment.DEFAULT_KEY);
    }

    @Test
    @DisplayName("should resolve keys case-insensitively and ignore surrounding whitespace")
    void shouldNormalizeKey() {
        assertEquals(staging.getId(), resolver.resolve(null, "  STAGING ").block().getId());
    }

    @Test
    @DisplayName("should resolve a key that is itself a UUID as an id")
    void shouldResolveUuidKey() {
        assertEquals("staging", resolver.resolve(null, staging.getId().toString()).block().getKey());
    }

    @Test
    @DisplayName("should let an explicit id win over the key")
    void shouldPreferExplicitId() {
        assertEquals(staging.getId(), resolver.resolve(staging.getId(), "default").block().getId());
    }

    @Test
    @DisplayName("should fall back to the default environment for a blank key")
    void shouldUseDefaultForBlankKey() {
        assertEquals(defaultEnvironment.getId(), resolver.resolve(null, "   ").block().getId());
        assertEquals(defaultEnvironment.getId(), resolver.resolve(null, null).block().getId());
    }

    @Test
    @DisplayName("should fail for unknown and inactive environments")
    void shouldFailForUnknownOrInactive() {
        environments.register(Environment.builder().id(UUID.randomUUID()).key("archive").name("Archive").active(false).build());

        StepVerifier.create(resolver.resolve(null, "qa"))
                .expectError(EnvironmentNotFoundException.class)
                .verify();
        StepVerifier.create(resolver.resolve(null, "archive"))
                .expectError(EnvironmentNotFoundException.class)
                .verify();
        StepVerifier.create(resolver.resolve(UUID.randomUUID(), null))
                .expectError(EnvironmentNotFoundException.class)
                .verify();
    }
}
