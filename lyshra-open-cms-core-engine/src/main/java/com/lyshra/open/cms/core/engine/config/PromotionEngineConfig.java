package com.lyshra.open.cms.core.engine.config;

import com.lyshra.open.cms.integration.models.environment.Environment;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Configuration for the content version and promotion services.
 *
 * Capability switches are plain flags read once when the services are wired.
 */
@Getter
@Builder
@ToString
public final class PromotionEngineConfig {

    // Environment resolution
    @Builder.Default
    private final String defaultEnvironmentKey = Environment.DEFAULT_KEY;

    // Capabilities
    @Builder.Default
    private final boolean versioningEnabled = true;

    @Builder.Default
    private final boolean blockPromotionEnabled = true;

    @Builder.Default
    private final boolean activityEnabled = true;

    // Migration
    @Builder.Default
    private final boolean migrationPathSearchEnabled = false;

    // Retention, 0 means unlimited
    @Builder.Default
    private final int maxVersionsPerEntry = 0;

    /**
     * Creates the default configuration.
     */
    public static PromotionEngineConfig defaultConfig() {
        return PromotionEngineConfig.builder().build();
    }

    /**
     * Creates a configuration that only applies direct migrations and promotes no block definitions.
     */
    public static PromotionEngineConfig strict() {
        return PromotionEngineConfig.builder()
                .migrationPathSearchEnabled(false)
                .blockPromotionEnabled(false)
                .build();
    }

    /**
     * Validates the configuration.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        if (defaultEnvironmentKey == null || defaultEnvironmentKey.isBlank()) {
            throw new IllegalStateException("defaultEnvironmentKey must not be blank");
        }
        if (!defaultEnvironmentKey.equals(Environment.normalizeKey(defaultEnvironmentKey))) {
            throw new IllegalStateException("defaultEnvironmentKey must be lowercase without surrounding whitespace");
        }
        if (maxVersionsPerEntry < 0) {
            throw new IllegalStateException("maxVersionsPerEntry must not be negative");
        }
    }
}
