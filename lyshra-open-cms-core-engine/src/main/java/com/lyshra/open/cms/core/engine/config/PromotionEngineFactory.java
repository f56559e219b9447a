package com.lyshra.open.cms.core.engine.config;

import com.lyshra.open.cms.core.engine.content.SnapshotMigrator;
import com.lyshra.open.cms.core.engine.content.impl.ContentVersionServiceImpl;
import com.lyshra.open.cms.core.engine.migration.SchemaPayloadMigrator;
import com.lyshra.open.cms.core.engine.promotion.impl.PromotionServiceImpl;
import com.lyshra.open.cms.integration.contract.content.IContentVersionService;
import com.lyshra.open.cms.integration.contract.promotion.IPromotionService;
import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * Creates and wires the content version and promotion services.
 */
@Slf4j
public final class PromotionEngineFactory {

    private PromotionEngineFactory() {
        // Utility class
    }

    /**
     * Creates a fully wired engine.
     *
     * @param config       the configuration
     * @param dependencies storage and optional collaborators
     * @return the configured engine
     */
    public static PromotionEngine create(PromotionEngineConfig config, PromotionEngineDependencies dependencies) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(dependencies, "dependencies must not be null");
        config.validate();
        dependencies.validate();

        log.info("Creating promotion engine with config: {}", config);

        SnapshotMigrator snapshotMigrator = createSnapshotMigrator(config, dependencies);
        IContentVersionService contentVersionService = new ContentVersionServiceImpl(config, dependencies, snapshotMigrator);
        IPromotionService promotionService = new PromotionServiceImpl(config, dependencies, snapshotMigrator);

        return new PromotionEngine(config, dependencies, contentVersionService, promotionService);
    }

    private static SnapshotMigrator createSnapshotMigrator(PromotionEngineConfig config, PromotionEngineDependencies dependencies) {
        SchemaPayloadMigrator payloadMigrator = dependencies.getMigrationRegistry() == null
                ? null
                : new SchemaPayloadMigrator(dependencies.getMigrationRegistry(), config.isMigrationPathSearchEnabled());
        return new SnapshotMigrator(payloadMigrator, dependencies.getPayloadValidator());
    }
}
