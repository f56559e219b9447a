package com.lyshra.open.cms.core.engine.config;

import com.lyshra.open.cms.core.engine.activity.impl.LoggingActivityEmitter;
import com.lyshra.open.cms.core.engine.schema.impl.SchemaCompatibilityCheckerImpl;
import com.lyshra.open.cms.core.engine.schema.impl.SchemaPayloadValidatorImpl;
import com.lyshra.open.cms.integration.contract.activity.IActivityEmitter;
import com.lyshra.open.cms.integration.contract.block.IBlockDefinitionService;
import com.lyshra.open.cms.integration.contract.environment.IEnvironmentService;
import com.lyshra.open.cms.integration.contract.repository.IContentRepository;
import com.lyshra.open.cms.integration.contract.repository.IContentTypeRepository;
import com.lyshra.open.cms.integration.contract.repository.ILocaleRepository;
import com.lyshra.open.cms.integration.contract.schema.ISchemaCompatibilityChecker;
import com.lyshra.open.cms.integration.contract.schema.ISchemaMigrationRegistry;
import lombok.Builder;
import lombok.Getter;

import java.time.Clock;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Collaborators the content services are wired with.
 *
 * <p>Repositories and the environment service are required. {@code activityEmitter} and
 * {@code migrationRegistry} may be null, which disables activity emission and payload migration.
 * {@code blockDefinitionService} may be null as long as no promoted schema references blocks.</p>
 */
@Getter
@Builder(toBuilder = true)
public final class PromotionEngineDependencies {

    private final IContentTypeRepository contentTypeRepository;
    private final IContentRepository contentRepository;
    private final ILocaleRepository localeRepository;
    private final IEnvironmentService environmentService;

    private final IBlockDefinitionService blockDefinitionService;

    @Builder.Default
    private final IActivityEmitter activityEmitter = LoggingActivityEmitter.getInstance();

    private final ISchemaMigrationRegistry migrationRegistry;

    @Builder.Default
    private final ISchemaCompatibilityChecker compatibilityChecker = SchemaCompatibilityCheckerImpl.getInstance();

    @Builder.Default
    private final SchemaPayloadValidatorImpl payloadValidator = SchemaPayloadValidatorImpl.getInstance();

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    @Builder.Default
    private final Supplier<UUID> idGenerator = UUID::randomUUID;

    /**
     * @throws IllegalStateException if a required collaborator is missing
     */
    public void validate() {
        if (contentTypeRepository == null) {
            throw new IllegalStateException("contentTypeRepository is required");
        }
        if (contentRepository == null) {
            throw new IllegalStateException("contentRepository is required");
        }
        if (localeRepository == null) {
            throw new IllegalStateException("localeRepository is required");
        }
        if (environmentService == null) {
            throw new IllegalStateException("environmentService is required");
        }
        if (compatibilityChecker == null || payloadValidator == null || clock == null || idGenerator == null) {
            throw new IllegalStateException("compatibilityChecker, payloadValidator, clock and idGenerator must not be null");
        }
    }
}
