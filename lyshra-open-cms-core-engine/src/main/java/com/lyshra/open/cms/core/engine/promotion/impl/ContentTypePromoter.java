package com.lyshra.open.cms.core.engine.promotion.impl;

import com.lyshra.open.cms.core.engine.config.PromotionEngineConfig;
import com.lyshra.open.cms.core.engine.config.PromotionEngineDependencies;
import com.lyshra.open.cms.core.engine.promotion.BlockDefinitionPromoter;
import com.lyshra.open.cms.core.engine.promotion.PromotionActivityPublisher;
import com.lyshra.open.cms.core.engine.promotion.PromotionCheckpoint;
import com.lyshra.open.cms.core.engine.schema.NormalizedSchema;
import com.lyshra.open.cms.core.engine.schema.SchemaVersions;
import com.lyshra.open.cms.core.exception.promotion.BreakingSchemaChangeException;
import com.lyshra.open.cms.core.exception.promotion.ContentTypeInactiveException;
import com.lyshra.open.cms.core.exception.promotion.TargetAheadOfSourceException;
import com.lyshra.open.cms.integration.contract.repository.IContentTypeRepository;
import com.lyshra.open.cms.integration.contract.schema.ISchemaCompatibilityChecker;
import com.lyshra.open.cms.integration.enumerations.ContentTypeStatus;
import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import com.lyshra.open.cms.integration.enumerations.PromotionStatus;
import com.lyshra.open.cms.integration.exception.RecordConflictException;
import com.lyshra.open.cms.integration.exception.RecordNotFoundException;
import com.lyshra.open.cms.integration.models.content.ContentType;
import com.lyshra.open.cms.integration.models.environment.Environment;
import com.lyshra.open.cms.integration.models.promotion.PromotionCancellation;
import com.lyshra.open.cms.integration.models.promotion.PromotionItem;
import com.lyshra.open.cms.integration.models.promotion.PromotionOptions;
import com.lyshra.open.cms.integration.models.schema.CompatibilityReport;
import com.lyshra.open.cms.integration.models.schema.SchemaHistorySnapshot;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Copies a content type, its schema history and the blocks its schema references into another environment.
 */
@Slf4j
class ContentTypePromoter {

    private final PromotionEngineConfig config;
    private final IContentTypeRepository contentTypeRepository;
    private final ISchemaCompatibilityChecker compatibilityChecker;
    private final BlockDefinitionPromoter blockDefinitionPromoter;
    private final PromotionActivityPublisher activityPublisher;
    private final Clock clock;
    private final Supplier<UUID> idGenerator;

    ContentTypePromoter(PromotionEngineConfig config, PromotionEngineDependencies dependencies,
                        PromotionActivityPublisher activityPublisher) {
        this.config = config;
        this.contentTypeRepository = dependencies.getContentTypeRepository();
        this.compatibilityChecker = dependencies.getCompatibilityChecker();
        this.blockDefinitionPromoter = new BlockDefinitionPromoter(dependencies.getBlockDefinitionService());
        this.activityPublisher = activityPublisher;
        this.clock = dependencies.getClock();
        this.idGenerator = dependencies.getIdGenerator();
    }

    Mono<ContentTypePromotion> promote(ContentType source, Environment sourceEnvironment, Environment targetEnvironment,
                                       PromotionOptions options, String actor, PromotionCancellation cancellation) {
        return PromotionCheckpoint.then(cancellation, Mono.defer(() -> {
            if (Objects.equals(sourceEnvironment.getId(), targetEnvironment.getId())) {
                return Mono.just(new ContentTypePromotion(PromotionItem.builder()
                        .kind(PromotionItemKind.CONTENT_TYPE)
                        .sourceId(source.getId())
                        .targetId(source.getId())
                        .status(PromotionStatus.SKIPPED)
                        .message("source and target environments match")
                        .build(), source));
            }
            if (source.getStatus() != ContentTypeStatus.ACTIVE && !options.isAllowDraft()) {
                return Mono.error(new ContentTypeInactiveException(source.getSlug()));
            }
            return Mono.fromCallable(() -> SchemaVersions.normalize(source))
                    .flatMap(normalized -> PromotionCheckpoint.then(cancellation, findTarget(source.getSlug(), targetEnvironment.getId()))
                            .flatMap(target -> {
                                target.ifPresent(existing -> checkTarget(source, normalized, existing, options));
                                if (options.isDryRun()) {
                                    return promoteBlocks(normalized, sourceEnvironment, targetEnvironment, true)
                                            .then(Mono.fromSupplier(() -> dryRun(source, normalized, target.orElse(null), targetEnvironment)));
                                }
                                return promoteBlocks(normalized, sourceEnvironment, targetEnvironment, false)
                                        .then(PromotionCheckpoint.then(cancellation,
                                                write(source, normalized, target.orElse(null), targetEnvironment, options, actor)))
                                        .doOnNext(written -> log.info("Promoted content type [{}] to environment [{}] at version [{}]: {}",
                                                source.getSlug(), targetEnvironment.getKey(), normalized.versionString(), written.status()))
                                        .flatMap(written -> emitActivity(written, actor, sourceEnvironment, targetEnvironment, options)
                                                .thenReturn(new ContentTypePromotion(
                                                        item(source, written.stored(), written.status(), normalized, false),
                                                        written.stored())));
                            }));
        }));
    }

    // === Checks ===

    private void checkTarget(ContentType source, NormalizedSchema normalized, ContentType target, PromotionOptions options) {
        NormalizedSchema targetSchema = SchemaVersions.normalize(target);
        if (SchemaVersions.compare(targetSchema.versionString(), normalized.versionString()) > 0 && !options.isForce()) {
            throw new TargetAheadOfSourceException(source.getSlug(), targetSchema.versionString(), normalized.versionString());
        }
        CompatibilityReport report = compatibilityChecker.check(targetSchema.schema(), normalized.schema());
        if (report.hasBreakingChanges() && !options.isAllowBreakingChanges()) {
            throw new BreakingSchemaChangeException(source.getSlug(), report);
        }
    }

    private Mono<Optional<ContentType>> findTarget(String slug, UUID targetEnvironmentId) {
        return contentTypeRepository.getBySlug(slug, targetEnvironmentId)
                .map(Optional::of)
                .onErrorResume(RecordNotFoundException.class, e -> Mono.just(Optional.empty()));
    }

    // === Writes ===

    private record Written(ContentType stored, PromotionStatus status) {
    }

    private ContentTypePromotion dryRun(ContentType source, NormalizedSchema normalized, ContentType target, Environment targetEnvironment) {
        ContentType preview = target != null
                ? target
                : source.toBuilder().id(idGenerator.get()).environmentId(targetEnvironment.getId()).build();
        PromotionStatus status = target != null ? PromotionStatus.UPDATED : PromotionStatus.CREATED;
        log.info("Dry run: content type [{}] would be {} in environment [{}]",
                source.getSlug(), status.name().toLowerCase(Locale.ROOT), targetEnvironment.getKey());
        PromotionItem item = item(source, target, status, normalized, true);
        return new ContentTypePromotion(item, preview);
    }

    private Mono<Void> promoteBlocks(NormalizedSchema normalized, Environment sourceEnvironment, Environment targetEnvironment,
                                     boolean dryRun) {
        if (!config.isBlockPromotionEnabled()) {
            return Mono.empty();
        }
        return blockDefinitionPromoter.promote(normalized.schema(), sourceEnvironment, targetEnvironment, dryRun)
                .doOnNext(slugs -> {
                    if (!slugs.isEmpty() && !dryRun) {
                        log.debug("Promoted block definitions {} to environment [{}]", slugs, targetEnvironment.getKey());
                    }
                })
                .then();
    }

    private Mono<Written> write(ContentType source, NormalizedSchema normalized, ContentType target,
                                Environment targetEnvironment, PromotionOptions options, String actor) {
        SchemaHistorySnapshot snapshot = SchemaHistorySnapshot.builder()
                .version(normalized.versionString())
                .schema(normalized.schema())
                .uiSchema(source.getUiSchema())
                .capabilities(source.getCapabilities())
                .status(source.getStatus())
                .updatedAt(clock.instant())
                .updatedBy(actor)
                .build();
        if (target != null) {
            return update(source, normalized, target, snapshot, options);
        }
        ContentType created = source.toBuilder()
                .id(null)
                .environmentId(targetEnvironment.getId())
                .schema(normalized.schema())
                .schemaVersion(normalized.versionString())
                .schemaHistory(SchemaVersions.appendHistory(source.getSchemaHistory(), snapshot))
                .status(options.isPromoteAsActive() ? ContentTypeStatus.ACTIVE : ContentTypeStatus.DRAFT)
                .createdAt(null)
                .updatedAt(null)
                .build();
        return contentTypeRepository.create(created)
                .map(stored -> new Written(stored, PromotionStatus.CREATED))
                .onErrorResume(RecordConflictException.class, e -> {
                    log.warn("Content type [{}] appeared in environment [{}] while promoting, updating instead",
                            source.getSlug(), targetEnvironment.getKey());
                    return contentTypeRepository.getBySlug(source.getSlug(), targetEnvironment.getId())
                            .flatMap(existing -> {
                                checkTarget(source, normalized, existing, options);
                                return update(source, normalized, existing, snapshot, options);
                            });
                });
    }

    private Mono<Written> update(ContentType source, NormalizedSchema normalized, ContentType target,
                                 SchemaHistorySnapshot snapshot, PromotionOptions options) {
        ContentType updated = target.toBuilder()
                .name(source.getName())
                .description(source.getDescription())
                .icon(source.getIcon())
                .schema(normalized.schema())
                .uiSchema(source.getUiSchema())
                .capabilities(source.getCapabilities())
                .schemaVersion(normalized.versionString())
                .schemaHistory(SchemaVersions.appendHistory(target.getSchemaHistory(), snapshot))
                .status(options.isPromoteAsActive() ? ContentTypeStatus.ACTIVE : ContentTypeStatus.DRAFT)
                .build();
        return contentTypeRepository.update(updated)
                .map(stored -> new Written(stored, PromotionStatus.UPDATED));
    }

    private Mono<Void> emitActivity(Written written, String actor, Environment sourceEnvironment,
                                    Environment targetEnvironment, PromotionOptions options) {
        if (!config.isActivityEnabled()) {
            return Mono.empty();
        }
        return activityPublisher.publish(PromotionItemKind.CONTENT_TYPE, written.stored().getId(), actor,
                sourceEnvironment, targetEnvironment, options);
    }

    private static PromotionItem item(ContentType source, ContentType target, PromotionStatus status,
                                      NormalizedSchema normalized, boolean dryRun) {
        return PromotionItem.builder()
                .kind(PromotionItemKind.CONTENT_TYPE)
                .sourceId(source.getId())
                .targetId(target == null ? null : target.getId())
                .status(status)
                .message(dryRun ? "dry run" : null)
                .details(Map.of(
                        PromotionItem.DETAIL_SCHEMA_VERSION, normalized.versionString(),
                        PromotionItem.DETAIL_DRY_RUN, dryRun))
                .build();
    }
}
