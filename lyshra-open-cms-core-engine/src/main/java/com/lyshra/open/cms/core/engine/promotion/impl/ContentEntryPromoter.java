package com.lyshra.open.cms.core.engine.promotion.impl;

import com.lyshra.open.cms.core.engine.config.PromotionEngineConfig;
import com.lyshra.open.cms.core.engine.config.PromotionEngineDependencies;
import com.lyshra.open.cms.core.engine.content.SnapshotMigrator;
import com.lyshra.open.cms.core.engine.promotion.PromotionActivityPublisher;
import com.lyshra.open.cms.core.engine.promotion.PromotionCheckpoint;
import com.lyshra.open.cms.core.engine.schema.NormalizedSchema;
import com.lyshra.open.cms.core.engine.schema.SchemaVersions;
import com.lyshra.open.cms.core.exception.promotion.ContentTypeRequiredException;
import com.lyshra.open.cms.core.exception.promotion.ContentVersionRequiredException;
import com.lyshra.open.cms.core.exception.promotion.SlugExistsException;
import com.lyshra.open.cms.core.exception.promotion.UnknownLocaleException;
import com.lyshra.open.cms.integration.contract.repository.IContentRepository;
import com.lyshra.open.cms.integration.contract.repository.IContentTypeRepository;
import com.lyshra.open.cms.integration.contract.repository.ILocaleRepository;
import com.lyshra.open.cms.integration.enumerations.ContentStatus;
import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import com.lyshra.open.cms.integration.enumerations.PromotionMode;
import com.lyshra.open.cms.integration.enumerations.PromotionStatus;
import com.lyshra.open.cms.integration.exception.RecordConflictException;
import com.lyshra.open.cms.integration.exception.RecordNotFoundException;
import com.lyshra.open.cms.integration.models.content.ContentEntry;
import com.lyshra.open.cms.integration.models.content.ContentSnapshot;
import com.lyshra.open.cms.integration.models.content.ContentTranslation;
import com.lyshra.open.cms.integration.models.content.ContentType;
import com.lyshra.open.cms.integration.models.content.ContentVersion;
import com.lyshra.open.cms.integration.models.content.TranslationSnapshot;
import com.lyshra.open.cms.integration.models.environment.Environment;
import com.lyshra.open.cms.integration.models.promotion.PromotionCancellation;
import com.lyshra.open.cms.integration.models.promotion.PromotionItem;
import com.lyshra.open.cms.integration.models.promotion.PromotionOptions;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Copies a content entry, with one of its versions brought to the target type's schema, into another environment.
 *
 * <p>The promoted version is the published one when available and preferred, otherwise the
 * latest draft if drafts are allowed. Its payloads are migrated to the target content type's
 * schema version. In the target the promoted snapshot becomes a new version numbered after the
 * highest existing one, so version numbers only grow. Optionally the other source versions are
 * copied first, unmigrated, as drafts.</p>
 */
@Slf4j
class ContentEntryPromoter {

    private final PromotionEngineConfig config;
    private final IContentRepository contentRepository;
    private final IContentTypeRepository contentTypeRepository;
    private final ILocaleRepository localeRepository;
    private final SnapshotMigrator snapshotMigrator;
    private final ContentTypePromoter contentTypePromoter;
    private final PromotionActivityPublisher activityPublisher;
    private final Clock clock;
    private final Supplier<UUID> idGenerator;

    ContentEntryPromoter(PromotionEngineConfig config, PromotionEngineDependencies dependencies,
                         SnapshotMigrator snapshotMigrator, ContentTypePromoter contentTypePromoter,
                         PromotionActivityPublisher activityPublisher) {
        this.config = config;
        this.contentRepository = dependencies.getContentRepository();
        this.contentTypeRepository = dependencies.getContentTypeRepository();
        this.localeRepository = dependencies.getLocaleRepository();
        this.snapshotMigrator = snapshotMigrator;
        this.contentTypePromoter = contentTypePromoter;
        this.activityPublisher = activityPublisher;
        this.clock = dependencies.getClock();
        this.idGenerator = dependencies.getIdGenerator();
    }

    /**
     * Everything the write phase needs, resolved before any write happens.
     */
    private record Plan(ContentEntry source, ContentType targetType, ContentVersion sourceVersion,
                        ContentSnapshot snapshot, NormalizedSchema targetSchema, ContentEntry existing,
                        UUID targetEntryId, List<ContentTranslation> translations, String actor) {
    }

    Mono<PromotionItem> promote(ContentEntry entry, ContentType sourceType, Environment sourceEnvironment,
                                Environment targetEnvironment, PromotionOptions options, String actor,
                                PromotionCancellation cancellation) {
        if (Objects.equals(sourceEnvironment.getId(), targetEnvironment.getId())) {
            return Mono.just(PromotionItem.builder()
                    .kind(PromotionItemKind.CONTENT_ENTRY)
                    .sourceId(entry.getId())
                    .targetId(entry.getId())
                    .status(PromotionStatus.SKIPPED)
                    .message("source and target environments match")
                    .build());
        }
        return PromotionCheckpoint.then(cancellation,
                        resolveTargetType(sourceType, sourceEnvironment, targetEnvironment, options, actor, cancellation))
                .flatMap(targetType -> selectSourceVersion(entry, options)
                        .flatMap(version -> plan(entry, sourceType, targetType, version, targetEnvironment, options, actor)))
                .flatMap(plan -> {
                    if (options.isDryRun()) {
                        log.info("Dry run: content entry [{}] would be {} in environment [{}]", entry.getSlug(),
                                plan.existing() != null ? "updated" : "created", targetEnvironment.getKey());
                        return Mono.just(item(plan, plan.existing() != null ? PromotionStatus.UPDATED : PromotionStatus.CREATED,
                                plan.existing() == null ? null : plan.existing().getId(), true));
                    }
                    return PromotionCheckpoint.then(cancellation, write(plan, targetEnvironment, options))
                            .flatMap(written -> finalizeVersions(plan, written.entry(), options)
                                    .flatMap(stored -> emitActivity(stored, plan.actor(), sourceEnvironment, targetEnvironment, options)
                                            .thenReturn(item(plan, written.status(), stored.getId(), false))));
                });
    }

    // === Resolution ===

    private Mono<ContentType> resolveTargetType(ContentType sourceType, Environment sourceEnvironment, Environment targetEnvironment,
                                                PromotionOptions options, String actor, PromotionCancellation cancellation) {
        return contentTypeRepository.getBySlug(sourceType.getSlug(), targetEnvironment.getId())
                .onErrorResume(RecordNotFoundException.class, e -> {
                    if (!options.isAutoPromoteType()) {
                        return Mono.error(ContentTypeRequiredException.missingInTarget(sourceType.getSlug(), targetEnvironment.getKey()));
                    }
                    log.info("Content type [{}] missing in environment [{}], promoting it first",
                            sourceType.getSlug(), targetEnvironment.getKey());
                    return contentTypePromoter.promote(sourceType, sourceEnvironment, targetEnvironment, options, actor, cancellation)
                            .map(ContentTypePromotion::targetType);
                });
    }

    private Mono<ContentVersion> selectSourceVersion(ContentEntry entry, PromotionOptions options) {
        Mono<Optional<ContentVersion>> published = entry.getPublishedVersion()
                .map(number -> contentRepository.getVersion(entry.getId(), number)
                        .map(Optional::of)
                        .onErrorResume(RecordNotFoundException.class, e -> Mono.just(Optional.empty())))
                .orElse(Mono.just(Optional.empty()));
        return published.flatMap(found -> {
            if (found.isPresent() && (options.isPreferPublished() || !options.isAllowDraft())) {
                return Mono.just(found.get());
            }
            if (!options.isAllowDraft()) {
                return Mono.error(new ContentVersionRequiredException(entry.getId()));
            }
            return contentRepository.getLatestVersion(entry.getId())
                    .onErrorMap(RecordNotFoundException.class, e -> new ContentVersionRequiredException(entry.getId()));
        });
    }

    private Mono<Plan> plan(ContentEntry entry, ContentType sourceType, ContentType targetType, ContentVersion version,
                            Environment targetEnvironment, PromotionOptions options, String actor) {
        return Mono.fromCallable(() -> SchemaVersions.normalize(targetType))
                .flatMap(targetSchema -> Mono.fromCallable(() -> snapshotMigrator.migrate(version.getSnapshot(), targetType.getSlug(),
                                SchemaVersions.normalize(sourceType).versionString(), targetSchema, options.isMigrateOnPromote()))
                        .flatMap(outcome -> findTargetEntry(entry.getSlug(), targetType.getId(), targetEnvironment.getId())
                                .flatMap(existing -> {
                                    if (existing.isPresent() && options.getMode() == PromotionMode.STRICT) {
                                        return Mono.error(new SlugExistsException(entry.getSlug(), targetEnvironment.getKey()));
                                    }
                                    String author = StringUtils.firstNonBlank(actor, entry.getUpdatedBy(), entry.getCreatedBy());
                                    UUID targetEntryId = existing.map(ContentEntry::getId).orElseGet(idGenerator);
                                    return resolveTranslations(outcome.snapshot(), targetEntryId)
                                            .map(translations -> new Plan(entry, targetType, version, outcome.snapshot(), targetSchema,
                                                    existing.orElse(null), targetEntryId, translations, author));
                                })));
    }

    private Mono<Optional<ContentEntry>> findTargetEntry(String slug, UUID contentTypeId, UUID environmentId) {
        return contentRepository.getBySlug(slug, contentTypeId, environmentId)
                .map(Optional::of)
                .onErrorResume(RecordNotFoundException.class, e -> Mono.just(Optional.empty()));
    }

    private Mono<List<ContentTranslation>> resolveTranslations(ContentSnapshot snapshot, UUID translationGroupId) {
        return Flux.fromIterable(snapshot.getTranslations())
                .concatMap(translation -> resolveTranslation(translation, translationGroupId))
                .collectList();
    }

    private Mono<ContentTranslation> resolveTranslation(TranslationSnapshot translation, UUID translationGroupId) {
        String code = StringUtils.trimToEmpty(translation.getLocale());
        if (code.isEmpty()) {
            return Mono.error(new UnknownLocaleException(translation.getLocale()));
        }
        return localeRepository.getByCode(code)
                .onErrorMap(e -> !(e instanceof UnknownLocaleException), e -> new UnknownLocaleException(code, e))
                .map(locale -> ContentTranslation.builder()
                        .localeId(locale.getId())
                        .localeCode(locale.getCode())
                        .translationGroupId(translationGroupId)
                        .title(translation.getTitle())
                        .summary(translation.getSummary())
                        .content(translation.getContent())
                        .build());
    }

    // === Writes ===

    private record Written(ContentEntry entry, PromotionStatus status) {
    }

    private Mono<Written> write(Plan plan, Environment targetEnvironment, PromotionOptions options) {
        if (plan.existing() != null) {
            return replace(plan.existing(), plan.translations()).map(stored -> new Written(stored, PromotionStatus.UPDATED));
        }
        ContentEntry created = ContentEntry.builder()
                .id(plan.targetEntryId())
                .contentTypeId(plan.targetType().getId())
                .slug(plan.source().getSlug())
                .currentVersion(0)
                .status(ContentStatus.DRAFT)
                .environmentId(targetEnvironment.getId())
                .translations(plan.translations())
                .metadata(plan.snapshot().getMetadata().orElse(plan.source().getMetadata()))
                .createdBy(plan.actor())
                .updatedBy(plan.actor())
                .build();
        return contentRepository.create(created)
                .map(stored -> new Written(stored, PromotionStatus.CREATED))
                .onErrorResume(RecordConflictException.class, e -> {
                    if (options.getMode() != PromotionMode.MERGE) {
                        return Mono.error(new SlugExistsException(plan.source().getSlug(), targetEnvironment.getKey()));
                    }
                    log.warn("Content entry [{}] appeared in environment [{}] while promoting, merging instead",
                            plan.source().getSlug(), targetEnvironment.getKey());
                    return contentRepository.getBySlug(plan.source().getSlug(), plan.targetType().getId(), targetEnvironment.getId())
                            .flatMap(existing -> replace(existing, regroup(plan.translations(), existing.getId())))
                            .map(stored -> new Written(stored, PromotionStatus.UPDATED));
                });
    }

    private Mono<ContentEntry> replace(ContentEntry existing, List<ContentTranslation> translations) {
        return contentRepository.replaceTranslations(existing.getId(), translations)
                .map(stored -> existing.toBuilder().translations(stored).build());
    }

    private static List<ContentTranslation> regroup(List<ContentTranslation> translations, UUID translationGroupId) {
        return translations.stream()
                .map(translation -> translation.toBuilder().translationGroupId(translationGroupId).build())
                .toList();
    }

    private Mono<ContentEntry> finalizeVersions(Plan plan, ContentEntry target, PromotionOptions options) {
        Mono<List<ContentVersion>> carried = options.isIncludeVersions()
                ? contentRepository.listVersions(plan.source().getId())
                        .filter(version -> version.getVersion() != plan.sourceVersion().getVersion())
                        .sort(Comparator.comparingInt(ContentVersion::getVersion))
                        .collectList()
                : Mono.just(List.of());
        return Mono.zip(contentRepository.listVersions(target.getId()).collectList(), carried)
                .flatMap(tuple -> {
                    int next = tuple.getT1().stream().mapToInt(ContentVersion::getVersion).max().orElse(0) + 1;
                    Instant now = clock.instant();
                    List<ContentVersion> copies = new ArrayList<>();
                    for (ContentVersion version : tuple.getT2()) {
                        copies.add(ContentVersion.builder()
                                .contentEntryId(target.getId())
                                .version(next++)
                                .status(ContentStatus.DRAFT)
                                .snapshot(version.getSnapshot())
                                .createdBy(version.getCreatedBy())
                                .createdAt(now)
                                .build());
                    }
                    boolean publish = options.isPromoteAsPublished();
                    ContentVersion promoted = ContentVersion.builder()
                            .contentEntryId(target.getId())
                            .version(next)
                            .status(publish ? ContentStatus.PUBLISHED : ContentStatus.DRAFT)
                            .snapshot(plan.snapshot())
                            .createdBy(plan.actor())
                            .createdAt(now)
                            .publishedAt(publish ? now : null)
                            .publishedBy(publish ? plan.actor() : null)
                            .build();
                    copies.add(promoted);
                    return Flux.fromIterable(copies)
                            .concatMap(contentRepository::createVersion)
                            .last()
                            .flatMap(stored -> (publish ? archivePrevious(target, stored.getVersion()) : Mono.<Void>empty())
                                    .then(contentRepository.update(updatedEntry(plan, target, stored, publish, now))));
                })
                .doOnNext(stored -> log.info("Promoted content entry [{}] to environment [{}] at version [{}]",
                        stored.getSlug(), stored.getEnvironmentId(), stored.getCurrentVersion()));
    }

    private static ContentEntry updatedEntry(Plan plan, ContentEntry target, ContentVersion stored, boolean publish, Instant now) {
        ContentEntry.ContentEntryBuilder builder = target.toBuilder()
                .currentVersion(Math.max(target.getCurrentVersion(), stored.getVersion()))
                .metadata(plan.snapshot().getMetadata().orElse(target.getMetadata()))
                .updatedBy(plan.actor());
        if (publish) {
            builder.status(ContentStatus.PUBLISHED)
                    .publishedVersion(stored.getVersion())
                    .publishedAt(now)
                    .publishedBy(plan.actor());
        } else if (target.getPublishedVersion().isEmpty()) {
            builder.status(ContentStatus.DRAFT);
        }
        return builder.build();
    }

    private Mono<Void> archivePrevious(ContentEntry target, int publishedVersion) {
        return target.getPublishedVersion()
                .filter(previous -> previous != publishedVersion)
                .map(previous -> contentRepository.getVersion(target.getId(), previous)
                        .filter(ContentVersion::isPublished)
                        .flatMap(version -> contentRepository.updateVersion(version.toBuilder().status(ContentStatus.ARCHIVED).build()))
                        .then())
                .orElse(Mono.empty());
    }

    private Mono<Void> emitActivity(ContentEntry stored, String actor, Environment sourceEnvironment,
                                    Environment targetEnvironment, PromotionOptions options) {
        if (!config.isActivityEnabled()) {
            return Mono.empty();
        }
        return activityPublisher.publish(PromotionItemKind.CONTENT_ENTRY, stored.getId(), actor,
                sourceEnvironment, targetEnvironment, options);
    }

    private static PromotionItem item(Plan plan, PromotionStatus status, UUID targetId, boolean dryRun) {
        return PromotionItem.builder()
                .kind(PromotionItemKind.CONTENT_ENTRY)
                .sourceId(plan.source().getId())
                .targetId(targetId)
                .status(status)
                .message(dryRun ? "dry run" : null)
                .details(Map.of(
                        PromotionItem.DETAIL_SCHEMA_VERSION, plan.targetSchema().versionString(),
                        PromotionItem.DETAIL_DRY_RUN, dryRun))
                .build();
    }
}
