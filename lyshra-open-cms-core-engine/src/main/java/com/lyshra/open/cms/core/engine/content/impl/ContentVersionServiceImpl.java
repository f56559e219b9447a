package com.lyshra.open.cms.core.engine.content.impl;

import com.lyshra.open.cms.core.engine.config.PromotionEngineConfig;
import com.lyshra.open.cms.core.engine.config.PromotionEngineDependencies;
import com.lyshra.open.cms.core.engine.content.SnapshotMigrator;
import com.lyshra.open.cms.core.engine.schema.NormalizedSchema;
import com.lyshra.open.cms.core.engine.schema.SchemaVersions;
import com.lyshra.open.cms.core.engine.validation.RequestValidator;
import com.lyshra.open.cms.core.exception.request.InvalidRequestException;
import com.lyshra.open.cms.integration.contract.content.IContentVersionService;
import com.lyshra.open.cms.integration.contract.repository.IContentRepository;
import com.lyshra.open.cms.integration.contract.repository.IContentTypeRepository;
import com.lyshra.open.cms.integration.enumerations.ContentStatus;
import com.lyshra.open.cms.integration.exception.RecordConflictException;
import com.lyshra.open.cms.integration.models.content.ContentEntry;
import com.lyshra.open.cms.integration.models.content.ContentSnapshot;
import com.lyshra.open.cms.integration.models.content.ContentVersion;
import com.lyshra.open.cms.integration.models.content.request.CreateDraftRequest;
import com.lyshra.open.cms.integration.models.content.request.PublishDraftRequest;
import com.lyshra.open.cms.integration.models.content.request.RestoreVersionRequest;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Version store for content entries.
 *
 * <p>Drafts are appended with the next version number. Publishing migrates payloads written
 * against an older schema, validates them and archives the previously published version.</p>
 */
@Slf4j
public class ContentVersionServiceImpl implements IContentVersionService {

    private static final String ENTRY = "ContentEntry";
    private static final String VERSION = "ContentVersion";

    private final PromotionEngineConfig config;
    private final IContentRepository contentRepository;
    private final IContentTypeRepository contentTypeRepository;
    private final SnapshotMigrator snapshotMigrator;
    private final Clock clock;

    public ContentVersionServiceImpl(PromotionEngineConfig config,
                                     PromotionEngineDependencies dependencies,
                                     SnapshotMigrator snapshotMigrator) {
        this.config = config;
        this.contentRepository = dependencies.getContentRepository();
        this.contentTypeRepository = dependencies.getContentTypeRepository();
        this.snapshotMigrator = snapshotMigrator;
        this.clock = dependencies.getClock();
    }

    @Override
    public Mono<ContentVersion> createDraft(CreateDraftRequest request) {
        return ensureEnabled()
                .then(RequestValidator.validate(request))
                .flatMap(valid -> contentRepository.getById(valid.getContentId()))
                .flatMap(entry -> {
                    if (request.getBaseVersion() != null && request.getBaseVersion() != entry.getCurrentVersion()) {
                        return Mono.error(new RecordConflictException(ENTRY, entry.getId(), "base version "
                                + request.getBaseVersion() + " does not match current version " + entry.getCurrentVersion()));
                    }
                    return contentTypeRepository.getById(entry.getContentTypeId())
                            .map(SchemaVersions::normalize)
                            .flatMap(schema -> appendVersion(entry, stampUntagged(request.getSnapshot(), schema),
                                    request.getCreatedBy()));
                })
                .doOnNext(version -> log.info("Created draft version [{}] of content entry [{}]",
                        version.getVersion(), version.getContentEntryId()));
    }

    @Override
    public Mono<ContentVersion> publishDraft(PublishDraftRequest request) {
        return ensureEnabled()
                .then(RequestValidator.validate(request))
                .flatMap(valid -> contentRepository.getById(valid.getContentId()))
                .flatMap(entry -> contentRepository.getVersion(entry.getId(), request.getVersion())
                        .flatMap(draft -> {
                            if (draft.getStatus() != ContentStatus.DRAFT) {
                                return Mono.error(new RecordConflictException(VERSION, entry.getId() + "#" + draft.getVersion(),
                                        "only draft versions can be published, found " + draft.getStatus()));
                            }
                            return contentTypeRepository.getById(entry.getContentTypeId())
                                    .flatMap(type -> {
                                        NormalizedSchema schema = SchemaVersions.normalize(type);
                                        SnapshotMigrator.Outcome outcome = snapshotMigrator.migrate(
                                                draft.getSnapshot(), type.getSlug(), schema.versionString(), schema, true);
                                        return writePublished(entry, draft, outcome, request.getPublishedBy());
                                    });
                        }));
    }

    @Override
    public Flux<ContentVersion> listVersions(UUID contentId) {
        return ensureEnabled()
                .then(contentRepository.getById(contentId))
                .flatMapMany(entry -> contentRepository.listVersions(entry.getId()));
    }

    @Override
    public Mono<ContentVersion> restoreVersion(RestoreVersionRequest request) {
        return ensureEnabled()
                .then(RequestValidator.validate(request))
                .flatMap(valid -> contentRepository.getById(valid.getContentId()))
                .flatMap(entry -> contentRepository.getVersion(entry.getId(), request.getVersion())
                        .flatMap(source -> appendVersion(entry, source.getSnapshot(), request.getRestoredBy())))
                .doOnNext(version -> log.info("Restored version [{}] of content entry [{}] as draft [{}]",
                        request.getVersion(), version.getContentEntryId(), version.getVersion()));
    }

    // === Internals ===

    private Mono<Void> ensureEnabled() {
        return config.isVersioningEnabled()
                ? Mono.empty()
                : Mono.error(new InvalidRequestException("Content versioning is disabled"));
    }

    private static ContentSnapshot stampUntagged(ContentSnapshot snapshot, NormalizedSchema schema) {
        return snapshot.mapPayloads(payload -> payload.isTagged() ? payload : payload.withVersion(schema.versionString()));
    }

    private Mono<ContentVersion> appendVersion(ContentEntry entry, ContentSnapshot snapshot, String author) {
        return contentRepository.listVersions(entry.getId()).collectList()
                .flatMap(existing -> {
                    int limit = config.getMaxVersionsPerEntry();
                    if (limit > 0 && existing.size() >= limit) {
                        return Mono.error(new RecordConflictException(ENTRY, entry.getId(),
                                "version limit of " + limit + " reached"));
                    }
                    ContentVersion draft = ContentVersion.builder()
                            .contentEntryId(entry.getId())
                            .version(nextVersion(existing))
                            .status(ContentStatus.DRAFT)
                            .snapshot(snapshot)
                            .createdBy(author)
                            .createdAt(clock.instant())
                            .build();
                    return contentRepository.createVersion(draft)
                            .flatMap(created -> contentRepository.update(entry.toBuilder()
                                            .currentVersion(Math.max(entry.getCurrentVersion(), created.getVersion()))
                                            .status(entry.getPublishedVersion().isPresent() ? entry.getStatus() : ContentStatus.DRAFT)
                                            .updatedBy(author)
                                            .build())
                                    .thenReturn(created));
                });
    }

    private Mono<ContentVersion> writePublished(ContentEntry entry, ContentVersion draft,
                                                SnapshotMigrator.Outcome outcome, String publishedBy) {
        Instant now = clock.instant();
        Mono<ContentVersion> published;
        if (outcome.migrated()) {
            published = contentRepository.listVersions(entry.getId()).collectList()
                    .flatMap(existing -> contentRepository.createVersion(ContentVersion.builder()
                            .contentEntryId(entry.getId())
                            .version(nextVersion(existing))
                            .status(ContentStatus.PUBLISHED)
                            .snapshot(outcome.snapshot())
                            .createdBy(publishedBy)
                            .createdAt(now)
                            .publishedAt(now)
                            .publishedBy(publishedBy)
                            .build()));
        } else {
            published = contentRepository.updateVersion(draft.toBuilder()
                    .status(ContentStatus.PUBLISHED)
                    .publishedAt(now)
                    .publishedBy(publishedBy)
                    .build());
        }
        return published.flatMap(version -> archivePrevious(entry, version.getVersion())
                .then(contentRepository.update(entry.toBuilder()
                        .currentVersion(Math.max(entry.getCurrentVersion(), version.getVersion()))
                        .publishedVersion(version.getVersion())
                        .status(ContentStatus.PUBLISHED)
                        .publishedAt(now)
                        .publishedBy(publishedBy)
                        .updatedBy(publishedBy)
                        .build()))
                .doOnNext(updated -> log.info("Published version [{}] of content entry [{}]{}",
                        version.getVersion(), entry.getSlug(), outcome.migrated() ? " after schema migration" : ""))
                .thenReturn(version));
    }

    private Mono<Void> archivePrevious(ContentEntry entry, int publishedVersion) {
        return entry.getPublishedVersion()
                .filter(previous -> previous != publishedVersion)
                .map(previous -> contentRepository.getVersion(entry.getId(), previous)
                        .filter(ContentVersion::isPublished)
                        .flatMap(version -> contentRepository.updateVersion(version.toBuilder()
                                .status(ContentStatus.ARCHIVED)
                                .build()))
                        .then())
                .orElse(Mono.empty());
    }

    static int nextVersion(List<ContentVersion> existing) {
        return existing.stream().mapToInt(ContentVersion::getVersion).max().orElse(0) + 1;
    }
}
