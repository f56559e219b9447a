package com.lyshra.open.cms.core.engine.promotion.impl;

import com.lyshra.open.cms.core.engine.AbstractPromotionTest;
import com.lyshra.open.cms.core.engine.document.DocumentCodec;
import com.lyshra.open.cms.core.engine.repository.impl.InMemoryBlockDefinitionService;
import com.lyshra.open.cms.core.engine.repository.impl.InMemoryContentRepository;
import com.lyshra.open.cms.core.exception.promotion.ContentTypeRequiredException;
import com.lyshra.open.cms.core.exception.promotion.ContentVersionRequiredException;
import com.lyshra.open.cms.core.exception.promotion.PromotionCancelledException;
import com.lyshra.open.cms.core.exception.promotion.SlugExistsException;
import com.lyshra.open.cms.core.exception.promotion.UnknownLocaleException;
import com.lyshra.open.cms.core.exception.schema.SchemaMigrationRequiredException;
import com.lyshra.open.cms.integration.contract.promotion.IPromotionService;
import com.lyshra.open.cms.integration.enumerations.ContentStatus;
import com.lyshra.open.cms.integration.enumerations.ContentTypeStatus;
import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import com.lyshra.open.cms.integration.enumerations.PromotionMode;
import com.lyshra.open.cms.integration.enumerations.PromotionStatus;
import com.lyshra.open.cms.integration.models.activity.ActivityEvent;
import com.lyshra.open.cms.integration.models.block.BlockDefinition;
import com.lyshra.open.cms.integration.models.content.ContentEntry;
import com.lyshra.open.cms.integration.models.content.ContentSnapshot;
import com.lyshra.open.cms.integration.models.content.ContentTranslation;
import com.lyshra.open.cms.integration.models.content.ContentType;
import com.lyshra.open.cms.integration.models.content.ContentVersion;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.promotion.PromoteContentEntryRequest;
import com.lyshra.open.cms.integration.models.promotion.PromotionCancellation;
import com.lyshra.open.cms.integration.models.promotion.PromotionItem;
import com.lyshra.open.cms.integration.models.promotion.PromotionOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for content entry promotion through {@link PromotionServiceImpl}.
 */
class PromotionServiceImplContentEntryTest extends AbstractPromotionTest {

    private static final String ARTICLE_V1 = "fixtures/article-v1.schema.json";
    private static final String ARTICLE_V2 = "fixtures/article-v2.schema.json";

    private IPromotionService promotionService;
    private ContentType stagingArticle;

    @BeforeEach
    void setUp() {
        promotionService = engine().getPromotionService();
        stagingArticle = createType(staging, "article", ARTICLE_V1, ContentTypeStatus.ACTIVE);
    }

    private PromoteContentEntryRequest toProduction(ContentEntry entry, PromotionOptions options) {
        return PromoteContentEntryRequest.builder()
                .contentEntryId(entry.getId())
                .targetEnvironment("production")
                .options(options)
                .actor("release-bot")
                .build();
    }

    private ContentEntry publishedEntry(String slug, Map<String, ?> content) {
        return createEntry(staging, stagingArticle, slug, snapshot("article@v1.0.0", content), ContentStatus.PUBLISHED);
    }

    private ContentEntry productionEntry(ContentType productionType, String slug) {
        return contents.getBySlug(slug, productionType.getId(), production.getId()).block();
    }

    private List<ContentVersion> versions(ContentEntry entry) {
        return contents.listVersions(entry.getId()).collectList().block();
    }

    // ========================================================================
    // BASIC PROMOTION
    // ========================================================================

    @Nested
    @DisplayName("Basic promotion")
    class BasicTests {

        @Test
        @DisplayName("should create the entry with the promoted version as a draft")
        void shouldCreateEntryWithDraftVersion() {
            // Given
            ContentType productionArticle = createType(production, "article", ARTICLE_V1, ContentTypeStatus.ACTIVE);
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));

            // When
            PromotionItem item = promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())).block();

            // Then
            assertEquals(PromotionItemKind.CONTENT_ENTRY, item.getKind());
            assertEquals(PromotionStatus.CREATED, item.getStatus());
            assertEquals(entry.getId(), item.getSourceId());
            assertEquals("article@v1.0.0", item.getDetails().get(PromotionItem.DETAIL_SCHEMA_VERSION));

            ContentEntry promoted = productionEntry(productionArticle, "hello");
            assertEquals(item.getTargetId(), promoted.getId());
            assertEquals(1, promoted.getCurrentVersion());
            assertEquals(ContentStatus.DRAFT, promoted.getStatus());
            assertTrue(promoted.getPublishedVersion().isEmpty());
            assertEquals("release-bot", promoted.getCreatedBy());

            ContentTranslation translation = promoted.getTranslations().get(0);
            assertEquals("en", translation.getLocaleCode());
            assertEquals(locales.getByCode("en").block().getId(), translation.getLocaleId());
            assertEquals(promoted.getId(), translation.getTranslationGroupId());
            assertEquals("Hello", translation.getTitle());

            List<ContentVersion> promotedVersions = versions(promoted);
            assertEquals(1, promotedVersions.size());
            assertEquals(ContentStatus.DRAFT, promotedVersions.get(0).getStatus());
            assertEquals("article@v1.0.0", promotedVersions.get(0).getSnapshot().recordedSchemaVersion().orElseThrow());
        }

        @Test
        @DisplayName("should carry every translation, locale-independent fields and metadata")
        void shouldCarryFullSnapshot() {
            // Given
            ContentType productionArticle = createType(production, "article", ARTICLE_V1, ContentTypeStatus.ACTIVE);
            ContentSnapshot snapshot = DocumentCodec.snapshotFromJson(readResource("fixtures/article-snapshot.json"));
            ContentEntry entry = createEntry(staging, stagingArticle, "hello-world", snapshot, ContentStatus.PUBLISHED);

            // When
            promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())).block();

            // Then
            ContentEntry promoted = productionEntry(productionArticle, "hello-world");
            assertEquals(List.of("en", "fr"), promoted.getTranslations().stream().map(ContentTranslation::getLocaleCode).toList());
            assertEquals("First post", promoted.getTranslations().get(0).getSummary());
            assertEquals(snapshot.getMetadata().orElseThrow(), promoted.getMetadata());

            ContentSnapshot stored = versions(promoted).get(0).getSnapshot();
            assertEquals(snapshot, stored);
        }

        @Test
        @DisplayName("should skip when source and target environment match")
        void shouldSkipSameEnvironment() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));
            long writesBefore = contents.getWriteCount();

            // When
            PromotionItem item = promotionService.promoteContentEntry(PromoteContentEntryRequest.builder()
                    .contentEntryId(entry.getId())
                    .targetEnvironmentId(staging.getId())
                    .build()).block();

            // Then
            assertEquals(PromotionStatus.SKIPPED, item.getStatus());
            assertEquals(writesBefore, contents.getWriteCount());
        }

        @Test
        @DisplayName("should emit a promote event for the target entry")
        void shouldEmitActivity() {
            // Given
            createType(production, "article", ARTICLE_V1, ContentTypeStatus.ACTIVE);
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));

            // When
            PromotionItem item = promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())).block();

            // Then
            assertEquals(1, activity.getEvents().size());
            assertEquals("content_entry", activity.getEvents().get(0).getObjectType());
            assertEquals(item.getTargetId().toString(), activity.getEvents().get(0).getObjectId());
        }
    }

    // ========================================================================
    // CONTENT TYPE RESOLUTION
    // ========================================================================

    @Nested
    @DisplayName("Content type resolution")
    class ContentTypeResolutionTests {

        @Test
        @DisplayName("should require the content type in the target")
        void shouldRequireContentTypeInTarget() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));

            // When / Then
            StepVerifier.create(promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())))
                    .expectError(ContentTypeRequiredException.class)
                    .verify();
            assertEquals(0, contentTypes.list(production.getId()).count().block());
        }

        @Test
        @DisplayName("should promote the content type first when asked to")
        void shouldAutoPromoteContentType() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));

            // When
            PromotionItem item = promotionService.promoteContentEntry(toProduction(entry,
                    PromotionOptions.builder().autoPromoteType(true).build())).block();

            // Then
            assertEquals(PromotionStatus.CREATED, item.getStatus());
            ContentType productionArticle = contentTypes.getBySlug("article", production.getId()).block();
            assertEquals("article@v1.0.0", productionArticle.getSchemaVersion());
            assertNotNull(productionEntry(productionArticle, "hello"));
            assertEquals(List.of("content_type", "content_entry"),
                    activity.getEvents().stream().map(ActivityEvent::getObjectType).toList());
        }

        @Test
        @DisplayName("should create referenced block definitions before writing the entry version")
        void shouldCreateBlocksBeforeEntryVersion() {
            // Given - production knows none of the blocks the landing page uses
            List<String> productionWrites = new CopyOnWriteArrayList<>();
            blocks = new RecordingBlockDefinitionService(productionWrites);
            contents = new RecordingContentRepository(productionWrites);
            promotionService = engine().getPromotionService();
            registerBlock(staging, "hero");
            registerBlock(staging, "quote");
            ContentType landing = createType(staging, "landing", Document.object(Map.of(
                    "type", "object",
                    "metadata", Map.of("block_availability", Map.of("allow", List.of("hero", "quote"))),
                    "properties", Map.of(
                            "title", Map.of("type", "string"),
                            "blocks", Map.of("type", "array", "items", Map.of("type", "object"))))),
                    ContentTypeStatus.ACTIVE);
            ContentEntry entry = createEntry(staging, landing, "welcome", snapshot("landing@v1.0.0", Map.of(
                    "title", "Welcome",
                    "blocks", List.of(
                            Map.of("type", "hero", "headline", "Hello"),
                            Map.of("type", "quote", "text", "Ship it")))), ContentStatus.PUBLISHED);
            productionWrites.clear();

            // When
            PromotionItem item = promotionService.promoteContentEntry(toProduction(entry,
                    PromotionOptions.builder().autoPromoteType(true).build())).block();

            // Then
            assertEquals(PromotionStatus.CREATED, item.getStatus());
            assertEquals(List.of("hero", "quote"),
                    blocks.listDefinitions("production").map(BlockDefinition::getSlug).collectList().block());
            assertEquals(List.of("block:hero", "block:quote", "version:1"), productionWrites);
        }
    }

    // ========================================================================
    // SCHEMA MIGRATION
    // ========================================================================

    @Nested
    @DisplayName("Schema migration")
    class MigrationTests {

        @BeforeEach
        void setUpV2Target() {
            createType(production, "article", ARTICLE_V2, ContentTypeStatus.ACTIVE);
        }

        @Test
        @DisplayName("should migrate payloads to the target schema version")
        void shouldMigratePayloads() {
            // Given
            migrations.register("article", "v1.0.0", "v2.0.0",
                    payload -> payload.without("title").with("headline", payload.get("title").orElse(Document.NULL)));
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello", "body", "Text"));

            // When
            PromotionItem item = promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())).block();

            // Then
            assertEquals("article@v2.0.0", item.getDetails().get(PromotionItem.DETAIL_SCHEMA_VERSION));
            ContentVersion promoted = contents.getVersion(item.getTargetId(), 1).block();
            Document.ObjectValue content = promoted.getSnapshot().getTranslations().get(0).getContent().payload();
            assertEquals("Hello", content.getString("headline").orElseThrow());
            assertFalse(content.has("title"));
            assertEquals("article@v2.0.0", promoted.getSnapshot().recordedSchemaVersion().orElseThrow());

            // the source stays untouched
            assertEquals("article@v1.0.0", contents.getVersion(entry.getId(), 1).block()
                    .getSnapshot().recordedSchemaVersion().orElseThrow());
        }

        @Test
        @DisplayName("should require a migration when migrating on promote is disabled")
        void shouldRequireMigrationWhenDisabled() {
            // Given
            migrations.register("article", "v1.0.0", "v2.0.0",
                    payload -> payload.without("title").with("headline", payload.get("title").orElse(Document.NULL)));
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));
            long writesBefore = contents.getWriteCount();

            // When / Then
            StepVerifier.create(promotionService.promoteContentEntry(toProduction(entry,
                            PromotionOptions.builder().migrateOnPromote(false).build())))
                    .expectError(SchemaMigrationRequiredException.class)
                    .verify();
            assertEquals(writesBefore, contents.getWriteCount());
        }

        @Test
        @DisplayName("should require a migration when none is registered")
        void shouldRequireRegisteredMigration() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));

            // When / Then
            StepVerifier.create(promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())))
                    .expectError(SchemaMigrationRequiredException.class)
                    .verify();
        }
    }

    // ========================================================================
    // VERSION SELECTION
    // ========================================================================

    @Nested
    @DisplayName("Version selection")
    class VersionSelectionTests {

        @BeforeEach
        void setUpTarget() {
            createType(production, "article", ARTICLE_V1, ContentTypeStatus.ACTIVE);
        }

        @Test
        @DisplayName("should refuse an entry without published version unless drafts are allowed")
        void shouldRefuseDraftOnlyEntry() {
            // Given
            ContentEntry entry = createEntry(staging, stagingArticle, "draft-only",
                    snapshot("article@v1.0.0", Map.of("title", "Draft")), ContentStatus.DRAFT);

            // When / Then
            StepVerifier.create(promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())))
                    .expectError(ContentVersionRequiredException.class)
                    .verify();

            PromotionItem allowed = promotionService.promoteContentEntry(toProduction(entry,
                    PromotionOptions.builder().allowDraft(true).build())).block();
            assertEquals(PromotionStatus.CREATED, allowed.getStatus());
        }

        @Test
        @DisplayName("should promote the latest draft when published content is not preferred")
        void shouldPromoteLatestDraftWhenNotPreferringPublished() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Published"));
            addVersion(entry, 2, ContentStatus.DRAFT, snapshot("article@v1.0.0", Map.of("title", "Work in progress")));

            // When
            PromotionItem item = promotionService.promoteContentEntry(toProduction(entry,
                    PromotionOptions.builder().allowDraft(true).preferPublished(false).build())).block();

            // Then
            ContentVersion promoted = contents.getVersion(item.getTargetId(), 1).block();
            assertEquals("Work in progress", promoted.getSnapshot().getTranslations().get(0).getTitle());
        }

        @Test
        @DisplayName("should copy other versions first so version numbers only grow")
        void shouldCopyOtherVersionsInOrder() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "v1"));
            addVersion(entry, 2, ContentStatus.DRAFT, snapshot("article@v1.0.0", Map.of("title", "v2")));
            addVersion(entry, 3, ContentStatus.DRAFT, snapshot("article@v1.0.0", Map.of("title", "v3")));
            PromotionOptions options = PromotionOptions.builder().includeVersions(true).mode(PromotionMode.MERGE).build();

            // When
            PromotionItem first = promotionService.promoteContentEntry(toProduction(entry, options)).block();
            PromotionItem second = promotionService.promoteContentEntry(toProduction(entry, options)).block();

            // Then
            assertEquals(PromotionStatus.UPDATED, second.getStatus());
            assertEquals(first.getTargetId(), second.getTargetId());
            List<ContentVersion> promoted = contents.listVersions(first.getTargetId()).collectList().block();
            assertEquals(List.of(1, 2, 3, 4, 5, 6), promoted.stream().map(ContentVersion::getVersion).toList());
            assertEquals(List.of("v2", "v3", "v1", "v2", "v3", "v1"),
                    promoted.stream().map(version -> version.getSnapshot().getTranslations().get(0).getTitle()).toList());
            assertEquals(6, contents.getById(first.getTargetId()).block().getCurrentVersion());
        }
    }

    // ========================================================================
    // EXISTING TARGET ENTRIES
    // ========================================================================

    @Nested
    @DisplayName("Existing target entries")
    class ExistingEntryTests {

        private ContentType productionArticle;

        @BeforeEach
        void setUpTarget() {
            productionArticle = createType(production, "article", ARTICLE_V1, ContentTypeStatus.ACTIVE);
        }

        @Test
        @DisplayName("should refuse an existing slug in strict mode")
        void shouldRefuseExistingSlugInStrictMode() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));
            promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())).block();

            // When / Then
            StepVerifier.create(promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())))
                    .expectErrorSatisfies(error -> {
                        SlugExistsException exists = assertInstanceOf(SlugExistsException.class, error);
                        assertEquals("hello", exists.getSlug());
                    })
                    .verify();
        }

        @Test
        @DisplayName("should merge into an existing entry and replace its translations")
        void shouldMergeIntoExistingEntry() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));
            PromotionItem first = promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())).block();
            addVersion(entry, 2, ContentStatus.DRAFT, snapshot("article@v1.0.0", Map.of("title", "Hello again")));

            // When
            PromotionItem merged = promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.builder()
                    .mode(PromotionMode.MERGE)
                    .allowDraft(true)
                    .preferPublished(false)
                    .build())).block();

            // Then
            assertEquals(PromotionStatus.UPDATED, merged.getStatus());
            assertEquals(first.getTargetId(), merged.getTargetId());
            ContentEntry target = productionEntry(productionArticle, "hello");
            assertEquals(2, target.getCurrentVersion());
            assertEquals(1, target.getTranslations().size());
            assertEquals("Hello again", target.getTranslations().get(0).getTitle());
        }

        @Test
        @DisplayName("should publish the promoted version and archive the previous one")
        void shouldPublishAndArchivePrevious() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));
            PromotionOptions publish = PromotionOptions.builder().promoteAsPublished(true).mode(PromotionMode.MERGE).build();
            PromotionItem first = promotionService.promoteContentEntry(toProduction(entry, publish)).block();

            // When
            promotionService.promoteContentEntry(toProduction(entry, publish)).block();

            // Then
            ContentEntry target = contents.getById(first.getTargetId()).block();
            assertEquals(ContentStatus.PUBLISHED, target.getStatus());
            assertEquals(2, target.getPublishedVersion().orElseThrow());
            assertEquals(NOW, target.getPublishedAt());
            assertEquals("release-bot", target.getPublishedBy());
            List<ContentVersion> promoted = versions(target);
            assertEquals(ContentStatus.ARCHIVED, promoted.get(0).getStatus());
            assertEquals(ContentStatus.PUBLISHED, promoted.get(1).getStatus());
        }
    }

    // ========================================================================
    // FAILURES WITHOUT WRITES
    // ========================================================================

    @Nested
    @DisplayName("Failures without writes")
    class NoWriteTests {

        @BeforeEach
        void setUpTarget() {
            createType(production, "article", ARTICLE_V1, ContentTypeStatus.ACTIVE);
        }

        @Test
        @DisplayName("should reject unknown locales before writing")
        void shouldRejectUnknownLocale() {
            // Given
            ContentSnapshot german = ContentSnapshot.builder()
                    .translations(List.of(translation("de", "article@v1.0.0", Map.of("title", "Hallo"))))
                    .build();
            ContentEntry entry = createEntry(staging, stagingArticle, "hallo", german, ContentStatus.PUBLISHED);
            long writesBefore = contents.getWriteCount();

            // When / Then
            StepVerifier.create(promotionService.promoteContentEntry(toProduction(entry, PromotionOptions.defaults())))
                    .expectErrorSatisfies(error -> {
                        UnknownLocaleException unknown = assertInstanceOf(UnknownLocaleException.class, error);
                        assertEquals("de", unknown.getLocale());
                    })
                    .verify();
            assertEquals(writesBefore, contents.getWriteCount());
        }

        @Test
        @DisplayName("should report a dry run without writing")
        void shouldReportDryRun() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));
            long writesBefore = contents.getWriteCount();

            // When
            PromotionItem item = promotionService.promoteContentEntry(toProduction(entry,
                    PromotionOptions.builder().dryRun(true).build())).block();

            // Then
            assertEquals(PromotionStatus.CREATED, item.getStatus());
            assertNull(item.getTargetId());
            assertTrue(item.isDryRun());
            assertEquals(writesBefore, contents.getWriteCount());
            assertTrue(activity.getEvents().isEmpty());
        }

        @Test
        @DisplayName("should stop when cancelled")
        void shouldStopWhenCancelled() {
            // Given
            ContentEntry entry = publishedEntry("hello", Map.of("title", "Hello"));
            PromotionCancellation cancellation = PromotionCancellation.create();
            cancellation.cancel();
            long writesBefore = contents.getWriteCount();

            // When / Then
            StepVerifier.create(promotionService.promoteContentEntry(PromoteContentEntryRequest.builder()
                            .contentEntryId(entry.getId())
                            .targetEnvironment("production")
                            .cancellation(cancellation)
                            .build()))
                    .expectError(PromotionCancelledException.class)
                    .verify();
            assertEquals(writesBefore, contents.getWriteCount());
        }
    }

    /**
     * Records block registrations in the production environment.
     */
    private final class RecordingBlockDefinitionService extends InMemoryBlockDefinitionService {

        private final List<String> writes;

        RecordingBlockDefinitionService(List<String> writes) {
            this.writes = writes;
        }

        @Override
        public Mono<BlockDefinition> registerDefinition(BlockDefinition definition) {
            return super.registerDefinition(definition)
                    .doOnNext(stored -> {
                        if (production.getKey().equals(stored.getEnvironmentKey())) {
                            writes.add("block:" + stored.getSlug());
                        }
                    });
        }
    }

    /**
     * Records version writes, in the order they reach the repository.
     */
    private static final class RecordingContentRepository extends InMemoryContentRepository {

        private final List<String> writes;

        RecordingContentRepository(List<String> writes) {
            this.writes = writes;
        }

        @Override
        public Mono<ContentVersion> createVersion(ContentVersion version) {
            return super.createVersion(version)
                    .doOnNext(stored -> writes.add("version:" + stored.getVersion()));
        }
    }
}
