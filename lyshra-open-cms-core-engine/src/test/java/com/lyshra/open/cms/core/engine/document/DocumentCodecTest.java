package com.lyshra.open.cms.core.engine.document;

import com.lyshra.open.cms.core.engine.AbstractPromotionTest;
import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.models.content.ContentSnapshot;
import com.lyshra.open.cms.integration.models.content.TranslationSnapshot;
import com.lyshra.open.cms.integration.models.document.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DocumentCodecTest extends AbstractPromotionTest {

    // ========================================================================
    // DOCUMENTS
    // ========================================================================

    @Nested
    @DisplayName("Documents")
    class DocumentTests {

        @Test
        @DisplayName("should keep decimal precision and key order")
        void shouldParseDecimals() {
            Document.ObjectValue document = DocumentCodec.parseObject("{\"b\": 0.1, \"a\": 12345678901234567890.5}");

            assertEquals(List.of("b", "a"), List.copyOf(document.keys()));
            assertEquals(Document.of(new BigDecimal("12345678901234567890.5")), document.get("a").orElseThrow());
            assertEquals("{\"b\":0.1,\"a\":12345678901234567890.5}", DocumentCodec.toJson(document));
        }

        @Test
        @DisplayName("should write large and small numbers in plain notation")
        void shouldWritePlainNumbers() {
            Document.ObjectValue document = Document.ObjectValue.builder()
                    .put("big", Document.of(new BigDecimal("1E+3")))
                    .put("flag", true)
                    .put("none", Document.NULL)
                    .build();

            assertEquals("{\"big\":1000,\"flag\":true,\"none\":null}", DocumentCodec.toJson(document));
        }

        @Test
        @DisplayName("should reject malformed JSON and non-object roots")
        void shouldRejectInvalidInput() {
            LyshraOpenCmsException malformed = assertThrows(LyshraOpenCmsException.class,
                    () -> DocumentCodec.parse("{\"title\": "));
            assertEquals(LyshraOpenCmsErrorKind.INVALID_FORMAT, malformed.getErrorKind());

            LyshraOpenCmsException notObject = assertThrows(LyshraOpenCmsException.class,
                    () -> DocumentCodec.parseObject("[1, 2]"));
            assertTrue(notObject.getMessage().contains("ARRAY"));
        }
    }

    // ========================================================================
    // SNAPSHOTS
    // ========================================================================

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("should split version tags off every payload of a stored snapshot")
        void shouldReadStoredSnapshot() {
            // When
            ContentSnapshot snapshot = DocumentCodec.snapshotFromJson(readResource("fixtures/article-snapshot.json"));

            // Then
            assertEquals(2, snapshot.getTranslations().size());
            TranslationSnapshot english = snapshot.getTranslations().get(0);
            assertEquals("en", english.getLocale());
            assertEquals("First post", english.getSummary());
            assertEquals("article@v1.0.0", english.getContent().schemaVersion());
            assertFalse(english.getContent().payload().has("_schema"));
            assertNull(snapshot.getTranslations().get(1).getSummary());

            assertEquals(Document.of(new BigDecimal("4.5")),
                    snapshot.getFields().orElseThrow().payload().get("rating").orElseThrow());
            assertEquals(Document.of(false), snapshot.getMetadata().orElseThrow()
                    .getObject("seo").orElseThrow().get("noindex").orElseThrow());
        }

        @Test
        @DisplayName("should write snapshots back in stored form")
        void shouldWriteStoredForm() {
            ContentSnapshot snapshot = DocumentCodec.snapshotFromJson(readResource("fixtures/article-snapshot.json"));

            Document.ObjectValue stored = DocumentCodec.snapshotToDocument(snapshot);

            Document.ObjectValue french = stored.getArray("translations").orElseThrow().get(1).asObject();
            assertEquals("article@v1.0.0", french.getObject("content").orElseThrow().getString("_schema").orElseThrow());
            assertFalse(french.has("summary"));
            assertEquals(snapshot, DocumentCodec.snapshotFromDocument(stored));
        }
    }
}
