package com.lyshra.open.cms.core.engine.schema;

import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.BlockAvailability;
import com.lyshra.open.cms.integration.models.schema.SchemaMetadata;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaMetadataCodecTest {

    @Test
    @DisplayName("should read block availability given as a plain list")
    void shouldReadListAvailability() {
        Document.ObjectValue schema = Document.object(Map.of("metadata", Map.of("block_availability", List.of("hero", "quote"))));

        SchemaMetadata metadata = SchemaMetadataCodec.extract(schema);

        assertEquals(List.of("hero", "quote"), metadata.getBlockAvailability().getAllow());
        assertTrue(metadata.getBlockAvailability().getDeny().isEmpty());
    }

    @Test
    @DisplayName("should accept the allowed and denied aliases")
    void shouldReadAliases() {
        Document.ObjectValue schema = Document.object(Map.of("metadata", Map.of(
                "block_availability", Map.of("allowed", List.of("hero"), "denied", List.of("gallery")),
                "ui_overlays", "compact")));

        SchemaMetadata metadata = SchemaMetadataCodec.extract(schema);

        assertEquals(List.of("hero"), metadata.getBlockAvailability().getAllow());
        assertEquals(List.of("gallery"), metadata.getBlockAvailability().getDeny());
        assertEquals(List.of("compact"), metadata.getUiOverlays());
    }

    @Test
    @DisplayName("should return empty metadata for blank values or a missing object")
    void shouldTolerateMissingMetadata() {
        assertEquals(SchemaMetadata.empty(), SchemaMetadataCodec.extract(null));
        assertEquals(SchemaMetadata.empty(), SchemaMetadataCodec.extract(Document.object(Map.of("type", "object"))));
        assertNull(SchemaMetadataCodec.extract(Document.object(Map.of("metadata", Map.of("schema_version", "  "))))
                .getSchemaVersion());
    }

    @Test
    @DisplayName("should write availability in allow and deny form and keep unrelated keys")
    void shouldApplyMetadata() {
        Document.ObjectValue schema = Document.object(Map.of(
                "type", "object",
                "metadata", Map.of("owner", "editorial")));
        SchemaMetadata metadata = SchemaMetadata.builder()
                .slug("article")
                .schemaVersion("article@v1.0.0")
                .blockAvailability(new BlockAvailability(List.of("hero"), List.of()))
                .build();

        Document.ObjectValue written = SchemaMetadataCodec.apply(schema, metadata);

        Document.ObjectValue meta = written.getObject("metadata").orElseThrow();
        assertEquals("editorial", meta.getString("owner").orElseThrow());
        assertEquals("article@v1.0.0", meta.getString("schema_version").orElseThrow());
        assertEquals(List.of("hero"), meta.getObject("block_availability").orElseThrow()
                .getArray("allow").orElseThrow().strings());
        assertFalse(meta.getObject("block_availability").orElseThrow().has("deny"));
        assertEquals(schema.get("type"), written.get("type"));
    }

    @Test
    @DisplayName("should strip version metadata and drop an emptied metadata object")
    void shouldStripVersionMetadata() {
        Document.ObjectValue versionOnly = Document.object(Map.of(
                "type", "object",
                "metadata", Map.of("slug", "article", "schema_version", "article@v1.0.0")));
        Document.ObjectValue withOverlays = versionOnly.with("metadata",
                versionOnly.getObject("metadata").orElseThrow().with("ui_overlays", Document.arrayOfStrings(List.of("wide"))));

        assertFalse(SchemaMetadataCodec.stripVersionMetadata(versionOnly).has("metadata"));
        Document.ObjectValue stripped = SchemaMetadataCodec.stripVersionMetadata(withOverlays);
        assertEquals(List.of("ui_overlays"), List.copyOf(stripped.getObject("metadata").orElseThrow().keys()));
    }
}
