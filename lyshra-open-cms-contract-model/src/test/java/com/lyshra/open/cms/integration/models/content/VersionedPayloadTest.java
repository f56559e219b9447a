package com.lyshra.open.cms.integration.models.content;

import com.lyshra.open.cms.integration.models.document.Document;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class VersionedPayloadTest {

    @Test
    @DisplayName("should split the embedded tag off a stored payload")
    void shouldSplitTag() {
        Document.ObjectValue stored = Document.object(Map.of("title", "Hello", "_schema", " article@v1.0.0 "));

        VersionedPayload payload = VersionedPayload.fromTagged(stored);

        assertThat(payload.schemaVersion()).isEqualTo("article@v1.0.0");
        assertThat(payload.payload().has(VersionedPayload.SCHEMA_TAG_KEY)).isFalse();
        assertThat(payload.toTagged().getString("_schema")).contains("article@v1.0.0");
    }

    @Test
    @DisplayName("should drop a tag that is not a string")
    void shouldDropNonStringTag() {
        VersionedPayload payload = VersionedPayload.fromTagged(Document.object(Map.of("_schema", 3, "title", "x")));

        assertThat(payload.isTagged()).isFalse();
        assertThat(payload.payload().keys()).containsExactly("title");
    }

    @Test
    @DisplayName("should treat a blank version as untagged")
    void shouldTreatBlankAsUntagged() {
        VersionedPayload payload = VersionedPayload.of("  ", Document.ObjectValue.empty());

        assertThat(payload.version()).isEmpty();
        assertThat(payload.toTagged()).isEqualTo(Document.ObjectValue.empty());
    }

    @Test
    @DisplayName("should reject the reserved key in a bare payload and discard it from transform output")
    void shouldGuardReservedKey() {
        Document.ObjectValue tagged = Document.object(Map.of("_schema", "x@v1.0.0"));

        assertThatThrownBy(() -> VersionedPayload.untagged(tagged)).isInstanceOf(IllegalArgumentException.class);
        assertThat(VersionedPayload.of("article@v2.0.0", Document.ObjectValue.empty()).withPayload(tagged).payload().isEmpty())
                .isTrue();
    }
}
