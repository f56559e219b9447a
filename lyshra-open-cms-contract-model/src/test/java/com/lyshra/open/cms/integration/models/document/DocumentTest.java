package com.lyshra.open.cms.integration.models.document;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentTest {

    @Test
    @DisplayName("should treat numbers with different scales as equal")
    void shouldCompareNumbersStructurally() {
        assertThat(Document.of(new BigDecimal("4.50"))).isEqualTo(Document.of(new BigDecimal("4.5")));
        assertThat(Document.of(new BigDecimal("1.0"))).isEqualTo(Document.of(1));
        assertThat(Document.of(new BigDecimal("0.00")).isIntegral()).isTrue();
        assertThat(Document.of(new BigDecimal("2.5")).isIntegral()).isFalse();
    }

    @Test
    @DisplayName("should build nested documents from plain Java values")
    void shouldConvertJavaValues() {
        Map<String, Object> source = new LinkedHashMap<>();
        source.put("title", "Hello");
        source.put("rating", 4);
        source.put("tags", List.of("a", "b"));
        source.put("author", Map.of("name", "Ada"));
        source.put("draft", null);

        Document.ObjectValue document = Document.object(source);

        assertThat(document.keys()).containsExactly("title", "rating", "tags", "author", "draft");
        assertThat(document.getString("title")).contains("Hello");
        assertThat(document.getArray("tags").get().strings()).containsExactly("a", "b");
        assertThat(document.getObject("author").flatMap(author -> author.getString("name"))).contains("Ada");
        assertThat(document.get("draft")).contains(Document.NULL);
        @SuppressWarnings("unchecked")
        Map<String, Object> java = (Map<String, Object>) document.toJava();
        assertThat(java)
                .containsEntry("title", "Hello")
                .containsEntry("rating", BigDecimal.valueOf(4))
                .containsEntry("tags", List.of("a", "b"))
                .containsEntry("draft", null);
    }

    @Test
    @DisplayName("should return new instances from with and without")
    void shouldBeImmutable() {
        Document.ObjectValue original = Document.ObjectValue.builder().put("a", 1).build();

        Document.ObjectValue added = original.with("b", "two");
        Document.ObjectValue removed = added.without("a");

        assertThat(original.keys()).containsExactly("a");
        assertThat(added.keys()).containsExactly("a", "b");
        assertThat(removed.keys()).containsExactly("b");
        assertThat(original.without("missing")).isSameAs(original);
    }

    @Test
    @DisplayName("should reject unsupported Java values")
    void shouldRejectUnsupportedValues() {
        assertThatThrownBy(() -> Document.from(new Object()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unsupported document value type");
    }

    @Test
    @DisplayName("should refuse to view a scalar as an object")
    void shouldFailOnWrongView() {
        assertThatThrownBy(() -> Document.of("text").asObject()).isInstanceOf(IllegalStateException.class);
        assertThat(Document.of(true).asText()).isEmpty();
    }
}
