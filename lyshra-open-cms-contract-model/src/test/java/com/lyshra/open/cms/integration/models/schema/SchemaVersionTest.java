package com.lyshra.open.cms.integration.models.schema;

import com.lyshra.open.cms.integration.enumerations.SchemaChangeLevel;
import com.lyshra.open.cms.integration.exception.InvalidSchemaVersionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SchemaVersionTest {

    // ========================================================================
    // PARSING
    // ========================================================================

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("should parse slug and numbers from a canonical tag")
        void shouldParseCanonicalTag() {
            SchemaVersion version = SchemaVersion.parse("article@v1.2.3");

            assertThat(version.getSlug()).isEqualTo("article");
            assertThat(version.getMajor()).isEqualTo(1);
            assertThat(version.getMinor()).isEqualTo(2);
            assertThat(version.getPatch()).isEqualTo(3);
            assertThat(version.toString()).isEqualTo("article@v1.2.3");
        }

        @Test
        @DisplayName("should accept a missing v prefix and surrounding whitespace")
        void shouldAcceptLenientForms() {
            assertThat(SchemaVersion.parse(" article@1.0.0 ").toString()).isEqualTo("article@v1.0.0");
            assertThat(SchemaVersion.parse("v2.0.1").hasSlug()).isFalse();
            assertThat(SchemaVersion.parse("v2.0.1").toString()).isEqualTo("v2.0.1");
        }

        @Test
        @DisplayName("should reject malformed tags")
        void shouldRejectMalformedTags() {
            assertThatThrownBy(() -> SchemaVersion.parse("")).isInstanceOf(InvalidSchemaVersionException.class);
            assertThatThrownBy(() -> SchemaVersion.parse("article@v1.2")).isInstanceOf(InvalidSchemaVersionException.class);
            assertThatThrownBy(() -> SchemaVersion.parse("@v1.0.0")).isInstanceOf(InvalidSchemaVersionException.class);
            assertThatThrownBy(() -> SchemaVersion.parse("a@b@v1.0.0")).isInstanceOf(InvalidSchemaVersionException.class);
            assertThatThrownBy(() -> SchemaVersion.parse("article@v01.0.0")).isInstanceOf(InvalidSchemaVersionException.class);
        }
    }

    // ========================================================================
    // ORDERING
    // ========================================================================

    @Nested
    @DisplayName("Ordering")
    class OrderingTests {

        @Test
        @DisplayName("should compare numerically rather than lexically")
        void shouldCompareNumerically() {
            assertThat(SchemaVersion.compareStrings("article@v1.10.0", "article@v1.9.0")).isEqualTo(1);
            assertThat(SchemaVersion.compareStrings("article@v1.9.0", "article@v1.10.0")).isEqualTo(-1);
        }

        @Test
        @DisplayName("should ignore the slug when comparing")
        void shouldIgnoreSlug() {
            assertThat(SchemaVersion.parse("article@v1.0.0").sameNumbers(SchemaVersion.parse("post@v1.0.0"))).isTrue();
        }

        @Test
        @DisplayName("should order versions antisymmetrically and transitively")
        void shouldBeAntisymmetricAndTransitive() {
            List<SchemaVersion> versions = Stream.of(
                            "article@v0.0.1", "article@v0.1.0", "article@v1.0.0", "post@v1.0.0",
                            "article@v1.0.10", "article@v1.2.0", "article@v1.10.0", "v2.0.0", "article@v10.0.0")
                    .map(SchemaVersion::parse)
                    .toList();

            for (SchemaVersion a : versions) {
                for (SchemaVersion b : versions) {
                    assertThat(Integer.signum(a.compareTo(b)))
                            .as("%s vs %s", a, b)
                            .isEqualTo(-Integer.signum(b.compareTo(a)));
                    assertThat(SchemaVersion.compareStrings(a.toString(), b.toString()))
                            .as("strings %s vs %s", a, b)
                            .isEqualTo(-SchemaVersion.compareStrings(b.toString(), a.toString()));
                    for (SchemaVersion c : versions) {
                        if (a.compareTo(b) <= 0 && b.compareTo(c) <= 0) {
                            assertThat(a.compareTo(c)).as("%s <= %s <= %s", a, b, c).isLessThanOrEqualTo(0);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("should keep the slug in equality even though ordering ignores it")
        void shouldKeepSlugInEquality() {
            SchemaVersion article = SchemaVersion.parse("article@v1.0.0");
            SchemaVersion post = SchemaVersion.parse("post@v1.0.0");

            assertThat(article.compareTo(post)).isZero();
            assertThat(article).isNotEqualTo(post);
            assertThat(article).isEqualTo(SchemaVersion.parse("article@1.0.0"));
        }

        @Test
        @DisplayName("should sort empty before anything and fall back to lexical order for legacy tags")
        void shouldHandleEmptyAndLegacy() {
            assertThat(SchemaVersion.compareStrings(null, "article@v1.0.0")).isEqualTo(-1);
            assertThat(SchemaVersion.compareStrings("article@v1.0.0", " ")).isEqualTo(1);
            assertThat(SchemaVersion.compareStrings("legacy-b", "legacy-a")).isEqualTo(1);
        }
    }

    @Test
    @DisplayName("should bump the component matching the change level")
    void shouldBump() {
        SchemaVersion version = SchemaVersion.parse("article@v1.2.3");

        assertThat(version.bump(SchemaChangeLevel.MAJOR).toString()).isEqualTo("article@v2.0.0");
        assertThat(version.bump(SchemaChangeLevel.MINOR).toString()).isEqualTo("article@v1.3.0");
        assertThat(version.bump(SchemaChangeLevel.PATCH).toString()).isEqualTo("article@v1.2.4");
        assertThat(version.bump(SchemaChangeLevel.NONE)).isSameAs(version);
    }

    @Test
    @DisplayName("should default untagged schemas to v1.0.0")
    void shouldProvideDefault() {
        assertThat(SchemaVersion.defaultFor("hero").toString()).isEqualTo("hero@v1.0.0");
    }
}
