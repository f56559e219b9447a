package com.lyshra.open.cms.core.engine.schema.impl;

import com.lyshra.open.cms.core.engine.document.DocumentCodec;
import com.lyshra.open.cms.core.exception.schema.SchemaInvalidException;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.ValidationIssue;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchemaPayloadValidatorImplTest {

    private final SchemaPayloadValidatorImpl validator = SchemaPayloadValidatorImpl.getInstance();

    private final Document.ObjectValue schema = DocumentCodec.parseObject("""
            {
              "type": "object",
              "metadata": { "schema_version": "article@v2.0.0" },
              "properties": {
                "headline": { "type": "string", "minLength": 1, "maxLength": 10 },
                "rating": { "type": "integer", "minimum": 1, "maximum": 5 },
                "status": { "enum": ["draft", "live"] },
                "tags": { "type": "array", "items": { "type": "string" } },
                "subtitle": { "type": "string" }
              },
              "required": ["headline"],
              "additionalProperties": false
            }
            """);

    private static List<String> locations(List<ValidationIssue> issues) {
        return issues.stream().map(ValidationIssue::getLocation).toList();
    }

    @Test
    @DisplayName("should accept a valid payload with null optional fields and extension keys")
    void shouldAcceptValidPayload() {
        Document.ObjectValue payload = Document.ObjectValue.builder()
                .put("headline", "Hello")
                .put("rating", 4)
                .put("tags", Document.arrayOfStrings(List.of("a")))
                .put("subtitle", Document.NULL)
                .put("x-editor", "classic")
                .build();

        assertTrue(validator.validate(schema, payload).isEmpty());
    }

    @Test
    @DisplayName("should report a missing required field at its location")
    void shouldReportMissingRequired() {
        List<ValidationIssue> issues = validator.validate(schema, Document.ObjectValue.empty());

        assertEquals(List.of("/headline"), locations(issues));
    }

    @Test
    @DisplayName("should report every violation in one pass")
    void shouldReportAllViolations() {
        Document.ObjectValue payload = Document.object(Map.of(
                "headline", "A headline that is too long",
                "rating", new BigDecimal("4.5"),
                "status", "archived",
                "tags", List.of("ok", 3),
                "extra", true));

        List<ValidationIssue> issues = validator.validate(schema, payload);

        assertTrue(locations(issues).containsAll(List.of("/headline", "/rating", "/status", "/tags/1", "/extra")),
                () -> "Unexpected issues " + issues);
        assertEquals(5, issues.size());
    }

    @Test
    @DisplayName("should check numeric bounds")
    void shouldCheckBounds() {
        List<ValidationIssue> issues = validator.validate(schema, Document.object(Map.of("headline", "Hi", "rating", 9)));

        assertEquals(1, issues.size());
        assertTrue(issues.get(0).getMessage().contains("exceeds maximum 5"));
    }

    @Test
    @DisplayName("should throw with the schema version and all issues")
    void shouldThrowWithVersion() {
        SchemaInvalidException exception = assertThrows(SchemaInvalidException.class,
                () -> validator.validateOrThrow(schema, Document.object(Map.of("extra", 1))));

        assertEquals("article@v2.0.0", exception.getSchemaVersion());
        assertEquals(2, exception.getIssues().size());
    }

    @Test
    @DisplayName("should accept anything when no schema is given")
    void shouldAcceptWithoutSchema() {
        assertTrue(validator.validate(null, Document.object(Map.of("any", 1))).isEmpty());
    }
}
