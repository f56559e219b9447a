package com.lyshra.open.cms.core.engine.schema.impl;

import com.lyshra.open.cms.core.engine.schema.SchemaMetadataCodec;
import com.lyshra.open.cms.core.engine.schema.SchemaVersions;
import com.lyshra.open.cms.core.exception.schema.SchemaInvalidException;
import com.lyshra.open.cms.integration.contract.schema.ISchemaPayloadValidator;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.ValidationIssue;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Validates payloads against the JSON Schema subset used by content types.
 *
 * <p>Supported keywords: {@code type}, {@code required}, {@code properties}, {@code items},
 * {@code enum}, {@code additionalProperties: false}, {@code minLength}, {@code maxLength},
 * {@code minimum} and {@code maximum}. The root {@code metadata} object and {@code x-*}
 * extension keys describe the schema itself and are not treated as payload fields.</p>
 */
@Slf4j
public class SchemaPayloadValidatorImpl implements ISchemaPayloadValidator {

    private static final Set<String> KNOWN_TYPES = Set.of("object", "array", "string", "number", "integer", "boolean", "null");

    private SchemaPayloadValidatorImpl() {
    }

    private static final class SingletonHelper {
        private static final SchemaPayloadValidatorImpl INSTANCE = new SchemaPayloadValidatorImpl();
    }

    public static SchemaPayloadValidatorImpl getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public List<ValidationIssue> validate(Document.ObjectValue schema, Document.ObjectValue payload) {
        List<ValidationIssue> issues = new ArrayList<>();
        if (schema == null) {
            return issues;
        }
        validateNode(schema.without(SchemaMetadataCodec.METADATA_KEY), payload == null ? Document.ObjectValue.empty() : payload, "", issues);
        return issues;
    }

    /**
     * Validates and throws when any issue is found.
     *
     * @throws SchemaInvalidException carrying every issue
     */
    public void validateOrThrow(Document.ObjectValue schema, Document.ObjectValue payload) {
        List<ValidationIssue> issues = validate(schema, payload);
        if (!issues.isEmpty()) {
            String version = SchemaVersions.readVersionTag(schema).orElse("unversioned");
            log.debug("Payload rejected by schema [{}]: {}", version, issues);
            throw new SchemaInvalidException(version, issues);
        }
    }

    private void validateNode(Document.ObjectValue schema, Document value, String location, List<ValidationIssue> issues) {
        List<String> types = declaredTypes(schema);
        if (!types.isEmpty() && types.stream().noneMatch(type -> matchesType(type, value))) {
            issues.add(issue(location, "expected " + String.join(" or ", types) + " but found " + describe(value)));
            return;
        }

        schema.getArray("enum").ifPresent(allowed -> {
            if (!allowed.items().contains(value)) {
                issues.add(issue(location, "value " + value + " is not one of " + allowed));
            }
        });

        if (value instanceof Document.ObjectValue object) {
            validateObject(schema, object, location, issues);
        } else if (value instanceof Document.ArrayValue array) {
            schema.getObject("items").ifPresent(items -> {
                for (int i = 0; i < array.size(); i++) {
                    validateNode(items, array.get(i), location + "/" + i, issues);
                }
            });
        } else if (value instanceof Document.StringValue string) {
            int length = string.value().codePointCount(0, string.value().length());
            readInt(schema, "minLength").filter(min -> length < min)
                    .ifPresent(min -> issues.add(issue(location, "length " + length + " is below minLength " + min)));
            readInt(schema, "maxLength").filter(max -> length > max)
                    .ifPresent(max -> issues.add(issue(location, "length " + length + " exceeds maxLength " + max)));
        } else if (value instanceof Document.NumberValue number) {
            readNumber(schema, "minimum").filter(min -> number.value().compareTo(min) < 0)
                    .ifPresent(min -> issues.add(issue(location, number + " is below minimum " + min.toPlainString())));
            readNumber(schema, "maximum").filter(max -> number.value().compareTo(max) > 0)
                    .ifPresent(max -> issues.add(issue(location, number + " exceeds maximum " + max.toPlainString())));
        }
    }

    private void validateObject(Document.ObjectValue schema, Document.ObjectValue object, String location, List<ValidationIssue> issues) {
        schema.getArray("required").ifPresent(required -> {
            for (String name : required.strings()) {
                if (!object.has(name) || object.get(name).filter(Document::isNull).isPresent()) {
                    issues.add(issue(location + "/" + name, "required property is missing"));
                }
            }
        });
        Document.ObjectValue properties = schema.getObject("properties").orElse(Document.ObjectValue.empty());
        boolean closed = schema.get("additionalProperties").filter(Document.of(false)::equals).isPresent();
        for (String name : object.keys()) {
            Document child = object.get(name).orElse(Document.NULL);
            Document.ObjectValue childSchema = properties.getObject(name).orElse(null);
            if (childSchema != null) {
                if (!child.isNull() || !isOptional(schema, name)) {
                    validateNode(childSchema, child, location + "/" + name, issues);
                }
            } else if (closed && !name.startsWith("x-")) {
                issues.add(issue(location + "/" + name, "additional property is not allowed"));
            }
        }
    }

    private static boolean isOptional(Document.ObjectValue schema, String name) {
        return schema.getArray("required").map(required -> !required.strings().contains(name)).orElse(true);
    }

    private static List<String> declaredTypes(Document.ObjectValue schema) {
        List<String> types = new ArrayList<>();
        schema.get("type").ifPresent(type -> {
            if (type.isArray()) {
                type.asArray().strings().forEach(name -> types.add(name.trim().toLowerCase(Locale.ROOT)));
            } else {
                type.asText().ifPresent(name -> types.add(name.trim().toLowerCase(Locale.ROOT)));
            }
        });
        return types;
    }

    private static boolean matchesType(String type, Document value) {
        if (!KNOWN_TYPES.contains(type)) {
            return true;
        }
        switch (type) {
            case "object":
                return value.isObject();
            case "array":
                return value.isArray();
            case "string":
                return value.isString();
            case "number":
                return value.kind() == Document.Kind.NUMBER;
            case "integer":
                return value instanceof Document.NumberValue number && number.isIntegral();
            case "boolean":
                return value.kind() == Document.Kind.BOOLEAN;
            default:
                return value.isNull();
        }
    }

    private static String describe(Document value) {
        return value.kind().name().toLowerCase(Locale.ROOT);
    }

    private static Optional<Integer> readInt(Document.ObjectValue schema, String keyword) {
        return readNumber(schema, keyword).map(BigDecimal::intValue);
    }

    private static Optional<BigDecimal> readNumber(Document.ObjectValue schema, String keyword) {
        return schema.get(keyword)
                .filter(value -> value instanceof Document.NumberValue)
                .map(value -> ((Document.NumberValue) value).value());
    }

    private static ValidationIssue issue(String location, String message) {
        return ValidationIssue.builder().location(location.isEmpty() ? "/" : location).message(message).build();
    }
}
