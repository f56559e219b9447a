package com.lyshra.open.cms.core.engine.schema.impl;

import com.lyshra.open.cms.core.engine.schema.SchemaMetadataCodec;
import com.lyshra.open.cms.integration.contract.schema.ISchemaCompatibilityChecker;
import com.lyshra.open.cms.integration.enumerations.SchemaChangeLevel;
import com.lyshra.open.cms.integration.enumerations.SchemaChangeType;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.CompatibilityReport;
import com.lyshra.open.cms.integration.models.schema.SchemaChange;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Field-level schema diff.
 *
 * <p>Fields are collected with dotted paths through {@code properties}, {@code items} ({@code []}
 * suffix), {@code oneOf}/{@code allOf} (indexed) and {@code $defs}. Classification:</p>
 * <ul>
 *   <li>added optional field: compatible; added required field: breaking</li>
 *   <li>removed optional field: compatible; removed required field: breaking</li>
 *   <li>type narrowed or replaced: breaking; type widened to a superset: compatible</li>
 *   <li>optional made required: breaking; required made optional: compatible</li>
 * </ul>
 * <p>Schemas in the legacy {@code fields} list form are converted to JSON Schema first.</p>
 */
@Slf4j
public class SchemaCompatibilityCheckerImpl implements ISchemaCompatibilityChecker {

    private SchemaCompatibilityCheckerImpl() {
    }

    private static final class SingletonHelper {
        private static final SchemaCompatibilityCheckerImpl INSTANCE = new SchemaCompatibilityCheckerImpl();
    }

    public static ISchemaCompatibilityChecker getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public CompatibilityReport check(Document.ObjectValue oldSchema, Document.ObjectValue newSchema) {
        Map<String, FieldDescriptor> oldFields = collectFields(normalizeLegacyFields(oldSchema));
        Map<String, FieldDescriptor> newFields = collectFields(normalizeLegacyFields(newSchema));

        List<SchemaChange> changes = new ArrayList<>();
        List<String> additions = new ArrayList<>();
        List<String> removals = new ArrayList<>();

        for (Map.Entry<String, FieldDescriptor> entry : oldFields.entrySet()) {
            String path = entry.getKey();
            FieldDescriptor oldField = entry.getValue();
            FieldDescriptor newField = newFields.get(path);
            if (newField == null) {
                removals.add(path);
                changes.add(oldField.required()
                        ? SchemaChange.breaking(SchemaChangeType.FIELD_REMOVED, path, "required field removed")
                        : SchemaChange.compatible(SchemaChangeType.FIELD_REMOVED, path, "optional field removed"));
                continue;
            }
            TypeChange typeChange = compareTypes(oldField.type(), newField.type());
            if (typeChange == TypeChange.BREAKING) {
                changes.add(SchemaChange.breaking(SchemaChangeType.TYPE_CHANGED, path, "field type changed"));
            } else if (typeChange == TypeChange.WIDENED) {
                changes.add(SchemaChange.compatible(SchemaChangeType.TYPE_WIDENED, path, "field type widened"));
            }
            if (!oldField.required() && newField.required()) {
                changes.add(SchemaChange.breaking(SchemaChangeType.REQUIRED_ADDED, path, "existing field made required"));
            } else if (oldField.required() && !newField.required()) {
                changes.add(SchemaChange.compatible(SchemaChangeType.REQUIRED_RELAXED, path, "required field made optional"));
            }
        }

        for (Map.Entry<String, FieldDescriptor> entry : newFields.entrySet()) {
            String path = entry.getKey();
            if (oldFields.containsKey(path)) {
                continue;
            }
            additions.add(path);
            changes.add(entry.getValue().required()
                    ? SchemaChange.breaking(SchemaChangeType.REQUIRED_ADDED, path, "required field added")
                    : SchemaChange.compatible(SchemaChangeType.FIELD_ADDED, path, "optional field added"));
        }

        SchemaChangeLevel level = SchemaChangeLevel.NONE;
        for (SchemaChange change : changes) {
            level = level.max(change.isBreaking() ? SchemaChangeLevel.MAJOR : SchemaChangeLevel.MINOR);
        }
        if (level == SchemaChangeLevel.NONE && !Objects.equals(
                SchemaMetadataCodec.stripVersionMetadata(oldSchema),
                SchemaMetadataCodec.stripVersionMetadata(newSchema))) {
            level = SchemaChangeLevel.PATCH;
        }

        CompatibilityReport report = CompatibilityReport.builder()
                .additions(List.copyOf(additions))
                .removals(List.copyOf(removals))
                .changes(List.copyOf(changes))
                .changeLevel(level)
                .build();
        log.debug("Schema comparison: level [{}], additions {}, removals {}, breaking {}",
                level, additions, removals, report.getBreakingChanges().size());
        return report;
    }

    // === Field collection ===

    private record FieldDescriptor(TypeInfo type, boolean required) {
    }

    private enum Shape {
        SCALAR, ARRAY, OBJECT, UNKNOWN
    }

    private record TypeInfo(Shape shape, Set<String> scalars, TypeInfo items, String signature) {
        static TypeInfo of(Shape shape) {
            return new TypeInfo(shape, Set.of(), null, null);
        }

        static TypeInfo scalar(Set<String> scalars) {
            return new TypeInfo(Shape.SCALAR, scalars, null, null);
        }

        static TypeInfo unknown(String signature) {
            return new TypeInfo(Shape.UNKNOWN, Set.of(), null, signature);
        }
    }

    private enum TypeChange {
        NONE, WIDENED, BREAKING
    }

    private static Map<String, FieldDescriptor> collectFields(Document.ObjectValue schema) {
        Map<String, FieldDescriptor> fields = new TreeMap<>();
        if (schema != null) {
            walk(schema, "", fields);
        }
        return fields;
    }

    private static void walk(Document.ObjectValue node, String prefix, Map<String, FieldDescriptor> fields) {
        Set<String> required = requiredSet(node);
        node.getObject("properties").ifPresent(properties -> {
            for (String name : properties.keys()) {
                Document raw = properties.get(name).orElse(Document.NULL);
                if (!raw.isObject()) {
                    continue;
                }
                String path = join(prefix, name);
                fields.put(path, new FieldDescriptor(typeOf(raw.asObject()), required.contains(name)));
                walk(raw.asObject(), path, fields);
            }
        });
        node.getObject("items").ifPresent(items -> walk(items, prefix + "[]", fields));
        walkIndexed(node, "oneOf", prefix, fields);
        walkIndexed(node, "allOf", prefix, fields);
        node.getObject("$defs").ifPresent(defs -> {
            for (String name : defs.keys()) {
                defs.getObject(name).ifPresent(child -> walk(child, join(join(prefix, "$defs"), name), fields));
            }
        });
    }

    private static void walkIndexed(Document.ObjectValue node, String keyword, String prefix, Map<String, FieldDescriptor> fields) {
        node.getArray(keyword).ifPresent(entries -> {
            for (int i = 0; i < entries.size(); i++) {
                Document child = entries.get(i);
                if (child.isObject()) {
                    walk(child.asObject(), join(prefix, keyword + "[" + i + "]"), fields);
                }
            }
        });
    }

    private static String join(String prefix, String segment) {
        return prefix.isEmpty() ? segment : prefix + "." + segment;
    }

    private static Set<String> requiredSet(Document.ObjectValue node) {
        Set<String> required = new TreeSet<>();
        node.getArray("required").ifPresent(values -> {
            for (String name : values.strings()) {
                if (!name.isBlank()) {
                    required.add(name.trim());
                }
            }
        });
        return required;
    }

    // === Type inference ===

    private static TypeInfo typeOf(Document.ObjectValue node) {
        List<String> types = readTypeList(node.get("type").orElse(null));
        if (!types.isEmpty()) {
            boolean object = types.contains("object");
            boolean array = types.contains("array");
            if (object || array) {
                if (types.size() > 1) {
                    return TypeInfo.unknown("type:" + String.join("|", types));
                }
                if (array) {
                    return new TypeInfo(Shape.ARRAY, Set.of(),
                            node.getObject("items").map(SchemaCompatibilityCheckerImpl::typeOf).orElse(null), null);
                }
                return TypeInfo.of(Shape.OBJECT);
            }
            return TypeInfo.scalar(new TreeSet<>(types));
        }
        if (node.has("const")) {
            String kind = kindOf(node.get("const").orElse(Document.NULL));
            if (kind != null) {
                return TypeInfo.scalar(Set.of(kind));
            }
        }
        if (node.getArray("enum").isPresent()) {
            Set<String> kinds = new TreeSet<>();
            node.getArray("enum").get().stream().map(SchemaCompatibilityCheckerImpl::kindOf)
                    .filter(Objects::nonNull).forEach(kinds::add);
            if (!kinds.isEmpty()) {
                return TypeInfo.scalar(kinds);
            }
        }
        if (node.getObject("properties").filter(p -> !p.isEmpty()).isPresent()) {
            return TypeInfo.of(Shape.OBJECT);
        }
        if (node.getObject("items").isPresent()) {
            return new TypeInfo(Shape.ARRAY, Set.of(), typeOf(node.getObject("items").get()), null);
        }
        if (node.getArray("oneOf").isPresent()) {
            Set<String> union = new TreeSet<>();
            for (Document entry : node.getArray("oneOf").get().items()) {
                if (!entry.isObject()) {
                    continue;
                }
                TypeInfo child = typeOf(entry.asObject());
                if (child.shape() != Shape.SCALAR) {
                    return TypeInfo.unknown("oneOf");
                }
                union.addAll(child.scalars());
            }
            return union.isEmpty() ? TypeInfo.unknown("oneOf") : TypeInfo.scalar(union);
        }
        if (node.getArray("allOf").filter(a -> !a.isEmpty()).isPresent()) {
            return TypeInfo.unknown("allOf");
        }
        return TypeInfo.unknown(null);
    }

    private static List<String> readTypeList(Document value) {
        List<String> types = new ArrayList<>();
        if (value == null) {
            return types;
        }
        if (value.isString()) {
            value.asText().map(t -> t.trim().toLowerCase(Locale.ROOT)).filter(t -> !t.isEmpty()).ifPresent(types::add);
            return types;
        }
        if (value.isArray()) {
            for (String name : value.asArray().strings()) {
                String trimmed = name.trim().toLowerCase(Locale.ROOT);
                if (!trimmed.isEmpty()) {
                    types.add(trimmed);
                }
            }
            types.sort(null);
        }
        return types;
    }

    private static String kindOf(Document value) {
        switch (value.kind()) {
            case STRING:
                return value.asText().filter(text -> !text.isBlank()).map(text -> "string").orElse(null);
            case BOOLEAN:
                return "boolean";
            case NUMBER:
                return "number";
            case ARRAY:
                return "array";
            case OBJECT:
                return "object";
            default:
                return "null";
        }
    }

    private static TypeChange compareTypes(TypeInfo oldType, TypeInfo newType) {
        if (oldType.shape() != newType.shape()) {
            return TypeChange.BREAKING;
        }
        switch (oldType.shape()) {
            case SCALAR:
                return compareScalars(oldType.scalars(), newType.scalars());
            case ARRAY:
                if (oldType.items() == null && newType.items() == null) {
                    return TypeChange.NONE;
                }
                if (oldType.items() == null) {
                    return TypeChange.BREAKING;
                }
                if (newType.items() == null) {
                    return TypeChange.WIDENED;
                }
                return compareTypes(oldType.items(), newType.items());
            case OBJECT:
                return TypeChange.NONE;
            default:
                return Objects.equals(oldType.signature(), newType.signature()) ? TypeChange.NONE : TypeChange.BREAKING;
        }
    }

    private static TypeChange compareScalars(Set<String> oldSet, Set<String> newSet) {
        if (oldSet.equals(newSet)) {
            return TypeChange.NONE;
        }
        for (String type : oldSet) {
            boolean covered = newSet.contains(type) || ("integer".equals(type) && newSet.contains("number"));
            if (!covered) {
                return TypeChange.BREAKING;
            }
        }
        return TypeChange.WIDENED;
    }

    // === Legacy field lists ===

    private static Document.ObjectValue normalizeLegacyFields(Document.ObjectValue schema) {
        if (schema == null || isJsonSchema(schema) || schema.getArray("fields").isEmpty()) {
            return schema;
        }
        Document.ObjectValue.Builder properties = Document.ObjectValue.builder();
        List<String> required = new ArrayList<>();
        for (Document entry : schema.getArray("fields").get().items()) {
            if (entry.isString()) {
                entry.asText().map(String::trim).filter(name -> !name.isEmpty())
                        .ifPresent(name -> properties.put(name, Document.ObjectValue.empty()));
                continue;
            }
            if (!entry.isObject()) {
                continue;
            }
            Document.ObjectValue field = entry.asObject();
            String name = field.getString("name").map(String::trim).orElse("");
            if (name.isEmpty()) {
                continue;
            }
            Document.ObjectValue property = field.getObject("schema")
                    .orElseGet(() -> field.getString("type")
                            .map(type -> type.trim().toLowerCase(Locale.ROOT))
                            .filter(SchemaCompatibilityCheckerImpl::isJsonType)
                            .map(type -> Document.ObjectValue.builder().put("type", type).build())
                            .orElse(Document.ObjectValue.empty()));
            properties.put(name, property);
            if (field.get("required").filter(Document.of(true)::equals).isPresent()) {
                required.add(name);
            }
        }
        Document.ObjectValue.Builder normalized = Document.ObjectValue.builder()
                .put("type", "object")
                .put("properties", properties.build());
        if (!required.isEmpty()) {
            normalized.put("required", Document.arrayOfStrings(required));
        }
        return normalized.build();
    }

    private static boolean isJsonSchema(Document.ObjectValue schema) {
        return schema.has("$schema") || schema.has("type") || schema.has("properties")
                || schema.has("oneOf") || schema.has("anyOf") || schema.has("allOf");
    }

    private static boolean isJsonType(String type) {
        switch (type) {
            case "string":
            case "number":
            case "integer":
            case "boolean":
            case "object":
            case "array":
            case "null":
                return true;
            default:
                return false;
        }
    }
}
