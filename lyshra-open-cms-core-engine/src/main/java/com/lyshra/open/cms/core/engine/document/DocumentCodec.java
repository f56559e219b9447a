package com.lyshra.open.cms.core.engine.document;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.models.content.ContentSnapshot;
import com.lyshra.open.cms.integration.models.content.TranslationSnapshot;
import com.lyshra.open.cms.integration.models.content.VersionedPayload;
import com.lyshra.open.cms.integration.models.document.Document;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON conversion for {@link Document} values and content snapshots.
 *
 * <p>Numbers are read as {@code BigDecimal} and written in plain notation. Snapshot payloads are
 * written in stored form, with the schema version embedded under
 * {@value VersionedPayload#SCHEMA_TAG_KEY}.</p>
 */
@Slf4j
public final class DocumentCodec {

    private static final ObjectMapper JSON_MAPPER;

    static {
        JSON_MAPPER = new ObjectMapper();
        JSON_MAPPER.registerModule(new JavaTimeModule());
        JSON_MAPPER.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        JSON_MAPPER.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        JSON_MAPPER.configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    private static final String TRANSLATIONS = "translations";
    private static final String LOCALE = "locale";
    private static final String TITLE = "title";
    private static final String SUMMARY = "summary";
    private static final String CONTENT = "content";
    private static final String FIELDS = "fields";
    private static final String METADATA = "metadata";

    private DocumentCodec() {
        // Utility class
    }

    // === Documents ===

    /**
     * Parses JSON text into a document.
     *
     * @throws LyshraOpenCmsException with kind INVALID_FORMAT for malformed JSON
     */
    public static Document parse(String json) {
        try {
            return fromJsonNode(JSON_MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            log.error("Failed to parse document JSON: {}", e.getOriginalMessage());
            throw new LyshraOpenCmsException(LyshraOpenCmsErrorKind.INVALID_FORMAT, "Malformed JSON document", e);
        }
    }

    /**
     * Parses JSON text that must hold an object.
     */
    public static Document.ObjectValue parseObject(String json) {
        Document document = parse(json);
        if (!document.isObject()) {
            throw new LyshraOpenCmsException(LyshraOpenCmsErrorKind.INVALID_FORMAT,
                    "Expected a JSON object but found " + document.kind());
        }
        return document.asObject();
    }

    public static String toJson(Document document) {
        try {
            return JSON_MAPPER.writeValueAsString(toJsonNode(document));
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize document to JSON: {}", e.getMessage(), e);
            throw new LyshraOpenCmsException(LyshraOpenCmsErrorKind.INVALID_FORMAT, "Failed to serialize document", e);
        }
    }

    public static Document fromJsonNode(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return Document.NULL;
        }
        if (node.isObject()) {
            Map<String, Document> fields = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> iterator = node.fields();
            while (iterator.hasNext()) {
                Map.Entry<String, JsonNode> field = iterator.next();
                fields.put(field.getKey(), fromJsonNode(field.getValue()));
            }
            return new Document.ObjectValue(fields);
        }
        if (node.isArray()) {
            List<Document> items = new ArrayList<>(node.size());
            node.forEach(item -> items.add(fromJsonNode(item)));
            return new Document.ArrayValue(items);
        }
        if (node.isBoolean()) {
            return Document.of(node.booleanValue());
        }
        if (node.isNumber()) {
            return Document.of(node.decimalValue());
        }
        return Document.of(node.asText());
    }

    public static JsonNode toJsonNode(Document document) {
        JsonNodeFactory factory = JSON_MAPPER.getNodeFactory();
        switch (document.kind()) {
            case OBJECT: {
                ObjectNode node = factory.objectNode();
                document.asObject().fields().forEach((key, value) -> node.set(key, toJsonNode(value)));
                return node;
            }
            case ARRAY: {
                ArrayNode node = factory.arrayNode();
                document.asArray().items().forEach(item -> node.add(toJsonNode(item)));
                return node;
            }
            case STRING:
                return factory.textNode(document.asText().orElse(""));
            case NUMBER:
                return factory.numberNode(((Document.NumberValue) document).value());
            case BOOLEAN:
                return factory.booleanNode(((Document.BoolValue) document).value());
            default:
                return factory.nullNode();
        }
    }

    // === Snapshots ===

    /**
     * Renders a snapshot in stored form: every payload carries its embedded version tag.
     */
    public static Document.ObjectValue snapshotToDocument(ContentSnapshot snapshot) {
        List<Document> translations = new ArrayList<>();
        for (TranslationSnapshot translation : snapshot.getTranslations()) {
            Document.ObjectValue.Builder builder = Document.ObjectValue.builder().put(LOCALE, translation.getLocale());
            if (translation.getTitle() != null) {
                builder.put(TITLE, translation.getTitle());
            }
            if (translation.getSummary() != null) {
                builder.put(SUMMARY, translation.getSummary());
            }
            builder.put(CONTENT, translation.getContent().toTagged());
            translations.add(builder.build());
        }
        Document.ObjectValue.Builder builder = Document.ObjectValue.builder()
                .put(TRANSLATIONS, new Document.ArrayValue(translations));
        snapshot.getFields().ifPresent(fields -> builder.put(FIELDS, fields.toTagged()));
        snapshot.getMetadata().ifPresent(metadata -> builder.put(METADATA, metadata));
        return builder.build();
    }

    /**
     * Reads a snapshot from its stored form, splitting the version tag off each payload.
     */
    public static ContentSnapshot snapshotFromDocument(Document.ObjectValue stored) {
        List<TranslationSnapshot> translations = new ArrayList<>();
        stored.getArray(TRANSLATIONS).ifPresent(items -> items.stream()
                .filter(Document::isObject)
                .map(Document::asObject)
                .forEach(item -> translations.add(TranslationSnapshot.builder()
                        .locale(item.getString(LOCALE).orElse(null))
                        .title(item.getString(TITLE).orElse(null))
                        .summary(item.getString(SUMMARY).orElse(null))
                        .content(VersionedPayload.fromTagged(item.getObject(CONTENT).orElse(null)))
                        .build())));
        return ContentSnapshot.builder()
                .translations(List.copyOf(translations))
                .fields(stored.getObject(FIELDS).map(VersionedPayload::fromTagged).orElse(null))
                .metadata(stored.getObject(METADATA).orElse(null))
                .build();
    }

    public static String snapshotToJson(ContentSnapshot snapshot) {
        return toJson(snapshotToDocument(snapshot));
    }

    public static ContentSnapshot snapshotFromJson(String json) {
        return snapshotFromDocument(parseObject(json));
    }
}
