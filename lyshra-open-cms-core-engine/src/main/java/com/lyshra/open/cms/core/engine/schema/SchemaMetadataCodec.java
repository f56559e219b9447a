package com.lyshra.open.cms.core.engine.schema;

import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.BlockAvailability;
import com.lyshra.open.cms.integration.models.schema.SchemaMetadata;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * Reads and writes the {@value #METADATA_KEY} object of a schema document.
 *
 * <p>Block availability is accepted either as a list (meaning allow) or as an object with
 * {@code allow}/{@code allowed} and {@code deny}/{@code denied} lists, and is always written
 * back in the {@code {allow, deny}} form.</p>
 */
public final class SchemaMetadataCodec {

    public static final String METADATA_KEY = "metadata";
    public static final String SLUG_KEY = "slug";
    public static final String SCHEMA_VERSION_KEY = "schema_version";
    public static final String UI_OVERLAYS_KEY = "ui_overlays";
    public static final String BLOCK_AVAILABILITY_KEY = "block_availability";

    private SchemaMetadataCodec() {
        // Utility class
    }

    public static SchemaMetadata extract(Document.ObjectValue schema) {
        if (schema == null) {
            return SchemaMetadata.empty();
        }
        return schema.getObject(METADATA_KEY)
                .map(raw -> SchemaMetadata.builder()
                        .slug(raw.getString(SLUG_KEY).map(String::trim).filter(StringUtils::isNotEmpty).orElse(null))
                        .schemaVersion(raw.getString(SCHEMA_VERSION_KEY).map(String::trim).filter(StringUtils::isNotEmpty).orElse(null))
                        .uiOverlays(readStringList(raw.get(UI_OVERLAYS_KEY).orElse(null)))
                        .blockAvailability(readBlockAvailability(raw.get(BLOCK_AVAILABILITY_KEY).orElse(null)))
                        .build())
                .orElse(SchemaMetadata.empty());
    }

    /**
     * Writes the non-empty parts of {@code metadata} into the schema. Fields absent from
     * {@code metadata} and keys outside the metadata object are left as they are.
     */
    public static Document.ObjectValue apply(Document.ObjectValue schema, SchemaMetadata metadata) {
        Document.ObjectValue target = schema.getObject(METADATA_KEY).orElse(Document.ObjectValue.empty());
        if (StringUtils.isNotBlank(metadata.getSlug())) {
            target = target.with(SLUG_KEY, metadata.getSlug().trim());
        }
        if (StringUtils.isNotBlank(metadata.getSchemaVersion())) {
            target = target.with(SCHEMA_VERSION_KEY, metadata.getSchemaVersion().trim());
        }
        if (metadata.getUiOverlays() != null && !metadata.getUiOverlays().isEmpty()) {
            target = target.with(UI_OVERLAYS_KEY, Document.arrayOfStrings(metadata.getUiOverlays()));
        }
        BlockAvailability availability = metadata.getBlockAvailability();
        if (availability != null && !availability.isEmpty()) {
            Document.ObjectValue.Builder written = Document.ObjectValue.builder();
            if (!availability.getAllow().isEmpty()) {
                written.put("allow", Document.arrayOfStrings(availability.getAllow()));
            }
            if (!availability.getDeny().isEmpty()) {
                written.put("deny", Document.arrayOfStrings(availability.getDeny()));
            }
            target = target.with(BLOCK_AVAILABILITY_KEY, written.build());
        }
        return schema.with(METADATA_KEY, target);
    }

    /**
     * Removes the version tag and slug from the metadata, dropping the metadata object when nothing else remains.
     */
    public static Document.ObjectValue stripVersionMetadata(Document.ObjectValue schema) {
        if (schema == null) {
            return null;
        }
        return schema.getObject(METADATA_KEY)
                .map(meta -> {
                    Document.ObjectValue remaining = meta.without(SCHEMA_VERSION_KEY).without(SLUG_KEY);
                    return remaining.isEmpty() ? schema.without(METADATA_KEY) : schema.with(METADATA_KEY, remaining);
                })
                .orElse(schema);
    }

    private static List<String> readStringList(Document value) {
        if (value == null) {
            return List.of();
        }
        if (value.isArray()) {
            return value.asArray().strings();
        }
        return value.asText().map(List::of).orElse(List.of());
    }

    private static BlockAvailability readBlockAvailability(Document value) {
        if (value == null || value.isNull()) {
            return BlockAvailability.none();
        }
        if (value.isArray()) {
            return new BlockAvailability(value.asArray().strings(), List.of());
        }
        if (!value.isObject()) {
            return BlockAvailability.none();
        }
        Document.ObjectValue raw = value.asObject();
        List<String> allow = readStringList(raw.get("allow").or(() -> raw.get("allowed")).orElse(null));
        List<String> deny = readStringList(raw.get("deny").or(() -> raw.get("denied")).orElse(null));
        return new BlockAvailability(allow, deny);
    }
}
