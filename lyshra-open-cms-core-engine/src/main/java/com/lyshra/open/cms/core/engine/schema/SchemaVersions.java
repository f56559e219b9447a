package com.lyshra.open.cms.core.engine.schema;

import com.lyshra.open.cms.integration.exception.InvalidSchemaVersionException;
import com.lyshra.open.cms.integration.models.block.BlockDefinition;
import com.lyshra.open.cms.integration.models.content.ContentType;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.schema.SchemaHistorySnapshot;
import com.lyshra.open.cms.integration.models.schema.SchemaMetadata;
import com.lyshra.open.cms.integration.models.schema.SchemaVersion;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Schema version stamping and comparison helpers.
 */
public final class SchemaVersions {

    private SchemaVersions() {
        // Utility class
    }

    /**
     * @see SchemaVersion#compareStrings(String, String)
     */
    public static int compare(String a, String b) {
        return SchemaVersion.compareStrings(a, b);
    }

    /**
     * Reads the version tag from a schema's metadata, if any.
     */
    public static Optional<String> readVersionTag(Document.ObjectValue schema) {
        return Optional.ofNullable(SchemaMetadataCodec.extract(schema).getSchemaVersion());
    }

    /**
     * Guarantees the schema carries a canonical {@code slug@vX.Y.Z} tag.
     *
     * <p>An untagged schema gets {@code slug@v1.0.0}. A tagged schema keeps its version; a tag
     * without slug gains {@code slug}. Applying this twice yields the same document.</p>
     *
     * @param schema schema document
     * @param slug   owning content type or block slug; required when the schema is untagged
     * @return normalized schema and its version
     * @throws InvalidSchemaVersionException if the tag is malformed, names another slug,
     *                                       or no slug is available for an untagged schema
     */
    public static NormalizedSchema ensureVersion(Document.ObjectValue schema, String slug) {
        if (schema == null) {
            throw new InvalidSchemaVersionException("null", "schema is required");
        }
        String normalizedSlug = StringUtils.trimToEmpty(slug);
        SchemaMetadata metadata = SchemaMetadataCodec.extract(schema);
        SchemaVersion version;
        if (metadata.getSchemaVersion() != null) {
            version = SchemaVersion.parse(metadata.getSchemaVersion());
            if (version.hasSlug() && !normalizedSlug.isEmpty() && !version.getSlug().equals(normalizedSlug)) {
                throw new InvalidSchemaVersionException(metadata.getSchemaVersion(),
                        "slug mismatch, expected [" + normalizedSlug + "]");
            }
            if (!version.hasSlug()) {
                if (normalizedSlug.isEmpty()) {
                    throw new InvalidSchemaVersionException(metadata.getSchemaVersion(), "slug is required");
                }
                version = version.withSlug(normalizedSlug);
            }
        } else {
            if (normalizedSlug.isEmpty()) {
                throw new InvalidSchemaVersionException("", "slug is required to assign a default version");
            }
            version = SchemaVersion.defaultFor(normalizedSlug);
        }
        SchemaMetadata stamped = metadata.toBuilder()
                .slug(metadata.getSlug() != null ? metadata.getSlug() : version.getSlug())
                .schemaVersion(version.toString())
                .build();
        return new NormalizedSchema(SchemaMetadataCodec.apply(schema, stamped), version);
    }

    /**
     * Normalizes a content type schema. A declared {@code schemaVersion} on the type wins over the tag in the schema.
     */
    public static NormalizedSchema normalize(ContentType contentType) {
        return normalize(contentType.getSchema(), contentType.getSchemaVersion(), contentType.getSlug());
    }

    /**
     * Normalizes a block definition schema under the block's own slug.
     */
    public static NormalizedSchema normalize(BlockDefinition definition) {
        Document.ObjectValue schema = definition.getSchema() == null ? Document.ObjectValue.empty() : definition.getSchema();
        return normalize(schema, definition.getSchemaVersion(), definition.getSlug());
    }

    private static NormalizedSchema normalize(Document.ObjectValue schema, String declaredVersion, String slug) {
        if (StringUtils.isBlank(declaredVersion)) {
            return ensureVersion(schema, slug);
        }
        SchemaVersion version = SchemaVersion.parse(declaredVersion);
        if (!version.hasSlug()) {
            version = version.withSlug(slug);
        }
        SchemaMetadata metadata = SchemaMetadataCodec.extract(schema).toBuilder()
                .slug(slug)
                .schemaVersion(version.toString())
                .build();
        return new NormalizedSchema(SchemaMetadataCodec.apply(schema, metadata), version);
    }

    /**
     * Appends a snapshot to a schema history. A snapshot with the same version as the last
     * entry replaces it; a snapshot without version leaves the history unchanged.
     *
     * @return new unmodifiable history list
     */
    public static List<SchemaHistorySnapshot> appendHistory(List<SchemaHistorySnapshot> history, SchemaHistorySnapshot snapshot) {
        List<SchemaHistorySnapshot> result = new ArrayList<>(history == null ? List.of() : history);
        if (snapshot == null || StringUtils.isBlank(snapshot.getVersion())) {
            return Collections.unmodifiableList(result);
        }
        if (!result.isEmpty() && Objects.equals(result.get(result.size() - 1).getVersion(), snapshot.getVersion())) {
            result.set(result.size() - 1, snapshot);
        } else {
            result.add(snapshot);
        }
        return Collections.unmodifiableList(result);
    }
}
