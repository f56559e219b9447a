package com.lyshra.open.cms.integration.models.content;

import com.lyshra.open.cms.integration.models.document.Document;

import java.io.Serializable;
import java.util.Objects;
import java.util.Optional;

/**
 * A content payload paired with the schema version it was authored against.
 *
 * <p>In storage the version travels inside the payload under the reserved {@value #SCHEMA_TAG_KEY}
 * key. {@link #fromTagged} and {@link #toTagged} are the only conversions between the two forms;
 * the payload held here never contains the reserved key.</p>
 *
 * @param schemaVersion version string, may be null for untagged legacy payloads
 * @param payload       user content without the version tag
 */
public record VersionedPayload(String schemaVersion, Document.ObjectValue payload) implements Serializable {

    public static final String SCHEMA_TAG_KEY = "_schema";

    public VersionedPayload {
        Objects.requireNonNull(payload, "payload");
        if (payload.has(SCHEMA_TAG_KEY)) {
            throw new IllegalArgumentException("Payload must not carry the reserved key " + SCHEMA_TAG_KEY);
        }
        if (schemaVersion != null && schemaVersion.isBlank()) {
            schemaVersion = null;
        }
    }

    public static VersionedPayload of(String schemaVersion, Document.ObjectValue payload) {
        return new VersionedPayload(schemaVersion, payload);
    }

    public static VersionedPayload untagged(Document.ObjectValue payload) {
        return new VersionedPayload(null, payload);
    }

    /**
     * Splits a stored document into its version tag and the remaining payload.
     * A tag that is not a string is dropped.
     */
    public static VersionedPayload fromTagged(Document.ObjectValue stored) {
        if (stored == null) {
            return untagged(Document.ObjectValue.empty());
        }
        String version = stored.getString(SCHEMA_TAG_KEY).map(String::trim).orElse(null);
        return new VersionedPayload(version, stored.without(SCHEMA_TAG_KEY));
    }

    /**
     * @return the payload with the version tag embedded, or the bare payload when untagged
     */
    public Document.ObjectValue toTagged() {
        return schemaVersion == null ? payload : payload.with(SCHEMA_TAG_KEY, Document.of(schemaVersion));
    }

    public Optional<String> version() {
        return Optional.ofNullable(schemaVersion);
    }

    public boolean isTagged() {
        return schemaVersion != null;
    }

    public VersionedPayload withVersion(String newVersion) {
        return new VersionedPayload(newVersion, payload);
    }

    /**
     * Replaces the payload. A reserved tag left in the new payload by a transform is discarded.
     */
    public VersionedPayload withPayload(Document.ObjectValue newPayload) {
        return new VersionedPayload(schemaVersion, newPayload.without(SCHEMA_TAG_KEY));
    }
}
