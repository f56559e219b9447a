package com.lyshra.open.cms.integration.models.content;

import com.lyshra.open.cms.integration.models.document.Document;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * Immutable payload captured by one content version.
 */
@Data
@Builder(toBuilder = true)
public class ContentSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotNull
    @Builder.Default
    private final List<@Valid @NotNull TranslationSnapshot> translations = List.of();
    /**
     * Locale-independent fields, versioned like translation content.
     */
    private final VersionedPayload fields;
    private final Document.ObjectValue metadata;

    public Optional<VersionedPayload> getFields() {
        return Optional.ofNullable(fields);
    }

    public Optional<Document.ObjectValue> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    /**
     * The schema version recorded on the snapshot: the first tagged translation, else the fields tag.
     */
    public Optional<String> recordedSchemaVersion() {
        for (TranslationSnapshot translation : translations) {
            if (translation.getContent() != null && translation.getContent().isTagged()) {
                return translation.getContent().version();
            }
        }
        return getFields().flatMap(VersionedPayload::version);
    }

    /**
     * Returns a copy with every translation payload (and the fields payload) passed through {@code mapper}.
     */
    public ContentSnapshot mapPayloads(UnaryOperator<VersionedPayload> mapper) {
        List<TranslationSnapshot> mapped = translations.stream()
                .map(t -> t.toBuilder().content(mapper.apply(t.getContent())).build())
                .collect(Collectors.toList());
        return toBuilder()
                .translations(mapped)
                .fields(fields == null ? null : mapper.apply(fields))
                .build();
    }
}
