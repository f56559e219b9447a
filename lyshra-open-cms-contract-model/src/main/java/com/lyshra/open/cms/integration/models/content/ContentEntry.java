package com.lyshra.open.cms.integration.models.content;

import com.lyshra.open.cms.integration.enumerations.ContentStatus;
import com.lyshra.open.cms.integration.models.document.Document;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * A piece of content of a given type within one environment.
 * The payload lives in {@link ContentVersion} snapshots; this record holds the version bookkeeping.
 */
@Data
@Builder(toBuilder = true)
public class ContentEntry implements Serializable {

    private static final long serialVersionUID = 1L;

    private final UUID id;
    private final UUID contentTypeId;
    private final String slug;
    private final int currentVersion;
    private final Integer publishedVersion;
    @Builder.Default
    private final ContentStatus status = ContentStatus.DRAFT;
    private final UUID environmentId;
    @Builder.Default
    private final List<ContentTranslation> translations = List.of();
    private final Document.ObjectValue metadata;
    private final String createdBy;
    private final String updatedBy;
    private final Instant createdAt;
    private final Instant updatedAt;
    private final Instant publishedAt;
    private final String publishedBy;

    public Optional<Integer> getPublishedVersion() {
        return Optional.ofNullable(publishedVersion);
    }
}
