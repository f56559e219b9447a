package com.lyshra.open.cms.integration.models.content;

import com.lyshra.open.cms.integration.enumerations.ContentStatus;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * Numbered snapshot of a content entry. The snapshot never changes after creation;
 * only the status moves (draft to published, published to archived).
 */
@Data
@Builder(toBuilder = true)
public class ContentVersion implements Serializable {

    private static final long serialVersionUID = 1L;

    private final UUID id;
    private final UUID contentEntryId;
    private final int version;
    private final ContentStatus status;
    private final ContentSnapshot snapshot;
    private final String createdBy;
    private final Instant createdAt;
    private final Instant publishedAt;
    private final String publishedBy;

    public boolean isPublished() {
        return status == ContentStatus.PUBLISHED;
    }
}
