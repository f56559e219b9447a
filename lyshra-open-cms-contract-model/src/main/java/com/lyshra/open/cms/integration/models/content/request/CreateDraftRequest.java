package com.lyshra.open.cms.integration.models.content.request;

import com.lyshra.open.cms.integration.models.content.ContentSnapshot;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Append a draft version to a content entry.
 * When {@code baseVersion} is set it must equal the entry's current version.
 */
@Data
@Builder
public class CreateDraftRequest {

    @NotNull
    private final UUID contentId;
    @NotNull
    @Valid
    private final ContentSnapshot snapshot;
    private final String createdBy;
    private final Integer baseVersion;
}
