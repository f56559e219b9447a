package com.lyshra.open.cms.integration.models.content.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Copy an earlier version's snapshot into a new draft.
 */
@Data
@Builder
public class RestoreVersionRequest {

    @NotNull
    private final UUID contentId;
    @Positive
    private final int version;
    private final String restoredBy;
}
