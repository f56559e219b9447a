package com.lyshra.open.cms.integration.models.content.request;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class PublishDraftRequest {

    @NotNull
    private final UUID contentId;
    @Positive
    private final int version;
    private final String publishedBy;
}
