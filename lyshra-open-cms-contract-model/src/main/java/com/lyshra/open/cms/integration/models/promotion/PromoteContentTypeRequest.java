package com.lyshra.open.cms.integration.models.promotion;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Promote one content type into a target environment, identified by key or id.
 * A blank key with no id selects the default environment.
 */
@Data
@Builder(toBuilder = true)
public class PromoteContentTypeRequest {

    @NotNull
    private final UUID contentTypeId;
    private final String targetEnvironment;
    private final UUID targetEnvironmentId;
    @NotNull
    @Builder.Default
    private final PromotionOptions options = PromotionOptions.defaults();
    private final String actor;
    private final PromotionCancellation cancellation;
}
