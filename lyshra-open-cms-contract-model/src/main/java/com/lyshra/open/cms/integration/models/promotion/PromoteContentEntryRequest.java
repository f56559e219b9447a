package com.lyshra.open.cms.integration.models.promotion;

import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * Promote one content entry into a target environment, identified by key or id.
 */
@Data
@Builder(toBuilder = true)
public class PromoteContentEntryRequest {

    @NotNull
    private final UUID contentEntryId;
    private final String targetEnvironment;
    private final UUID targetEnvironmentId;
    @NotNull
    @Builder.Default
    private final PromotionOptions options = PromotionOptions.defaults();
    private final String actor;
    private final PromotionCancellation cancellation;
}
