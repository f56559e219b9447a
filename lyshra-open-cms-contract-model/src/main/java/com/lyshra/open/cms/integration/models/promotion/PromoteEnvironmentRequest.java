package com.lyshra.open.cms.integration.models.promotion;

import com.lyshra.open.cms.integration.enumerations.PromotionScope;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;

import java.util.List;
import java.util.UUID;

/**
 * Promote a batch of content types and entries from one environment to another.
 *
 * <p>Empty filters select everything in scope. Entry slugs need a content type filter
 * ({@code contentEntryTypeId} or {@code contentEntryTypeSlug}).</p>
 */
@Data
@Builder(toBuilder = true)
public class PromoteEnvironmentRequest {

    private final String sourceEnvironment;
    @NotBlank
    private final String targetEnvironment;
    @NotNull
    @Builder.Default
    private final PromotionScope scope = PromotionScope.ALL;
    @Builder.Default
    private final List<UUID> contentTypeIds = List.of();
    @Builder.Default
    private final List<String> contentTypeSlugs = List.of();
    @Builder.Default
    private final List<UUID> contentIds = List.of();
    @Builder.Default
    private final List<String> contentSlugs = List.of();
    private final UUID contentEntryTypeId;
    private final String contentEntryTypeSlug;
    @NotNull
    @Builder.Default
    private final PromotionOptions options = PromotionOptions.defaults();
    private final String actor;
    private final PromotionCancellation cancellation;
}
