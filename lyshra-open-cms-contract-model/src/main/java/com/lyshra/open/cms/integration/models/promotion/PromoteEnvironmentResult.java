package com.lyshra.open.cms.integration.models.promotion;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Result of a whole-environment promotion. Partial success is normal: failed items
 * appear in {@code errors} while the rest appear in {@code items}.
 */
@Data
@Builder
public class PromoteEnvironmentResult {

    private final EnvironmentRef sourceEnvironment;
    private final EnvironmentRef targetEnvironment;
    private final PromotionSummary summary;
    @Builder.Default
    private final List<PromotionItem> items = List.of();
    @Builder.Default
    private final List<PromotionError> errors = List.of();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
