package com.lyshra.open.cms.integration.models.promotion;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PromotionSummary {

    private final PromotionCounts contentTypes;
    private final PromotionCounts contentEntries;
}
