package com.lyshra.open.cms.integration.models.promotion;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class PromotionCounts {

    private final int created;
    private final int updated;
    private final int skipped;
    private final int failed;

    public int total() {
        return created + updated + skipped + failed;
    }
}
