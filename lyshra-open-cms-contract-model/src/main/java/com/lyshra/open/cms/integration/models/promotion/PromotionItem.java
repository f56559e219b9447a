package com.lyshra.open.cms.integration.models.promotion;

import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import com.lyshra.open.cms.integration.enumerations.PromotionStatus;
import lombok.Builder;
import lombok.Data;

import java.util.Map;
import java.util.UUID;

/**
 * Outcome of promoting one content type or content entry.
 */
@Data
@Builder(toBuilder = true)
public class PromotionItem {

    public static final String DETAIL_SCHEMA_VERSION = "schema_version";
    public static final String DETAIL_DRY_RUN = "dry_run";

    private final PromotionItemKind kind;
    private final UUID sourceId;
    private final UUID targetId;
    private final PromotionStatus status;
    private final String message;
    @Builder.Default
    private final Map<String, Object> details = Map.of();

    public boolean isDryRun() {
        return Boolean.TRUE.equals(details.get(DETAIL_DRY_RUN));
    }
}
