package com.lyshra.open.cms.integration.models.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

/**
 * A failed item of a whole-environment promotion.
 */
@Data
@Builder
public class PromotionError {

    private final PromotionItemKind kind;
    private final UUID sourceId;
    private final LyshraOpenCmsErrorKind errorKind;
    private final String error;
}
