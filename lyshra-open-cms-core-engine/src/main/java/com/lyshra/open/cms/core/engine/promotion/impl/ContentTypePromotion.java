package com.lyshra.open.cms.core.engine.promotion.impl;

import com.lyshra.open.cms.integration.models.content.ContentType;
import com.lyshra.open.cms.integration.models.promotion.PromotionItem;

/**
 * Result of promoting one content type.
 *
 * @param item       reported item
 * @param targetType the type as it now exists in the target environment; for a dry run that
 *                   would create the type, an unsaved copy carrying a fresh id
 */
record ContentTypePromotion(PromotionItem item, ContentType targetType) {
}
