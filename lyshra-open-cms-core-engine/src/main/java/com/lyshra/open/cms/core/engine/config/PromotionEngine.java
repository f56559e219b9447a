package com.lyshra.open.cms.core.engine.config;

import com.lyshra.open.cms.integration.contract.content.IContentVersionService;
import com.lyshra.open.cms.integration.contract.promotion.IPromotionService;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Wired content services and the configuration and collaborators they were built from.
 *
 * <pre>
 * PromotionEngine engine = PromotionEngineFactory.create(PromotionEngineConfig.defaultConfig(), dependencies);
 * engine.getPromotionService().promoteContentType(request).block();
 * </pre>
 */
@Getter
@RequiredArgsConstructor
public final class PromotionEngine {

    private final PromotionEngineConfig config;
    private final PromotionEngineDependencies dependencies;
    private final IContentVersionService contentVersionService;
    private final IPromotionService promotionService;
}
