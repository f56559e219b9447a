package com.lyshra.open.cms.integration.contract.promotion;

import com.lyshra.open.cms.integration.models.promotion.PromoteContentEntryRequest;
import com.lyshra.open.cms.integration.models.promotion.PromoteContentTypeRequest;
import com.lyshra.open.cms.integration.models.promotion.PromoteEnvironmentRequest;
import com.lyshra.open.cms.integration.models.promotion.PromoteEnvironmentResult;
import com.lyshra.open.cms.integration.models.promotion.PromotionItem;
import reactor.core.publisher.Mono;

/**
 * Copies content types and entries between environments.
 *
 * <p>Single-item promotions fail fast and write nothing on failure. Environment promotion
 * collects per-item failures and only fails as a whole when an environment cannot be resolved.
 * With {@code dryRun} no mutating repository call is made.</p>
 */
public interface IPromotionService {

    Mono<PromotionItem> promoteContentType(PromoteContentTypeRequest request);

    Mono<PromotionItem> promoteContentEntry(PromoteContentEntryRequest request);

    Mono<PromoteEnvironmentResult> promoteEnvironment(PromoteEnvironmentRequest request);
}
