package com.lyshra.open.cms.core.engine.promotion.impl;

import com.lyshra.open.cms.core.engine.config.PromotionEngineConfig;
import com.lyshra.open.cms.core.engine.config.PromotionEngineDependencies;
import com.lyshra.open.cms.core.engine.content.SnapshotMigrator;
import com.lyshra.open.cms.core.engine.promotion.EnvironmentResolver;
import com.lyshra.open.cms.core.engine.promotion.PromotionActivityPublisher;
import com.lyshra.open.cms.core.engine.validation.RequestValidator;
import com.lyshra.open.cms.integration.contract.environment.IEnvironmentService;
import com.lyshra.open.cms.integration.contract.promotion.IPromotionService;
import com.lyshra.open.cms.integration.contract.repository.IContentRepository;
import com.lyshra.open.cms.integration.contract.repository.IContentTypeRepository;
import com.lyshra.open.cms.integration.models.promotion.PromoteContentEntryRequest;
import com.lyshra.open.cms.integration.models.promotion.PromoteContentTypeRequest;
import com.lyshra.open.cms.integration.models.promotion.PromoteEnvironmentRequest;
import com.lyshra.open.cms.integration.models.promotion.PromoteEnvironmentResult;
import com.lyshra.open.cms.integration.models.promotion.PromotionItem;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Promotes content types, content entries and whole environments.
 *
 * <p>Single-item operations fail with the first error. The environment operation reports
 * per-item errors in its result and only fails for problems with the environments or filters.</p>
 */
@Slf4j
public class PromotionServiceImpl implements IPromotionService {

    private final IContentTypeRepository contentTypeRepository;
    private final IContentRepository contentRepository;
    private final IEnvironmentService environmentService;
    private final EnvironmentResolver environmentResolver;
    private final ContentTypePromoter contentTypePromoter;
    private final ContentEntryPromoter contentEntryPromoter;
    private final EnvironmentPromoter environmentPromoter;

    public PromotionServiceImpl(PromotionEngineConfig config,
                                PromotionEngineDependencies dependencies,
                                SnapshotMigrator snapshotMigrator) {
        this.contentTypeRepository = dependencies.getContentTypeRepository();
        this.contentRepository = dependencies.getContentRepository();
        this.environmentService = dependencies.getEnvironmentService();
        this.environmentResolver = new EnvironmentResolver(environmentService, config.getDefaultEnvironmentKey());
        PromotionActivityPublisher activityPublisher =
                new PromotionActivityPublisher(dependencies.getActivityEmitter(), dependencies.getClock());
        this.contentTypePromoter = new ContentTypePromoter(config, dependencies, activityPublisher);
        this.contentEntryPromoter = new ContentEntryPromoter(config, dependencies, snapshotMigrator,
                contentTypePromoter, activityPublisher);
        this.environmentPromoter = new EnvironmentPromoter(contentTypeRepository, contentRepository,
                environmentResolver, contentTypePromoter, contentEntryPromoter);
    }

    @Override
    public Mono<PromotionItem> promoteContentType(PromoteContentTypeRequest request) {
        return RequestValidator.validate(request)
                .flatMap(valid -> contentTypeRepository.getById(valid.getContentTypeId()))
                .flatMap(type -> Mono.zip(
                                environmentService.getEnvironment(type.getEnvironmentId()),
                                environmentResolver.resolve(request.getTargetEnvironmentId(), request.getTargetEnvironment()))
                        .flatMap(environments -> contentTypePromoter.promote(type, environments.getT1(), environments.getT2(),
                                request.getOptions(), request.getActor(), request.getCancellation())))
                .map(ContentTypePromotion::item)
                .doOnError(e -> log.warn("Promotion of content type [{}] failed: {}", request == null ? null : request.getContentTypeId(), e.getMessage()));
    }

    @Override
    public Mono<PromotionItem> promoteContentEntry(PromoteContentEntryRequest request) {
        return RequestValidator.validate(request)
                .flatMap(valid -> contentRepository.getById(valid.getContentEntryId()))
                .flatMap(entry -> Mono.zip(
                                contentTypeRepository.getById(entry.getContentTypeId()),
                                environmentService.getEnvironment(entry.getEnvironmentId()),
                                environmentResolver.resolve(request.getTargetEnvironmentId(), request.getTargetEnvironment()))
                        .flatMap(resolved -> contentEntryPromoter.promote(entry, resolved.getT1(), resolved.getT2(), resolved.getT3(),
                                request.getOptions(), request.getActor(), request.getCancellation())))
                .doOnError(e -> log.warn("Promotion of content entry [{}] failed: {}", request == null ? null : request.getContentEntryId(), e.getMessage()));
    }

    @Override
    public Mono<PromoteEnvironmentResult> promoteEnvironment(PromoteEnvironmentRequest request) {
        return RequestValidator.validate(request)
                .flatMap(environmentPromoter::promote);
    }
}
