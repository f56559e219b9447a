package com.lyshra.open.cms.core.engine.promotion.impl;

import com.lyshra.open.cms.core.engine.promotion.EnvironmentResolver;
import com.lyshra.open.cms.core.exception.promotion.ContentTypeEnvironmentMismatchException;
import com.lyshra.open.cms.core.exception.promotion.ContentTypeRequiredException;
import com.lyshra.open.cms.integration.contract.repository.IContentRepository;
import com.lyshra.open.cms.integration.contract.repository.IContentTypeRepository;
import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import com.lyshra.open.cms.integration.enumerations.PromotionStatus;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.exception.RecordNotFoundException;
import com.lyshra.open.cms.integration.models.content.ContentEntry;
import com.lyshra.open.cms.integration.models.content.ContentType;
import com.lyshra.open.cms.integration.models.environment.Environment;
import com.lyshra.open.cms.integration.models.promotion.EnvironmentRef;
import com.lyshra.open.cms.integration.models.promotion.PromoteEnvironmentRequest;
import com.lyshra.open.cms.integration.models.promotion.PromoteEnvironmentResult;
import com.lyshra.open.cms.integration.models.promotion.PromotionCounts;
import com.lyshra.open.cms.integration.models.promotion.PromotionError;
import com.lyshra.open.cms.integration.models.promotion.PromotionItem;
import com.lyshra.open.cms.integration.models.promotion.PromotionSummary;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Promotes a selection of content types and entries from one environment to another.
 *
 * <p>Environment and filter problems fail the whole batch. Any failure while promoting a single
 * type or entry is reported as an error and the batch carries on. Failures outside the domain
 * taxonomy are reported as {@link LyshraOpenCmsErrorKind#INTERNAL}. Items are processed one at a
 * time: all selected types first, then entries.</p>
 */
@Slf4j
class EnvironmentPromoter {

    private final IContentTypeRepository contentTypeRepository;
    private final IContentRepository contentRepository;
    private final EnvironmentResolver environmentResolver;
    private final ContentTypePromoter contentTypePromoter;
    private final ContentEntryPromoter contentEntryPromoter;

    EnvironmentPromoter(IContentTypeRepository contentTypeRepository, IContentRepository contentRepository,
                        EnvironmentResolver environmentResolver, ContentTypePromoter contentTypePromoter,
                        ContentEntryPromoter contentEntryPromoter) {
        this.contentTypeRepository = contentTypeRepository;
        this.contentRepository = contentRepository;
        this.environmentResolver = environmentResolver;
        this.contentTypePromoter = contentTypePromoter;
        this.contentEntryPromoter = contentEntryPromoter;
    }

    /**
     * One selected item: either something to promote or an error found while selecting it.
     */
    private record Selection<T>(T value, PromotionError error) {

        static <T> Selection<T> of(T value) {
            return new Selection<>(value, null);
        }

        static <T> Selection<T> failed(PromotionError error) {
            return new Selection<>(null, error);
        }
    }

    /**
     * Collects items and errors in processing order.
     */
    private static final class Outcomes {
        private final List<PromotionItem> items = new ArrayList<>();
        private final List<PromotionError> errors = new ArrayList<>();

        PromotionCounts counts(PromotionItemKind kind) {
            int created = 0;
            int updated = 0;
            int skipped = 0;
            for (PromotionItem item : items) {
                if (item.getKind() != kind) {
                    continue;
                }
                switch (item.getStatus()) {
                    case CREATED -> created++;
                    case UPDATED -> updated++;
                    case SKIPPED -> skipped++;
                }
            }
            int failed = (int) errors.stream().filter(error -> error.getKind() == kind).count();
            return PromotionCounts.builder().created(created).updated(updated).skipped(skipped).failed(failed).build();
        }
    }

    Mono<PromoteEnvironmentResult> promote(PromoteEnvironmentRequest request) {
        return environmentResolver.resolve(null, request.getSourceEnvironment())
                .zipWith(environmentResolver.resolve(null, request.getTargetEnvironment()))
                .flatMap(environments -> {
                    Environment source = environments.getT1();
                    Environment target = environments.getT2();
                    log.info("Promoting [{}] from environment [{}] to [{}]", request.getScope(), source.getKey(), target.getKey());
                    Mono<Optional<ContentType>> entryTypeFilter = request.getScope().includesContentEntries()
                            ? resolveEntryTypeFilter(request, source)
                            : Mono.just(Optional.empty());
                    return entryTypeFilter.flatMap(filter -> run(request, source, target, filter.orElse(null)));
                });
    }

    private Mono<PromoteEnvironmentResult> run(PromoteEnvironmentRequest request, Environment source, Environment target,
                                               ContentType entryTypeFilter) {
        Outcomes outcomes = new Outcomes();
        Mono<Void> types = request.getScope().includesContentTypes()
                ? selectContentTypes(request, source)
                        .concatMap(selection -> promoteType(selection, request, source, target))
                        .doOnNext(outcome -> record(outcomes, outcome))
                        .then()
                : Mono.empty();
        Mono<Void> entries = request.getScope().includesContentEntries()
                ? sourceTypesById(source)
                        .flatMapMany(typesById -> selectContentEntries(request, source, entryTypeFilter)
                                .concatMap(selection -> promoteEntry(selection, typesById, request, source, target)))
                        .doOnNext(outcome -> record(outcomes, outcome))
                        .then()
                : Mono.empty();
        return types.then(entries)
                .then(Mono.fromSupplier(() -> {
                    PromoteEnvironmentResult result = PromoteEnvironmentResult.builder()
                            .sourceEnvironment(EnvironmentRef.of(source))
                            .targetEnvironment(EnvironmentRef.of(target))
                            .summary(PromotionSummary.builder()
                                    .contentTypes(outcomes.counts(PromotionItemKind.CONTENT_TYPE))
                                    .contentEntries(outcomes.counts(PromotionItemKind.CONTENT_ENTRY))
                                    .build())
                            .items(List.copyOf(outcomes.items))
                            .errors(List.copyOf(outcomes.errors))
                            .build();
                    log.info("Promotion from [{}] to [{}] finished: types {}, entries {}", source.getKey(), target.getKey(),
                            result.getSummary().getContentTypes(), result.getSummary().getContentEntries());
                    return result;
                }));
    }

    private static void record(Outcomes outcomes, Selection<PromotionItem> outcome) {
        if (outcome.error() != null) {
            outcomes.errors.add(outcome.error());
        } else {
            outcomes.items.add(outcome.value());
        }
    }

    // === Filters ===

    private Mono<Optional<ContentType>> resolveEntryTypeFilter(PromoteEnvironmentRequest request, Environment source) {
        UUID typeId = request.getContentEntryTypeId();
        String typeSlug = StringUtils.trimToNull(request.getContentEntryTypeSlug());
        if (typeId == null && typeSlug == null) {
            return hasValues(request.getContentSlugs())
                    ? Mono.error(ContentTypeRequiredException.forSlugFilter())
                    : Mono.just(Optional.empty());
        }
        Mono<Optional<ContentType>> byId = typeId == null
                ? Mono.just(Optional.empty())
                : contentTypeRepository.getById(typeId)
                        .flatMap(type -> Objects.equals(type.getEnvironmentId(), source.getId())
                                ? Mono.just(Optional.of(type))
                                : Mono.error(ContentTypeEnvironmentMismatchException.notInEnvironment(typeId, source.getKey())));
        return byId.flatMap(fromId -> {
            if (typeSlug == null) {
                return Mono.just(fromId);
            }
            return contentTypeRepository.getBySlug(typeSlug, source.getId())
                    .flatMap(fromSlug -> fromId.isPresent() && !fromId.get().getId().equals(fromSlug.getId())
                            ? Mono.error(ContentTypeEnvironmentMismatchException.filterMismatch(typeId, typeSlug))
                            : Mono.just(Optional.of(fromSlug)));
        });
    }

    // === Content types ===

    private Flux<Selection<ContentType>> selectContentTypes(PromoteEnvironmentRequest request, Environment source) {
        boolean explicit = hasValues(request.getContentTypeIds()) || hasValues(request.getContentTypeSlugs());
        if (!explicit) {
            return contentTypeRepository.list(source.getId()).map(Selection::of);
        }
        return contentTypeRepository.list(source.getId()).collectList()
                .flatMapMany(sourceTypes -> {
                    Set<UUID> seen = new LinkedHashSet<>();
                    Flux<Selection<ContentType>> byId = Flux.fromIterable(nonNull(request.getContentTypeIds()))
                            .concatMap(id -> contentTypeRepository.getById(id)
                                    .map(type -> Objects.equals(type.getEnvironmentId(), source.getId())
                                            ? Selection.of(type)
                                            : Selection.<ContentType>failed(error(PromotionItemKind.CONTENT_TYPE, id,
                                                    ContentTypeEnvironmentMismatchException.notInEnvironment(id, source.getKey()))))
                                    .onErrorResume(RecordNotFoundException.class,
                                            e -> Mono.just(Selection.failed(error(PromotionItemKind.CONTENT_TYPE, id, e)))));
                    Flux<Selection<ContentType>> bySlug = Flux.fromIterable(nonNull(request.getContentTypeSlugs()))
                            .map(slug -> sourceTypes.stream()
                                    .filter(type -> type.getSlug().equalsIgnoreCase(slug.trim()))
                                    .findFirst()
                                    .map(Selection::of)
                                    .orElseGet(() -> Selection.failed(error(PromotionItemKind.CONTENT_TYPE, null,
                                            new RecordNotFoundException("ContentType", slug + "@" + source.getKey())))));
                    return byId.concatWith(bySlug)
                            .filter(selection -> selection.value() == null || seen.add(selection.value().getId()));
                });
    }

    private Mono<Selection<PromotionItem>> promoteType(Selection<ContentType> selection, PromoteEnvironmentRequest request,
                                                       Environment source, Environment target) {
        if (selection.error() != null) {
            return Mono.just(Selection.failed(selection.error()));
        }
        ContentType type = selection.value();
        return contentTypePromoter.promote(type, source, target, request.getOptions(), request.getActor(), request.getCancellation())
                .map(promotion -> Selection.of(promotion.item()))
                .onErrorResume(e -> Mono.just(Selection.failed(error(PromotionItemKind.CONTENT_TYPE, type.getId(), e))));
    }

    // === Content entries ===

    private Mono<Map<UUID, ContentType>> sourceTypesById(Environment source) {
        return contentTypeRepository.list(source.getId())
                .collectMap(ContentType::getId, type -> type, LinkedHashMap::new);
    }

    private Flux<Selection<ContentEntry>> selectContentEntries(PromoteEnvironmentRequest request, Environment source,
                                                               ContentType typeFilter) {
        boolean explicit = hasValues(request.getContentIds()) || hasValues(request.getContentSlugs());
        Flux<ContentEntry> sourceEntries = contentRepository.list(source.getId())
                .filter(entry -> typeFilter == null || Objects.equals(entry.getContentTypeId(), typeFilter.getId()));
        if (!explicit) {
            return sourceEntries.map(Selection::of);
        }
        return sourceEntries.collectList()
                .flatMapMany(candidates -> {
                    Set<UUID> seen = new LinkedHashSet<>();
                    Flux<Selection<ContentEntry>> byId = Flux.fromIterable(nonNull(request.getContentIds()))
                            .concatMap(id -> contentRepository.getById(id)
                                    .filter(entry -> typeFilter == null || Objects.equals(entry.getContentTypeId(), typeFilter.getId()))
                                    .map(entry -> Objects.equals(entry.getEnvironmentId(), source.getId())
                                            ? Selection.of(entry)
                                            : Selection.<ContentEntry>failed(error(PromotionItemKind.CONTENT_ENTRY, id,
                                                    new RecordNotFoundException("ContentEntry", id + "@" + source.getKey()))))
                                    .onErrorResume(RecordNotFoundException.class,
                                            e -> Mono.just(Selection.failed(error(PromotionItemKind.CONTENT_ENTRY, id, e)))));
                    Set<String> slugs = new LinkedHashSet<>();
                    nonNull(request.getContentSlugs()).forEach(slug -> slugs.add(slug.trim().toLowerCase(Locale.ROOT)));
                    Flux<Selection<ContentEntry>> bySlug = Flux.fromIterable(candidates)
                            .filter(entry -> slugs.contains(entry.getSlug().toLowerCase(Locale.ROOT)))
                            .map(Selection::of);
                    return byId.concatWith(bySlug)
                            .filter(selection -> selection.value() == null || seen.add(selection.value().getId()));
                });
    }

    private Mono<Selection<PromotionItem>> promoteEntry(Selection<ContentEntry> selection, Map<UUID, ContentType> typesById,
                                                        PromoteEnvironmentRequest request, Environment source, Environment target) {
        if (selection.error() != null) {
            return Mono.just(Selection.failed(selection.error()));
        }
        ContentEntry entry = selection.value();
        Mono<ContentType> sourceType = typesById.containsKey(entry.getContentTypeId())
                ? Mono.just(typesById.get(entry.getContentTypeId()))
                : contentTypeRepository.getById(entry.getContentTypeId());
        return sourceType
                .flatMap(type -> contentEntryPromoter.promote(entry, type, source, target,
                        request.getOptions(), request.getActor(), request.getCancellation()))
                .map(Selection::of)
                .onErrorResume(e -> Mono.just(Selection.failed(error(PromotionItemKind.CONTENT_ENTRY, entry.getId(), e))));
    }

    // === Helpers ===

    private static PromotionError error(PromotionItemKind kind, UUID sourceId, Throwable failure) {
        Exceptions.throwIfJvmFatal(failure);
        LyshraOpenCmsException e;
        if (failure instanceof LyshraOpenCmsException domain) {
            e = domain;
        } else {
            log.error("Unexpected failure promoting {} [{}]", kind.getObjectType(), sourceId, failure);
            e = new LyshraOpenCmsException(LyshraOpenCmsErrorKind.INTERNAL,
                    StringUtils.defaultIfBlank(failure.getMessage(), failure.getClass().getSimpleName()), failure);
        }
        if (e.getErrorKind() == LyshraOpenCmsErrorKind.CANCELLED) {
            log.debug("Skipping {} [{}]: promotion cancelled", kind.getObjectType(), sourceId);
        } else {
            log.warn("Failed to promote {} [{}]: {}", kind.getObjectType(), sourceId, e.getMessage());
        }
        return PromotionError.builder()
                .kind(kind)
                .sourceId(sourceId)
                .errorKind(e.getErrorKind())
                .error(e.getMessage())
                .build();
    }

    private static <T> List<T> nonNull(List<T> values) {
        return values == null ? List.of() : values.stream().filter(Objects::nonNull).toList();
    }

    private static boolean hasValues(List<?> values) {
        return values != null && values.stream().anyMatch(Objects::nonNull);
    }
}
