package com.lyshra.open.cms.core.engine.promotion;

import com.lyshra.open.cms.core.engine.schema.NormalizedSchema;
import com.lyshra.open.cms.core.engine.schema.SchemaMetadataCodec;
import com.lyshra.open.cms.core.engine.schema.SchemaVersions;
import com.lyshra.open.cms.core.exception.promotion.BlockDefinitionNotFoundException;
import com.lyshra.open.cms.core.exception.request.InvalidRequestException;
import com.lyshra.open.cms.integration.contract.block.IBlockDefinitionService;
import com.lyshra.open.cms.integration.models.block.BlockDefinition;
import com.lyshra.open.cms.integration.models.document.Document;
import com.lyshra.open.cms.integration.models.environment.Environment;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Copies the block definitions a content type schema references into the target environment.
 *
 * <p>Referenced slugs are the schema's block allow-list, or its deny-list when no allow-list is
 * set. Each must exist in the source environment. Its schema is stamped with a version under the
 * block's own slug, then registered in the target or updated in place when the slug already exists
 * there.</p>
 */
@Slf4j
public class BlockDefinitionPromoter {

    private final IBlockDefinitionService blockDefinitionService;

    /**
     * @param blockDefinitionService block catalogue, or null when none is available
     */
    public BlockDefinitionPromoter(IBlockDefinitionService blockDefinitionService) {
        this.blockDefinitionService = blockDefinitionService;
    }

    /**
     * With {@code dryRun} set, every lookup and check still runs but nothing is registered or updated.
     *
     * @return the promoted (or, in a dry run, promotable) block slugs, in reference order
     */
    public Mono<List<String>> promote(Document.ObjectValue contentTypeSchema, Environment source, Environment target,
                                      boolean dryRun) {
        List<String> slugs = SchemaMetadataCodec.extract(contentTypeSchema).getBlockAvailability().referencedSlugs();
        if (slugs.isEmpty()) {
            return Mono.just(List.of());
        }
        if (blockDefinitionService == null) {
            return Mono.error(new InvalidRequestException("Content type references blocks " + slugs
                    + " but no block definition service is configured"));
        }
        return Mono.zip(index(source.getKey()), index(target.getKey()))
                .flatMap(indexes -> Flux.fromIterable(slugs)
                        .concatMap(slug -> promoteOne(slug, indexes.getT1(), indexes.getT2(), source, target, dryRun))
                        .collectList());
    }

    private Mono<String> promoteOne(String slug, Map<String, BlockDefinition> sourceIndex, Map<String, BlockDefinition> targetIndex,
                                    Environment source, Environment target, boolean dryRun) {
        String key = slug.toLowerCase(Locale.ROOT);
        BlockDefinition definition = sourceIndex.get(key);
        if (definition == null) {
            return Mono.error(new BlockDefinitionNotFoundException(slug, source.getKey()));
        }
        NormalizedSchema schema = SchemaVersions.normalize(definition);
        BlockDefinition existing = targetIndex.get(key);
        if (dryRun) {
            log.debug("Dry run: block definition [{}] would be {} in environment [{}]",
                    definition.getSlug(), existing != null ? "updated" : "registered", target.getKey());
            return Mono.just(definition.getSlug());
        }
        if (existing != null) {
            BlockDefinition updated = definition.toBuilder()
                    .id(existing.getId())
                    .schema(schema.schema())
                    .schemaVersion(schema.versionString())
                    .environmentKey(target.getKey())
                    .build();
            return blockDefinitionService.updateDefinition(updated)
                    .doOnNext(stored -> log.info("Updated block definition [{}] in environment [{}]", stored.getSlug(), target.getKey()))
                    .thenReturn(definition.getSlug());
        }
        BlockDefinition created = definition.toBuilder()
                .id(null)
                .schema(schema.schema())
                .schemaVersion(schema.versionString())
                .environmentKey(target.getKey())
                .build();
        return blockDefinitionService.registerDefinition(created)
                .doOnNext(stored -> log.info("Registered block definition [{}] in environment [{}]", stored.getSlug(), target.getKey()))
                .thenReturn(definition.getSlug());
    }

    private Mono<Map<String, BlockDefinition>> index(String environmentKey) {
        return blockDefinitionService.listDefinitions(environmentKey)
                .collectList()
                .map(definitions -> definitions.stream().collect(Collectors.toMap(
                        definition -> definition.getSlug().toLowerCase(Locale.ROOT),
                        Function.identity(),
                        (first, second) -> first)));
    }
}
