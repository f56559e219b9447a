package com.lyshra.open.cms.integration.contract.block;

import com.lyshra.open.cms.integration.models.block.BlockDefinition;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Block definition catalogue, consulted when a content type schema references block slugs.
 */
public interface IBlockDefinitionService {

    Flux<BlockDefinition> listDefinitions(String environmentKey);

    Mono<BlockDefinition> registerDefinition(BlockDefinition definition);

    Mono<BlockDefinition> updateDefinition(BlockDefinition definition);
}
