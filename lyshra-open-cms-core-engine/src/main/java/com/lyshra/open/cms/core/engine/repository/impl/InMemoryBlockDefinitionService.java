package com.lyshra.open.cms.core.engine.repository.impl;

import com.lyshra.open.cms.integration.contract.block.IBlockDefinitionService;
import com.lyshra.open.cms.integration.exception.RecordConflictException;
import com.lyshra.open.cms.integration.exception.RecordNotFoundException;
import com.lyshra.open.cms.integration.models.block.BlockDefinition;
import com.lyshra.open.cms.integration.models.environment.Environment;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory block definition catalogue. Slugs are unique per environment key, ignoring case.
 */
@Slf4j
public class InMemoryBlockDefinitionService implements IBlockDefinitionService {

    private static final String RECORD_TYPE = "BlockDefinition";

    private final Map<UUID, BlockDefinition> definitions = new ConcurrentHashMap<>();
    private final AtomicLong writeCount = new AtomicLong();

    @Override
    public Flux<BlockDefinition> listDefinitions(String environmentKey) {
        return Flux.defer(() -> {
            String key = Environment.normalizeKey(environmentKey);
            List<BlockDefinition> matches = definitions.values().stream()
                    .filter(definition -> Environment.normalizeKey(definition.getEnvironmentKey()).equals(key))
                    .sorted(Comparator.comparing(BlockDefinition::getSlug))
                    .toList();
            return Flux.fromIterable(matches);
        });
    }

    @Override
    public Mono<BlockDefinition> registerDefinition(BlockDefinition definition) {
        return Mono.fromCallable(() -> {
            synchronized (definitions) {
                String key = Environment.normalizeKey(definition.getEnvironmentKey());
                boolean taken = definitions.values().stream()
                        .anyMatch(existing -> Environment.normalizeKey(existing.getEnvironmentKey()).equals(key)
                                && existing.getSlug().equalsIgnoreCase(definition.getSlug()));
                if (taken) {
                    throw new RecordConflictException(RECORD_TYPE, definition.getSlug(), "slug already exists in environment");
                }
                BlockDefinition stored = definition.toBuilder()
                        .id(definition.getId() != null ? definition.getId() : UUID.randomUUID())
                        .environmentKey(key)
                        .build();
                definitions.put(stored.getId(), stored);
                writeCount.incrementAndGet();
                log.info("Registered block definition [{}] in environment [{}]", stored.getSlug(), key);
                return stored;
            }
        });
    }

    @Override
    public Mono<BlockDefinition> updateDefinition(BlockDefinition definition) {
        return Mono.fromCallable(() -> {
            synchronized (definitions) {
                if (definition.getId() == null || !definitions.containsKey(definition.getId())) {
                    throw new RecordNotFoundException(RECORD_TYPE, definition.getId());
                }
                BlockDefinition stored = definition.toBuilder()
                        .environmentKey(Environment.normalizeKey(definition.getEnvironmentKey()))
                        .build();
                definitions.put(stored.getId(), stored);
                writeCount.incrementAndGet();
                log.info("Updated block definition [{}] in environment [{}]", stored.getSlug(), stored.getEnvironmentKey());
                return stored;
            }
        });
    }

    public long getWriteCount() {
        return writeCount.get();
    }
}
