package com.lyshra.open.cms.core.engine.repository.impl;

import com.lyshra.open.cms.integration.contract.environment.IEnvironmentService;
import com.lyshra.open.cms.integration.exception.EnvironmentNotFoundException;
import com.lyshra.open.cms.integration.models.environment.Environment;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory environment directory. Keys are stored normalized.
 */
@Slf4j
public class InMemoryEnvironmentService implements IEnvironmentService {

    private final Map<UUID, Environment> environments = new ConcurrentHashMap<>();

    /**
     * Registers an active environment with a random id.
     */
    public Environment register(String key, String name) {
        Environment environment = Environment.builder()
                .id(UUID.randomUUID())
                .key(key)
                .name(name)
                .defaultEnvironment(Environment.DEFAULT_KEY.equals(Environment.normalizeKey(key)))
                .build();
        return register(environment);
    }

    public Environment register(Environment environment) {
        Environment stored = environment.toBuilder().key(Environment.normalizeKey(environment.getKey())).build();
        environments.put(stored.getId(), stored);
        log.info("Registered environment [{}] with id [{}]", stored.getKey(), stored.getId());
        return stored;
    }

    @Override
    public Mono<Environment> getEnvironment(UUID id) {
        return Mono.defer(() -> {
            Environment environment = id == null ? null : environments.get(id);
            if (environment == null || !environment.isActive()) {
                return Mono.error(new EnvironmentNotFoundException(String.valueOf(id)));
            }
            return Mono.just(environment);
        });
    }

    @Override
    public Mono<Environment> getEnvironmentByKey(String key) {
        return Mono.defer(() -> {
            String normalized = Environment.normalizeKey(key);
            return environments.values().stream()
                    .filter(Environment::isActive)
                    .filter(environment -> environment.getKey().equals(normalized))
                    .findFirst()
                    .map(Mono::just)
                    .orElseGet(() -> Mono.error(new EnvironmentNotFoundException(normalized)));
        });
    }

    @Override
    public Flux<Environment> listEnvironments() {
        return Flux.defer(() -> Flux.fromStream(environments.values().stream()
                .filter(Environment::isActive)
                .sorted(Comparator.comparing(Environment::getKey))));
    }
}
