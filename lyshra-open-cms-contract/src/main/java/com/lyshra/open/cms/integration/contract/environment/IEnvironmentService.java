package com.lyshra.open.cms.integration.contract.environment;

import com.lyshra.open.cms.integration.models.environment.Environment;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Resolves environments. Only active environments are returned; unknown or inactive
 * ones emit {@link com.lyshra.open.cms.integration.exception.EnvironmentNotFoundException}.
 */
public interface IEnvironmentService {

    Mono<Environment> getEnvironment(UUID id);

    /**
     * @param key environment key, normalized (trimmed, lowercased) before lookup
     */
    Mono<Environment> getEnvironmentByKey(String key);

    Flux<Environment> listEnvironments();
}
