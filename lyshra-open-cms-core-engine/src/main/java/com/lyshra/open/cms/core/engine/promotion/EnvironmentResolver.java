package com.lyshra.open.cms.core.engine.promotion;

import com.lyshra.open.cms.integration.contract.environment.IEnvironmentService;
import com.lyshra.open.cms.integration.models.environment.Environment;
import lombok.RequiredArgsConstructor;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Resolves an environment reference given as an id, a key, or a key that is itself a UUID.
 *
 * <p>An explicit id wins. A key that parses as a UUID is looked up as an id. Any other key is
 * normalized; a blank key selects the default environment key.</p>
 */
@RequiredArgsConstructor
public class EnvironmentResolver {

    private final IEnvironmentService environmentService;
    private final String defaultEnvironmentKey;

    public Mono<Environment> resolve(UUID id, String key) {
        if (id != null) {
            return environmentService.getEnvironment(id);
        }
        String trimmed = key == null ? "" : key.trim();
        UUID parsed = parseUuid(trimmed);
        if (parsed != null) {
            return environmentService.getEnvironment(parsed);
        }
        String normalized = Environment.normalizeKey(trimmed);
        return environmentService.getEnvironmentByKey(normalized.isEmpty() ? defaultEnvironmentKey : normalized);
    }

    private static UUID parseUuid(String value) {
        if (value.length() != 36) {
            return null;
        }
        try {
            return UUID.fromString(value);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
