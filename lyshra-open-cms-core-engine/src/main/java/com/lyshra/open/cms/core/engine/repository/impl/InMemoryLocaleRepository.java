package com.lyshra.open.cms.core.engine.repository.impl;

import com.lyshra.open.cms.integration.contract.repository.ILocaleRepository;
import com.lyshra.open.cms.integration.exception.RecordNotFoundException;
import com.lyshra.open.cms.integration.models.locale.ContentLocale;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory locale catalogue keyed by lowercased code. Inactive locales are not returned.
 */
@Slf4j
public class InMemoryLocaleRepository implements ILocaleRepository {

    private final Map<String, ContentLocale> locales = new ConcurrentHashMap<>();

    public ContentLocale register(String code, String displayName) {
        ContentLocale locale = ContentLocale.builder()
                .id(UUID.randomUUID())
                .code(code)
                .displayName(displayName)
                .build();
        register(locale);
        return locale;
    }

    public void register(ContentLocale locale) {
        locales.put(normalize(locale.getCode()), locale);
        log.debug("Registered locale [{}]", locale.getCode());
    }

    @Override
    public Mono<ContentLocale> getByCode(String code) {
        return Mono.defer(() -> {
            ContentLocale locale = locales.get(normalize(code));
            if (locale == null || !locale.isActive()) {
                return Mono.error(new RecordNotFoundException("Locale", code));
            }
            return Mono.just(locale);
        });
    }

    private static String normalize(String code) {
        return code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
    }
}
