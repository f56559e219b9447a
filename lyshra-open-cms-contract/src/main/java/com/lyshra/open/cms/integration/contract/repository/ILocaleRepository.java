package com.lyshra.open.cms.integration.contract.repository;

import com.lyshra.open.cms.integration.models.locale.ContentLocale;
import reactor.core.publisher.Mono;

public interface ILocaleRepository {

    /**
     * @param code locale code, e.g. {@code en} or {@code pt-BR}; matched case-insensitively
     * @return the locale, or a not-found error
     */
    Mono<ContentLocale> getByCode(String code);
}
