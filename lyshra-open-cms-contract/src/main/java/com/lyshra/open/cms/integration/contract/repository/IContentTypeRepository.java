package com.lyshra.open.cms.integration.contract.repository;

import com.lyshra.open.cms.integration.models.content.ContentType;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Storage for content types.
 *
 * <p>Lookups of absent records emit {@link com.lyshra.open.cms.integration.exception.RecordNotFoundException}.
 * Slugs are unique per environment; a create that collides emits
 * {@link com.lyshra.open.cms.integration.exception.RecordConflictException}.</p>
 */
public interface IContentTypeRepository {

    Mono<ContentType> getById(UUID id);

    /**
     * @param slug          content type slug
     * @param environmentId owning environment
     * @return the type, or a not-found error
     */
    Mono<ContentType> getBySlug(String slug, UUID environmentId);

    Flux<ContentType> list(UUID environmentId);

    /**
     * Persists a new content type. Timestamps and id are assigned when absent.
     *
     * @param contentType type to create
     * @return stored type
     */
    Mono<ContentType> create(ContentType contentType);

    /**
     * Replaces an existing content type.
     *
     * @param contentType type with the id of an existing record
     * @return stored type
     */
    Mono<ContentType> update(ContentType contentType);
}
