package com.lyshra.open.cms.integration.contract.repository;

import com.lyshra.open.cms.integration.models.content.ContentEntry;
import com.lyshra.open.cms.integration.models.content.ContentTranslation;
import com.lyshra.open.cms.integration.models.content.ContentVersion;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.UUID;

/**
 * Storage for content entries, their translations and their versions.
 *
 * <p>Lookups of absent records emit {@link com.lyshra.open.cms.integration.exception.RecordNotFoundException}.
 * Unique constraints:</p>
 * <ul>
 *   <li>entry slug per (environment, content type)</li>
 *   <li>version number per entry</li>
 * </ul>
 * <p>Violations emit {@link com.lyshra.open.cms.integration.exception.RecordConflictException}.</p>
 */
public interface IContentRepository {

    // ===== Entries =====

    Mono<ContentEntry> getById(UUID id);

    Mono<ContentEntry> getBySlug(String slug, UUID contentTypeId, UUID environmentId);

    Flux<ContentEntry> list(UUID environmentId);

    Mono<ContentEntry> create(ContentEntry entry);

    /**
     * Replaces entry bookkeeping (versions, status, timestamps). Translations are left untouched;
     * use {@link #replaceTranslations}.
     */
    Mono<ContentEntry> update(ContentEntry entry);

    /**
     * Replaces every translation of an entry.
     *
     * @param contentId    entry id
     * @param translations new translations
     * @return stored translations
     */
    Mono<List<ContentTranslation>> replaceTranslations(UUID contentId, List<ContentTranslation> translations);

    // ===== Versions =====

    /**
     * @param contentId entry id
     * @return versions ordered by version number ascending
     */
    Flux<ContentVersion> listVersions(UUID contentId);

    Mono<ContentVersion> getVersion(UUID contentId, int version);

    Mono<ContentVersion> getLatestVersion(UUID contentId);

    /**
     * Appends a version. Fails with a conflict when the number is already taken.
     */
    Mono<ContentVersion> createVersion(ContentVersion version);

    /**
     * Updates a version's status fields. The snapshot of a stored version is never replaced.
     */
    Mono<ContentVersion> updateVersion(ContentVersion version);
}
