package com.lyshra.open.cms.integration.contract.content;

import com.lyshra.open.cms.integration.models.content.ContentVersion;
import com.lyshra.open.cms.integration.models.content.request.CreateDraftRequest;
import com.lyshra.open.cms.integration.models.content.request.PublishDraftRequest;
import com.lyshra.open.cms.integration.models.content.request.RestoreVersionRequest;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Versioned snapshot store for content entries.
 *
 * <p>Versions are numbered from 1 without gaps, their snapshots are immutable and an entry
 * has at most one published version.</p>
 */
public interface IContentVersionService {

    /**
     * Appends a draft version. Untagged payloads are stamped with the content type's schema version.
     */
    Mono<ContentVersion> createDraft(CreateDraftRequest request);

    /**
     * Publishes a draft. Payloads authored against an older schema are migrated and validated
     * first; the migrated snapshot is written as a new published version and the previously
     * published version is archived.
     *
     * @return the new published version
     */
    Mono<ContentVersion> publishDraft(PublishDraftRequest request);

    Flux<ContentVersion> listVersions(UUID contentId);

    /**
     * Copies the snapshot of an existing version into a new draft version.
     */
    Mono<ContentVersion> restoreVersion(RestoreVersionRequest request);
}
