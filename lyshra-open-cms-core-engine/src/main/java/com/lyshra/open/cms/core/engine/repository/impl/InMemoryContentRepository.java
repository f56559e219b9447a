package com.lyshra.open.cms.core.engine.repository.impl;

import com.lyshra.open.cms.integration.contract.repository.IContentRepository;
import com.lyshra.open.cms.integration.exception.RecordConflictException;
import com.lyshra.open.cms.integration.exception.RecordNotFoundException;
import com.lyshra.open.cms.integration.models.content.ContentEntry;
import com.lyshra.open.cms.integration.models.content.ContentTranslation;
import com.lyshra.open.cms.integration.models.content.ContentVersion;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory store for content entries, translations and versions.
 *
 * <p>Enforces unique entry slugs per (environment, content type) and unique version numbers
 * per entry. Entries are returned with their current translations attached. The snapshot of a
 * stored version is never replaced by {@link #updateVersion}.</p>
 */
@Slf4j
public class InMemoryContentRepository implements IContentRepository {

    private static final String ENTRY = "ContentEntry";
    private static final String VERSION = "ContentVersion";

    // entryId -> entry (translations held separately)
    private final Map<UUID, ContentEntry> entries;
    // entryId -> translations
    private final Map<UUID, List<ContentTranslation>> translations;
    // entryId -> (version number -> version)
    private final Map<UUID, NavigableMap<Integer, ContentVersion>> versions;

    private final ReadWriteLock lock;
    private final AtomicLong writeCount;
    private final Clock clock;
    private final Supplier<UUID> idGenerator;

    public InMemoryContentRepository() {
        this(Clock.systemUTC(), UUID::randomUUID);
    }

    public InMemoryContentRepository(Clock clock, Supplier<UUID> idGenerator) {
        this.entries = new ConcurrentHashMap<>();
        this.translations = new ConcurrentHashMap<>();
        this.versions = new ConcurrentHashMap<>();
        this.lock = new ReentrantReadWriteLock();
        this.writeCount = new AtomicLong();
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    // ===== Entries =====

    @Override
    public Mono<ContentEntry> getById(UUID id) {
        return Mono.defer(() -> {
            lock.readLock().lock();
            try {
                ContentEntry entry = entries.get(id);
                return entry != null ? Mono.just(withTranslations(entry)) : Mono.error(new RecordNotFoundException(ENTRY, id));
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentEntry> getBySlug(String slug, UUID contentTypeId, UUID environmentId) {
        return Mono.defer(() -> {
            lock.readLock().lock();
            try {
                return entries.values().stream()
                        .filter(entry -> sameKey(entry, slug, contentTypeId, environmentId))
                        .findFirst()
                        .map(entry -> Mono.just(withTranslations(entry)))
                        .orElseGet(() -> Mono.error(new RecordNotFoundException(ENTRY, slug + "@" + environmentId)));
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Flux<ContentEntry> list(UUID environmentId) {
        return Flux.defer(() -> {
            lock.readLock().lock();
            try {
                List<ContentEntry> matches = entries.values().stream()
                        .filter(entry -> Objects.equals(entry.getEnvironmentId(), environmentId))
                        .sorted(Comparator.comparing(ContentEntry::getSlug))
                        .map(this::withTranslations)
                        .toList();
                return Flux.fromIterable(matches);
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentEntry> create(ContentEntry entry) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                boolean taken = entries.values().stream()
                        .anyMatch(existing -> sameKey(existing, entry.getSlug(), entry.getContentTypeId(), entry.getEnvironmentId()));
                if (taken) {
                    throw new RecordConflictException(ENTRY, entry.getSlug(), "slug already exists for content type");
                }
                Instant now = clock.instant();
                UUID id = entry.getId() != null ? entry.getId() : idGenerator.get();
                ContentEntry stored = entry.toBuilder()
                        .id(id)
                        .translations(List.of())
                        .createdAt(entry.getCreatedAt() != null ? entry.getCreatedAt() : now)
                        .updatedAt(now)
                        .build();
                entries.put(id, stored);
                translations.put(id, assignTranslationIds(id, entry.getTranslations()));
                writeCount.incrementAndGet();
                log.info("Created content entry [{}] in environment [{}]", stored.getSlug(), stored.getEnvironmentId());
                return withTranslations(stored);
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentEntry> update(ContentEntry entry) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                ContentEntry existing = entries.get(entry.getId());
                if (existing == null) {
                    throw new RecordNotFoundException(ENTRY, entry.getId());
                }
                ContentEntry stored = entry.toBuilder()
                        .translations(List.of())
                        .createdAt(existing.getCreatedAt())
                        .updatedAt(clock.instant())
                        .build();
                entries.put(stored.getId(), stored);
                writeCount.incrementAndGet();
                log.debug("Updated content entry [{}] to current version [{}]", stored.getSlug(), stored.getCurrentVersion());
                return withTranslations(stored);
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public Mono<List<ContentTranslation>> replaceTranslations(UUID contentId, List<ContentTranslation> replacement) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                if (!entries.containsKey(contentId)) {
                    throw new RecordNotFoundException(ENTRY, contentId);
                }
                List<ContentTranslation> stored = assignTranslationIds(contentId, replacement);
                translations.put(contentId, stored);
                writeCount.incrementAndGet();
                log.debug("Replaced [{}] translations of content entry [{}]", stored.size(), contentId);
                return stored;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    // ===== Versions =====

    @Override
    public Flux<ContentVersion> listVersions(UUID contentId) {
        return Flux.defer(() -> {
            lock.readLock().lock();
            try {
                NavigableMap<Integer, ContentVersion> entryVersions = versions.get(contentId);
                return entryVersions == null ? Flux.empty() : Flux.fromIterable(new ArrayList<>(entryVersions.values()));
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentVersion> getVersion(UUID contentId, int version) {
        return Mono.defer(() -> {
            lock.readLock().lock();
            try {
                NavigableMap<Integer, ContentVersion> entryVersions = versions.get(contentId);
                ContentVersion found = entryVersions == null ? null : entryVersions.get(version);
                return found != null ? Mono.just(found) : Mono.error(new RecordNotFoundException(VERSION, contentId + "#" + version));
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentVersion> getLatestVersion(UUID contentId) {
        return Mono.defer(() -> {
            lock.readLock().lock();
            try {
                NavigableMap<Integer, ContentVersion> entryVersions = versions.get(contentId);
                return entryVersions == null || entryVersions.isEmpty()
                        ? Mono.error(new RecordNotFoundException(VERSION, contentId + "#latest"))
                        : Mono.just(entryVersions.lastEntry().getValue());
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentVersion> createVersion(ContentVersion version) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                if (!entries.containsKey(version.getContentEntryId())) {
                    throw new RecordNotFoundException(ENTRY, version.getContentEntryId());
                }
                NavigableMap<Integer, ContentVersion> entryVersions =
                        versions.computeIfAbsent(version.getContentEntryId(), k -> new TreeMap<>());
                if (entryVersions.containsKey(version.getVersion())) {
                    throw new RecordConflictException(VERSION, version.getContentEntryId() + "#" + version.getVersion(),
                            "version number already exists");
                }
                ContentVersion stored = version.toBuilder()
                        .id(version.getId() != null ? version.getId() : idGenerator.get())
                        .createdAt(version.getCreatedAt() != null ? version.getCreatedAt() : clock.instant())
                        .build();
                entryVersions.put(stored.getVersion(), stored);
                writeCount.incrementAndGet();
                log.debug("Created version [{}] of content entry [{}] with status [{}]",
                        stored.getVersion(), stored.getContentEntryId(), stored.getStatus());
                return stored;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentVersion> updateVersion(ContentVersion version) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                NavigableMap<Integer, ContentVersion> entryVersions = versions.get(version.getContentEntryId());
                ContentVersion existing = entryVersions == null ? null : entryVersions.get(version.getVersion());
                if (existing == null) {
                    throw new RecordNotFoundException(VERSION, version.getContentEntryId() + "#" + version.getVersion());
                }
                ContentVersion stored = existing.toBuilder()
                        .status(version.getStatus())
                        .publishedAt(version.getPublishedAt())
                        .publishedBy(version.getPublishedBy())
                        .build();
                entryVersions.put(stored.getVersion(), stored);
                writeCount.incrementAndGet();
                log.debug("Moved version [{}] of content entry [{}] to [{}]",
                        stored.getVersion(), stored.getContentEntryId(), stored.getStatus());
                return stored;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    /**
     * @return number of successful mutating calls
     */
    public long getWriteCount() {
        return writeCount.get();
    }

    private ContentEntry withTranslations(ContentEntry entry) {
        return entry.toBuilder().translations(translations.getOrDefault(entry.getId(), List.of())).build();
    }

    private List<ContentTranslation> assignTranslationIds(UUID contentId, List<ContentTranslation> source) {
        List<ContentTranslation> stored = new ArrayList<>();
        if (source != null) {
            for (ContentTranslation translation : source) {
                stored.add(translation.toBuilder()
                        .id(translation.getId() != null ? translation.getId() : idGenerator.get())
                        .contentId(contentId)
                        .build());
            }
        }
        return List.copyOf(stored);
    }

    private static boolean sameKey(ContentEntry entry, String slug, UUID contentTypeId, UUID environmentId) {
        return Objects.equals(entry.getEnvironmentId(), environmentId)
                && Objects.equals(entry.getContentTypeId(), contentTypeId)
                && Objects.equals(entry.getSlug(), slug);
    }
}
