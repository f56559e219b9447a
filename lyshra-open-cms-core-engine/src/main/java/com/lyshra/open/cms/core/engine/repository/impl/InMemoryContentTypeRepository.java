package com.lyshra.open.cms.core.engine.repository.impl;

import com.lyshra.open.cms.integration.contract.repository.IContentTypeRepository;
import com.lyshra.open.cms.integration.exception.RecordConflictException;
import com.lyshra.open.cms.integration.exception.RecordNotFoundException;
import com.lyshra.open.cms.integration.models.content.ContentType;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;

/**
 * In-memory content type store. Slugs are unique per environment.
 *
 * <p>Thread-safe: writes hold the write lock so the uniqueness check and the insert are atomic.</p>
 */
@Slf4j
public class InMemoryContentTypeRepository implements IContentTypeRepository {

    private static final String RECORD_TYPE = "ContentType";

    private final Map<UUID, ContentType> types;
    private final ReadWriteLock lock;
    private final AtomicLong writeCount;
    private final Clock clock;
    private final Supplier<UUID> idGenerator;

    public InMemoryContentTypeRepository() {
        this(Clock.systemUTC(), UUID::randomUUID);
    }

    public InMemoryContentTypeRepository(Clock clock, Supplier<UUID> idGenerator) {
        this.types = new ConcurrentHashMap<>();
        this.lock = new ReentrantReadWriteLock();
        this.writeCount = new AtomicLong();
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    @Override
    public Mono<ContentType> getById(UUID id) {
        return Mono.defer(() -> {
            ContentType type = types.get(id);
            return type != null ? Mono.just(type) : Mono.error(new RecordNotFoundException(RECORD_TYPE, id));
        });
    }

    @Override
    public Mono<ContentType> getBySlug(String slug, UUID environmentId) {
        return Mono.defer(() -> {
            lock.readLock().lock();
            try {
                return types.values().stream()
                        .filter(type -> Objects.equals(type.getEnvironmentId(), environmentId))
                        .filter(type -> Objects.equals(type.getSlug(), slug))
                        .findFirst()
                        .map(Mono::just)
                        .orElseGet(() -> Mono.error(new RecordNotFoundException(RECORD_TYPE, slug + "@" + environmentId)));
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Flux<ContentType> list(UUID environmentId) {
        return Flux.defer(() -> {
            lock.readLock().lock();
            try {
                List<ContentType> matches = types.values().stream()
                        .filter(type -> Objects.equals(type.getEnvironmentId(), environmentId))
                        .sorted(Comparator.comparing(ContentType::getSlug))
                        .toList();
                return Flux.fromIterable(matches);
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentType> create(ContentType contentType) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                ensureSlugAvailable(contentType, null);
                Instant now = clock.instant();
                ContentType stored = contentType.toBuilder()
                        .id(contentType.getId() != null ? contentType.getId() : idGenerator.get())
                        .createdAt(contentType.getCreatedAt() != null ? contentType.getCreatedAt() : now)
                        .updatedAt(now)
                        .build();
                if (types.containsKey(stored.getId())) {
                    throw new RecordConflictException(RECORD_TYPE, stored.getId(), "id already exists");
                }
                types.put(stored.getId(), stored);
                writeCount.incrementAndGet();
                log.info("Created content type [{}] in environment [{}]", stored.getSlug(), stored.getEnvironmentId());
                return stored;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    @Override
    public Mono<ContentType> update(ContentType contentType) {
        return Mono.fromCallable(() -> {
            lock.writeLock().lock();
            try {
                ContentType existing = types.get(contentType.getId());
                if (existing == null) {
                    throw new RecordNotFoundException(RECORD_TYPE, contentType.getId());
                }
                ensureSlugAvailable(contentType, contentType.getId());
                ContentType stored = contentType.toBuilder()
                        .createdAt(existing.getCreatedAt())
                        .updatedAt(clock.instant())
                        .build();
                types.put(stored.getId(), stored);
                writeCount.incrementAndGet();
                log.info("Updated content type [{}] in environment [{}]", stored.getSlug(), stored.getEnvironmentId());
                return stored;
            } finally {
                lock.writeLock().unlock();
            }
        });
    }

    private void ensureSlugAvailable(ContentType candidate, UUID ownId) {
        boolean taken = types.values().stream()
                .filter(type -> !type.getId().equals(ownId))
                .anyMatch(type -> Objects.equals(type.getEnvironmentId(), candidate.getEnvironmentId())
                        && Objects.equals(type.getSlug(), candidate.getSlug()));
        if (taken) {
            throw new RecordConflictException(RECORD_TYPE, candidate.getSlug(), "slug already exists in environment");
        }
    }

    /**
     * @return number of successful create and update calls
     */
    public long getWriteCount() {
        return writeCount.get();
    }
}
