package com.lyshra.open.cms.core.engine.promotion;

import com.lyshra.open.cms.integration.contract.activity.IActivityEmitter;
import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import com.lyshra.open.cms.integration.models.activity.ActivityEvent;
import com.lyshra.open.cms.integration.models.environment.Environment;
import com.lyshra.open.cms.integration.models.promotion.PromotionOptions;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Emits {@code promote} activity events. Emitter failures are logged and never fail the promotion.
 */
@Slf4j
public class PromotionActivityPublisher {

    public static final String VERB_PROMOTE = "promote";

    public static final String SOURCE_ENVIRONMENT_ID = "source_environment_id";
    public static final String SOURCE_ENVIRONMENT_KEY = "source_environment_key";
    public static final String TARGET_ENVIRONMENT_ID = "target_environment_id";
    public static final String TARGET_ENVIRONMENT_KEY = "target_environment_key";
    public static final String PROMOTION_MODE = "promotion_mode";
    public static final String PROMOTE_AS_ACTIVE = "promote_as_active";
    public static final String PROMOTE_AS_PUBLISHED = "promote_as_published";

    private final IActivityEmitter emitter;
    private final Clock clock;

    /**
     * @param emitter activity emitter, or null to publish nothing
     */
    public PromotionActivityPublisher(IActivityEmitter emitter, Clock clock) {
        this.emitter = emitter;
        this.clock = clock;
    }

    public Mono<Void> publish(PromotionItemKind kind, UUID targetId, String actor,
                              Environment source, Environment target, PromotionOptions options) {
        if (emitter == null) {
            return Mono.empty();
        }
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(SOURCE_ENVIRONMENT_ID, String.valueOf(source.getId()));
        metadata.put(SOURCE_ENVIRONMENT_KEY, source.getKey());
        metadata.put(TARGET_ENVIRONMENT_ID, String.valueOf(target.getId()));
        metadata.put(TARGET_ENVIRONMENT_KEY, target.getKey());
        metadata.put(PROMOTION_MODE, options.getMode().name().toLowerCase(Locale.ROOT));
        metadata.put(PROMOTE_AS_ACTIVE, options.isPromoteAsActive());
        metadata.put(PROMOTE_AS_PUBLISHED, options.isPromoteAsPublished());

        ActivityEvent event = ActivityEvent.builder()
                .verb(VERB_PROMOTE)
                .actor(actor)
                .objectType(kind.getObjectType())
                .objectId(String.valueOf(targetId))
                .metadata(metadata)
                .occurredAt(clock.instant())
                .build();
        return Mono.defer(() -> emitter.emit(event))
                .onErrorResume(e -> {
                    log.warn("Failed to emit promotion activity for {} [{}]: {}", kind.getObjectType(), targetId, e.getMessage());
                    return Mono.empty();
                });
    }
}
