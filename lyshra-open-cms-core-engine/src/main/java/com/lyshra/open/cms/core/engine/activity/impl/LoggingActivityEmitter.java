package com.lyshra.open.cms.core.engine.activity.impl;

import com.lyshra.open.cms.core.engine.document.DocumentCodec;
import com.lyshra.open.cms.integration.contract.activity.IActivityEmitter;
import com.lyshra.open.cms.integration.models.activity.ActivityEvent;
import com.lyshra.open.cms.integration.models.document.Document;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Writes activity events to the application log as single-line JSON metadata.
 */
@Slf4j
public class LoggingActivityEmitter implements IActivityEmitter {

    private LoggingActivityEmitter() {
    }

    private static final class SingletonHelper {
        private static final LoggingActivityEmitter INSTANCE = new LoggingActivityEmitter();
    }

    public static IActivityEmitter getInstance() {
        return SingletonHelper.INSTANCE;
    }

    @Override
    public Mono<Void> emit(ActivityEvent event) {
        return Mono.fromRunnable(() -> log.info("Activity [{}] by [{}] on {} [{}] at [{}]: {}",
                event.getVerb(),
                event.getActor(),
                event.getObjectType(),
                event.getObjectId(),
                event.getOccurredAt(),
                DocumentCodec.toJson(Document.from(event.getMetadata()))));
    }
}
