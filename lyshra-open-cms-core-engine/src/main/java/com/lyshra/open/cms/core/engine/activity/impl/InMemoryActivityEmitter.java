package com.lyshra.open.cms.core.engine.activity.impl;

import com.lyshra.open.cms.integration.contract.activity.IActivityEmitter;
import com.lyshra.open.cms.integration.models.activity.ActivityEvent;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Keeps emitted activity events in memory, in emission order.
 * Suitable for development and testing.
 */
@Slf4j
public class InMemoryActivityEmitter implements IActivityEmitter {

    private final List<ActivityEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public Mono<Void> emit(ActivityEvent event) {
        return Mono.fromRunnable(() -> {
            events.add(event);
            log.debug("Recorded activity [{}] on {} [{}]", event.getVerb(), event.getObjectType(), event.getObjectId());
        });
    }

    public List<ActivityEvent> getEvents() {
        return List.copyOf(events);
    }

    public void clear() {
        events.clear();
    }
}
