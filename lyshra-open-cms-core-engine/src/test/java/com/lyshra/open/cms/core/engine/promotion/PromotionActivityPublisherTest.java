package com.lyshra.open.cms.core.engine.promotion;

import com.lyshra.open.cms.core.engine.activity.impl.InMemoryActivityEmitter;
import com.lyshra.open.cms.integration.enumerations.PromotionItemKind;
import com.lyshra.open.cms.integration.enumerations.PromotionMode;
import com.lyshra.open.cms.integration.models.activity.ActivityEvent;
import com.lyshra.open.cms.integration.models.environment.Environment;
import com.lyshra.open.cms.integration.models.promotion.PromotionOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PromotionActivityPublisherTest {

    private static final Instant NOW = Instant.parse("2026-03-02T09:30:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final Environment staging = Environment.builder().id(UUID.randomUUID()).key("staging").name("Staging").build();
    private final Environment production = Environment.builder().id(UUID.randomUUID()).key("production").name("Production").build();

    @Test
    @DisplayName("should describe the promotion in the event metadata")
    void shouldPublishEvent() {
        // Given
        InMemoryActivityEmitter emitter = new InMemoryActivityEmitter();
        PromotionActivityPublisher publisher = new PromotionActivityPublisher(emitter, clock);
        UUID targetId = UUID.randomUUID();
        PromotionOptions options = PromotionOptions.builder().mode(PromotionMode.MERGE).promoteAsPublished(true).build();

        // When
        publisher.publish(PromotionItemKind.CONTENT_ENTRY, targetId, "release-bot", staging, production, options).block();

        // Then
        assertEquals(1, emitter.getEvents().size());
        ActivityEvent event = emitter.getEvents().get(0);
        assertEquals("promote", event.getVerb());
        assertEquals("release-bot", event.getActor());
        assertEquals("content_entry", event.getObjectType());
        assertEquals(targetId.toString(), event.getObjectId());
        assertEquals(NOW, event.getOccurredAt());
        assertEquals("merge", event.getMetadata().get(PromotionActivityPublisher.PROMOTION_MODE));
        assertEquals("staging", event.getMetadata().get(PromotionActivityPublisher.SOURCE_ENVIRONMENT_KEY));
        assertEquals(production.getId().toString(), event.getMetadata().get(PromotionActivityPublisher.TARGET_ENVIRONMENT_ID));
        assertEquals(Boolean.TRUE, event.getMetadata().get(PromotionActivityPublisher.PROMOTE_AS_PUBLISHED));
        assertEquals(Boolean.FALSE, event.getMetadata().get(PromotionActivityPublisher.PROMOTE_AS_ACTIVE));
    }

    @Test
    @DisplayName("should swallow emitter errors, including ones thrown while subscribing")
    void shouldIgnoreEmitterFailures() {
        PromotionActivityPublisher failing = new PromotionActivityPublisher(
                event -> Mono.error(new IllegalStateException("sink down")), clock);
        PromotionActivityPublisher throwing = new PromotionActivityPublisher(event -> {
            throw new IllegalStateException("sink down");
        }, clock);

        StepVerifier.create(failing.publish(PromotionItemKind.CONTENT_TYPE, UUID.randomUUID(), "a", staging, production,
                        PromotionOptions.builder().build()))
                .verifyComplete();
        StepVerifier.create(throwing.publish(PromotionItemKind.CONTENT_TYPE, UUID.randomUUID(), "a", staging, production,
                        PromotionOptions.builder().build()))
                .verifyComplete();
    }

    @Test
    @DisplayName("should publish nothing without an emitter")
    void shouldSkipWithoutEmitter() {
        StepVerifier.create(new PromotionActivityPublisher(null, clock).publish(PromotionItemKind.CONTENT_TYPE,
                        UUID.randomUUID(), "a", staging, production, PromotionOptions.builder().build()))
                .verifyComplete();
    }
}
