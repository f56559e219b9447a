package com.lyshra.open.cms.integration.models.activity;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.Map;

/**
 * Event describing an action taken on a content object, e.g. a promotion.
 */
@Data
@Builder
public class ActivityEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String verb;
    private final String actor;
    private final String objectType;
    private final String objectId;
    @Builder.Default
    private final Map<String, Object> metadata = Map.of();
    private final Instant occurredAt;

    public Map<String, Object> getMetadata() {
        return Collections.unmodifiableMap(metadata);
    }
}
