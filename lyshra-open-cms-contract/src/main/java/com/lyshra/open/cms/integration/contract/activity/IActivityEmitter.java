package com.lyshra.open.cms.integration.contract.activity;

import com.lyshra.open.cms.integration.models.activity.ActivityEvent;
import reactor.core.publisher.Mono;

/**
 * Receives activity events. Callers treat emission as fire-and-forget and never
 * fail an operation because of an emitter error.
 */
public interface IActivityEmitter {

    Mono<Void> emit(ActivityEvent event);
}
