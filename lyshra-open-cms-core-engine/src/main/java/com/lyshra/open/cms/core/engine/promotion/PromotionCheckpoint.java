package com.lyshra.open.cms.core.engine.promotion;

import com.lyshra.open.cms.core.exception.promotion.PromotionCancelledException;
import com.lyshra.open.cms.integration.models.promotion.PromotionCancellation;
import reactor.core.publisher.Mono;

/**
 * Cancellation checks placed between repository calls.
 */
public final class PromotionCheckpoint {

    private PromotionCheckpoint() {
        // Utility class
    }

    /**
     * @return an empty Mono, or a {@link PromotionCancelledException} when the token is tripped
     */
    public static Mono<Void> check(PromotionCancellation cancellation) {
        return Mono.defer(() -> cancellation != null && cancellation.isCancelled()
                ? Mono.error(new PromotionCancelledException(cancellation.getReason()))
                : Mono.empty());
    }

    /**
     * Runs {@code next} only if the token is not tripped.
     */
    public static <T> Mono<T> then(PromotionCancellation cancellation, Mono<T> next) {
        return check(cancellation).then(next);
    }
}
