package com.lyshra.open.cms.integration.models.promotion;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Caller-owned cancellation signal checked between repository calls.
 * Tripping it aborts the item in progress, not the whole batch.
 */
public final class PromotionCancellation {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private volatile String reason;

    public static PromotionCancellation create() {
        return new PromotionCancellation();
    }

    public void cancel(String reason) {
        this.reason = reason;
        cancelled.set(true);
    }

    public void cancel() {
        cancel("cancelled by caller");
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String getReason() {
        return reason;
    }
}
