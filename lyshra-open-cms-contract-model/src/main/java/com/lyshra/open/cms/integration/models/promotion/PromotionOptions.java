package com.lyshra.open.cms.integration.models.promotion;

import com.lyshra.open.cms.integration.enumerations.PromotionMode;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;

/**
 * Toggles controlling content type and content entry promotion.
 * Options that only apply to entries are ignored by content type promotion.
 */
@Data
@Builder(toBuilder = true)
public class PromotionOptions implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Validate and report without writing anything.
     */
    private final boolean dryRun;
    /**
     * Allow promoting an older source schema over a newer target schema.
     */
    private final boolean force;
    private final boolean allowBreakingChanges;
    private final boolean promoteAsActive;
    /**
     * Permit promoting draft content types and draft entry versions.
     */
    private final boolean allowDraft;

    @Builder.Default
    private final boolean preferPublished = true;
    @Builder.Default
    private final boolean migrateOnPromote = true;
    /**
     * Copy every other source version as draft versions of the target entry.
     */
    private final boolean includeVersions;
    @Builder.Default
    private final PromotionMode mode = PromotionMode.STRICT;
    /**
     * Promote the owning content type first when the target lacks it.
     */
    private final boolean autoPromoteType;
    private final boolean promoteAsPublished;

    public static PromotionOptions defaults() {
        return PromotionOptions.builder().build();
    }
}
