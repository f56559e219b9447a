package com.lyshra.open.cms.integration.models.schema;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Allow and deny lists of block slugs a content type schema accepts.
 * Lists are normalized on construction: trimmed, blank entries dropped, case-insensitive duplicates removed.
 */
@Data
public class BlockAvailability implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final BlockAvailability NONE = new BlockAvailability(List.of(), List.of());

    private final List<String> allow;
    private final List<String> deny;

    @Builder
    public BlockAvailability(List<String> allow, List<String> deny) {
        this.allow = normalize(allow);
        this.deny = normalize(deny);
    }

    public static BlockAvailability none() {
        return NONE;
    }

    public boolean isEmpty() {
        return allow.isEmpty() && deny.isEmpty();
    }

    /**
     * Deny wins over allow; an empty allow list admits every block not denied.
     */
    public boolean allows(String blockSlug) {
        if (blockSlug == null) {
            return false;
        }
        String candidate = blockSlug.trim();
        if (containsIgnoreCase(deny, candidate)) {
            return false;
        }
        return allow.isEmpty() || containsIgnoreCase(allow, candidate);
    }

    /**
     * Block slugs a promotion must carry over: the allow list, or the deny list when nothing is allowed explicitly.
     */
    public List<String> referencedSlugs() {
        return allow.isEmpty() ? deny : allow;
    }

    private static boolean containsIgnoreCase(List<String> values, String candidate) {
        for (String value : values) {
            if (value.equalsIgnoreCase(candidate)) {
                return true;
            }
        }
        return false;
    }

    private static List<String> normalize(List<String> values) {
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new LinkedHashSet<>();
        List<String> result = new ArrayList<>();
        for (String value : values) {
            if (value == null) {
                continue;
            }
            String trimmed = value.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                result.add(trimmed);
            }
        }
        return Collections.unmodifiableList(result);
    }
}
