package com.lyshra.open.cms.integration.models.environment;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.Locale;
import java.util.UUID;

/**
 * Isolated namespace of content types and entries, e.g. staging or production.
 */
@Data
@Builder(toBuilder = true)
public class Environment implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_KEY = "default";

    private final UUID id;
    private final String key;
    private final String name;
    private final String description;
    @Builder.Default
    private final boolean active = true;
    private final boolean defaultEnvironment;

    /**
     * Lowercases and trims an environment key. Blank input yields an empty string.
     */
    public static String normalizeKey(String key) {
        return key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
    }
}
