package com.lyshra.open.cms.integration.models.content;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.UUID;

/**
 * Locale-specific record attached to a content entry.
 */
@Data
@Builder(toBuilder = true)
public class ContentTranslation implements Serializable {

    private static final long serialVersionUID = 1L;

    private final UUID id;
    private final UUID contentId;
    private final UUID localeId;
    private final String localeCode;
    private final UUID translationGroupId;
    private final String title;
    private final String summary;
    private final VersionedPayload content;
}
