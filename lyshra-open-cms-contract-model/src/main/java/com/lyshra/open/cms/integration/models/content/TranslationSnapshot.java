package com.lyshra.open.cms.integration.models.content;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;

/**
 * Per-locale part of a content snapshot.
 */
@Data
@Builder(toBuilder = true)
public class TranslationSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    @NotBlank
    private final String locale;
    private final String title;
    private final String summary;
    @NotNull
    private final VersionedPayload content;
}
