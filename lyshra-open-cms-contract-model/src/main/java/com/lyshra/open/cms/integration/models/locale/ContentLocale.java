package com.lyshra.open.cms.integration.models.locale;

import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.UUID;

@Data
@Builder
public class ContentLocale implements Serializable {

    private static final long serialVersionUID = 1L;

    private final UUID id;
    private final String code;
    private final String displayName;
    @Builder.Default
    private final boolean active = true;
}
