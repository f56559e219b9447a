package com.lyshra.open.cms.integration.models.promotion;

import com.lyshra.open.cms.integration.models.environment.Environment;
import lombok.Builder;
import lombok.Data;

import java.util.UUID;

@Data
@Builder
public class EnvironmentRef {

    private final UUID id;
    private final String key;
    private final String name;

    public static EnvironmentRef of(Environment environment) {
        return EnvironmentRef.builder()
                .id(environment.getId())
                .key(environment.getKey())
                .name(environment.getName())
                .build();
    }
}
