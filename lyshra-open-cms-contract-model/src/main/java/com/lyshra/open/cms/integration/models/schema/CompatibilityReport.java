package com.lyshra.open.cms.integration.models.schema;

import com.lyshra.open.cms.integration.enumerations.SchemaChangeLevel;
import lombok.Builder;
import lombok.Data;

import java.io.Serializable;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of comparing an old schema to a new one.
 * Advisory: callers decide whether breaking changes block an operation.
 */
@Data
@Builder
public class CompatibilityReport implements Serializable {

    private static final long serialVersionUID = 1L;

    @Builder.Default
    private final List<String> additions = List.of();
    @Builder.Default
    private final List<String> removals = List.of();
    @Builder.Default
    private final List<SchemaChange> changes = List.of();
    @Builder.Default
    private final SchemaChangeLevel changeLevel = SchemaChangeLevel.NONE;

    public List<SchemaChange> getBreakingChanges() {
        return changes.stream().filter(SchemaChange::isBreaking).collect(Collectors.toList());
    }

    public boolean hasBreakingChanges() {
        return changes.stream().anyMatch(SchemaChange::isBreaking);
    }

    public boolean isCompatible() {
        return !hasBreakingChanges();
    }

    public static CompatibilityReport identical() {
        return CompatibilityReport.builder().build();
    }
}
