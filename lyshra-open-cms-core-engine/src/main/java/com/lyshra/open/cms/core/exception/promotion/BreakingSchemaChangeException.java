package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;
import com.lyshra.open.cms.integration.models.schema.CompatibilityReport;
import com.lyshra.open.cms.integration.models.schema.SchemaChange;

import java.util.stream.Collectors;

public class BreakingSchemaChangeException extends LyshraOpenCmsException {

    private final String slug;
    private final CompatibilityReport report;

    public BreakingSchemaChangeException(String slug, CompatibilityReport report) {
        super(LyshraOpenCmsErrorKind.BREAKING_SCHEMA_CHANGE, "Breaking schema change for content type [" + slug + "]: "
                + report.getBreakingChanges().stream()
                        .map(change -> change.getType() + " " + change.getPath())
                        .collect(Collectors.joining(", ")));
        this.slug = slug;
        this.report = report;
    }

    public String getSlug() {
        return slug;
    }

    public CompatibilityReport getReport() {
        return report;
    }

    public boolean involves(String path) {
        return report.getBreakingChanges().stream().map(SchemaChange::getPath).anyMatch(path::equals);
    }
}
