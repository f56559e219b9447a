package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class TargetAheadOfSourceException extends LyshraOpenCmsException {

    private final String slug;
    private final String targetVersion;
    private final String sourceVersion;

    public TargetAheadOfSourceException(String slug, String targetVersion, String sourceVersion) {
        super(LyshraOpenCmsErrorKind.TARGET_AHEAD_OF_SOURCE, "Target schema [" + targetVersion
                + "] of content type [" + slug + "] is ahead of source [" + sourceVersion + "]");
        this.slug = slug;
        this.targetVersion = targetVersion;
        this.sourceVersion = sourceVersion;
    }

    public String getSlug() {
        return slug;
    }

    public String getTargetVersion() {
        return targetVersion;
    }

    public String getSourceVersion() {
        return sourceVersion;
    }
}
