package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class SlugExistsException extends LyshraOpenCmsException {

    private final String slug;

    public SlugExistsException(String slug, String environmentKey) {
        super(LyshraOpenCmsErrorKind.SLUG_EXISTS, "Content entry [" + slug + "] already exists in environment ["
                + environmentKey + "]; use MERGE mode to update it");
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
