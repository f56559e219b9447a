package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class BlockDefinitionNotFoundException extends LyshraOpenCmsException {

    private final String slug;

    public BlockDefinitionNotFoundException(String slug, String environmentKey) {
        super(LyshraOpenCmsErrorKind.BLOCK_DEFINITION_NOT_FOUND,
                "Block definition [" + slug + "] not found in environment [" + environmentKey + "]");
        this.slug = slug;
    }

    public String getSlug() {
        return slug;
    }
}
