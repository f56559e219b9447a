package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class ContentTypeInactiveException extends LyshraOpenCmsException {

    public ContentTypeInactiveException(String slug) {
        super(LyshraOpenCmsErrorKind.CONTENT_TYPE_INACTIVE,
                "Content type [" + slug + "] is not active; set allowDraft to promote it");
    }
}
