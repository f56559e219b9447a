package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

import java.util.UUID;

public class ContentVersionRequiredException extends LyshraOpenCmsException {

    public ContentVersionRequiredException(UUID contentId) {
        super(LyshraOpenCmsErrorKind.CONTENT_VERSION_REQUIRED, "Content entry [" + contentId
                + "] has no published version; set allowDraft to promote its latest draft");
    }
}
