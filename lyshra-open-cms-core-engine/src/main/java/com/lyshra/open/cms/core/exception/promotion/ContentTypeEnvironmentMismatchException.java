package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class ContentTypeEnvironmentMismatchException extends LyshraOpenCmsException {

    public ContentTypeEnvironmentMismatchException(String message) {
        super(LyshraOpenCmsErrorKind.CONTENT_TYPE_ENVIRONMENT_MISMATCH, message);
    }

    public static ContentTypeEnvironmentMismatchException notInEnvironment(Object contentTypeId, String environmentKey) {
        return new ContentTypeEnvironmentMismatchException(
                "Content type [" + contentTypeId + "] does not belong to environment [" + environmentKey + "]");
    }

    public static ContentTypeEnvironmentMismatchException filterMismatch(Object contentTypeId, String slug) {
        return new ContentTypeEnvironmentMismatchException(
                "Content type filter id [" + contentTypeId + "] and slug [" + slug + "] name different types");
    }
}
