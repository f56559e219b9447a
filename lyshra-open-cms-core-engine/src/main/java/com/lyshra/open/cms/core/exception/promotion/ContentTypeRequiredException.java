package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

/**
 * Thrown when an operation needs a content type that is missing, e.g. the target environment
 * lacks the entry's type and auto-promotion is off, or entry slugs were given without a type filter.
 */
public class ContentTypeRequiredException extends LyshraOpenCmsException {

    public ContentTypeRequiredException(String message) {
        super(LyshraOpenCmsErrorKind.CONTENT_TYPE_REQUIRED, message);
    }

    public static ContentTypeRequiredException missingInTarget(String slug, String environmentKey) {
        return new ContentTypeRequiredException("Content type [" + slug + "] does not exist in environment ["
                + environmentKey + "]; promote it first or enable autoPromoteType");
    }

    public static ContentTypeRequiredException forSlugFilter() {
        return new ContentTypeRequiredException("Content entry slugs require a content type id or slug filter");
    }
}
