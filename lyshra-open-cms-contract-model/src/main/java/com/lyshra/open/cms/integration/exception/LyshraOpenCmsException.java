package com.lyshra.open.cms.integration.exception;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;

/**
 * Base exception for every failure raised by the content engine.
 * Callers branch on {@link #getErrorKind()} rather than on concrete types.
 */
public class LyshraOpenCmsException extends RuntimeException {

    private final LyshraOpenCmsErrorKind errorKind;

    public LyshraOpenCmsException(LyshraOpenCmsErrorKind errorKind, String message) {
        super(message);
        this.errorKind = errorKind;
    }

    public LyshraOpenCmsException(LyshraOpenCmsErrorKind errorKind, String message, Throwable cause) {
        super(message, cause);
        this.errorKind = errorKind;
    }

    public LyshraOpenCmsErrorKind getErrorKind() {
        return errorKind;
    }

    public String getErrorCode() {
        return errorKind.getErrorCode();
    }
}
