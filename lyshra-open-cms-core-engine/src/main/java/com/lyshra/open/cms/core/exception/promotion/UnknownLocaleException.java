package com.lyshra.open.cms.core.exception.promotion;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

public class UnknownLocaleException extends LyshraOpenCmsException {

    private final String locale;

    public UnknownLocaleException(String locale) {
        super(LyshraOpenCmsErrorKind.UNKNOWN_LOCALE, "Unknown locale [" + locale + "]");
        this.locale = locale;
    }

    public UnknownLocaleException(String locale, Throwable cause) {
        super(LyshraOpenCmsErrorKind.UNKNOWN_LOCALE, "Unknown locale [" + locale + "]", cause);
        this.locale = locale;
    }

    public String getLocale() {
        return locale;
    }
}
