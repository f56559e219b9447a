package com.lyshra.open.cms.integration.exception;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;

/**
 * Raised when an environment is unknown or inactive.
 */
public class EnvironmentNotFoundException extends LyshraOpenCmsException {

    private final String reference;

    public EnvironmentNotFoundException(String reference) {
        super(LyshraOpenCmsErrorKind.ENVIRONMENT_NOT_FOUND, "Environment not found or inactive: " + reference);
        this.reference = reference;
    }

    public String getReference() {
        return reference;
    }
}
