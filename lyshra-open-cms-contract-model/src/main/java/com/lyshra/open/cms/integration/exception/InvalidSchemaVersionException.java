package com.lyshra.open.cms.integration.exception;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;

/**
 * Thrown when a schema version string cannot be parsed.
 */
public class InvalidSchemaVersionException extends LyshraOpenCmsException {

    private final String input;

    public InvalidSchemaVersionException(String input, String reason) {
        super(LyshraOpenCmsErrorKind.INVALID_FORMAT, "Invalid schema version [" + input + "]: " + reason);
        this.input = input;
    }

    public String getInput() {
        return input;
    }
}
