package com.lyshra.open.cms.integration.exception;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;

/**
 * Raised by repositories when a looked-up record does not exist.
 */
public class RecordNotFoundException extends LyshraOpenCmsException {

    private final String recordType;
    private final String identifier;

    public RecordNotFoundException(String recordType, Object identifier) {
        super(LyshraOpenCmsErrorKind.NOT_FOUND, recordType + " not found: " + identifier);
        this.recordType = recordType;
        this.identifier = String.valueOf(identifier);
    }

    public String getRecordType() {
        return recordType;
    }

    public String getIdentifier() {
        return identifier;
    }
}
