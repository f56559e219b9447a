package com.lyshra.open.cms.integration.exception;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;

/**
 * Raised by repositories when a create or update violates a uniqueness constraint,
 * e.g. a racing create of the same slug in one environment.
 */
public class RecordConflictException extends LyshraOpenCmsException {

    private final String recordType;
    private final String identifier;

    public RecordConflictException(String recordType, Object identifier, String reason) {
        super(LyshraOpenCmsErrorKind.CONFLICT, recordType + " conflict [" + identifier + "]: " + reason);
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
