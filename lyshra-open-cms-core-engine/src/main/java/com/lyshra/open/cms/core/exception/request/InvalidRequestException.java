package com.lyshra.open.cms.core.exception.request;

import com.lyshra.open.cms.integration.enumerations.LyshraOpenCmsErrorKind;
import com.lyshra.open.cms.integration.exception.LyshraOpenCmsException;

import java.util.List;

/**
 * Thrown when a request fails bean validation or a precondition such as a disabled capability.
 */
public class InvalidRequestException extends LyshraOpenCmsException {

    private final List<String> violations;

    public InvalidRequestException(String message) {
        this(message, List.of());
    }

    public InvalidRequestException(String message, List<String> violations) {
        super(LyshraOpenCmsErrorKind.INVALID_REQUEST, violations.isEmpty()
                ? message
                : message + ": " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
