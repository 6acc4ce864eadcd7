package com.example.dutyroster.exception;

import java.util.List;

/**
 * Rejected pin requests. Carries every issue found, not only the first one.
 */
public class PinValidationException extends BusinessException {

    public static final String ERROR_CODE = "PIN_VALIDATION";

    private final List<String> issues;

    public PinValidationException(List<String> issues) {
        super(ERROR_CODE, "Pin validation failed: " + String.join("; ", issues));
        this.issues = List.copyOf(issues);
    }

    public List<String> getIssues() {
        return issues;
    }
}
