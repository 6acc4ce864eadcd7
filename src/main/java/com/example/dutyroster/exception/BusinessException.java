package com.example.dutyroster.exception;

/**
 * Base of the roster error taxonomy. Every failure that aborts a generation run
 * before any assignment is made is reported through a subclass of this type.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;

    public BusinessException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BusinessException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
