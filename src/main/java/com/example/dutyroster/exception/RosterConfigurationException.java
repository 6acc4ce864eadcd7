package com.example.dutyroster.exception;

/**
 * Grid size outside the supported bounds, an empty population, or an unusable person list.
 */
public class RosterConfigurationException extends BusinessException {

    public static final String ERROR_CODE = "ROSTER_CONFIG";

    public RosterConfigurationException(String message) {
        super(ERROR_CODE, message);
    }
}
