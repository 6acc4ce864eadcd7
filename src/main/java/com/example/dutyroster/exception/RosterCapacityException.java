package com.example.dutyroster.exception;

/**
 * The grid cannot hold the duties the secondary population must receive,
 * or there are not enough people to staff every room on a single day.
 */
public class RosterCapacityException extends BusinessException {

    public static final String ERROR_CODE = "ROSTER_CAPACITY";

    private final int totalPositions;
    private final int requiredPositions;

    public RosterCapacityException(String message, int totalPositions, int requiredPositions) {
        super(ERROR_CODE, message);
        this.totalPositions = totalPositions;
        this.requiredPositions = requiredPositions;
    }

    public int getTotalPositions() {
        return totalPositions;
    }

    public int getRequiredPositions() {
        return requiredPositions;
    }
}
