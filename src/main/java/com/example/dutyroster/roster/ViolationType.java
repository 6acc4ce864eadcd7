package com.example.dutyroster.roster;

public enum ViolationType {
    UNFILLED_POSITION,
    DUPLICATE_OCCUPANT,
    DOUBLE_BOOKING,
    CONSECUTIVE_ROOM,
    DUTY_TOTAL_MISMATCH,
    SECONDARY_TARGET_DEVIATION,
    SENIORITY_VIOLATION,
    PIN_UNSATISFIED,
    POSITION_ORDER
}
