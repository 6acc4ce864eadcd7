package com.example.dutyroster.roster;

/**
 * Obligation to put {@code personName} in some room on {@code day} (1-based).
 */
public record PinRequest(String personName, int day) {
}
