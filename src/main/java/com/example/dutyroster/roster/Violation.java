package com.example.dutyroster.roster;

/**
 * One validator finding. {@code day}, {@code room} and {@code person} are null when they do
 * not apply to the finding.
 */
public record Violation(ViolationType type, Integer day, Integer room, String person, String message) {
}
