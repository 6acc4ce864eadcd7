package com.example.dutyroster.roster;

public enum Population {
    /** Preferentially occupies the primary slot of a room; duty ceilings stratified by seniority. */
    PRIMARY,
    /** Must end a run with an exact duty count. */
    SECONDARY
}
