package com.example.dutyroster.roster;

public enum SlotPosition {
    PRIMARY,
    SECONDARY
}
