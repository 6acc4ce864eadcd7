package com.example.dutyroster.roster;

/**
 * Result of placing one pin. {@code room} is null when the pin could not be honoured.
 */
public record PinOutcome(String personName, int day, boolean satisfied, Integer room) {

    static PinOutcome placed(PinRequest pin, int room) {
        return new PinOutcome(pin.personName(), pin.day(), true, room);
    }

    static PinOutcome unsatisfied(PinRequest pin) {
        return new PinOutcome(pin.personName(), pin.day(), false, null);
    }
}
