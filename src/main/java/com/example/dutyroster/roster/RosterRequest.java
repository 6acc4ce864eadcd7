package com.example.dutyroster.roster;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record RosterRequest(
        @NotNull(message = "primary list is required") List<String> primary,
        @NotNull(message = "secondary list is required") List<String> secondary,
        @NotNull(message = "days is required") Integer days,
        @NotNull(message = "rooms is required") Integer rooms,
        List<@Valid Pin> pins,
        Long seed
) {

    public record Pin(
            @NotBlank(message = "personName is required") String personName,
            @NotNull(message = "day is required") Integer day
    ) {}

    public RosterInput toInput() {
        List<PinRequest> pinRequests = pins == null ? List.of()
                : pins.stream().map(p -> new PinRequest(p.personName(), p.day())).toList();
        return RosterInput.of(primary, secondary, days, rooms, pinRequests);
    }
}
