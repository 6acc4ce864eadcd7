package com.example.dutyroster.config;

import com.example.dutyroster.roster.RosterPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Engine settings bound from {@code roster.*} properties.
 */
@Component
public class RosterSettings {

    @Value("${roster.grid.min-days:1}")
    private int minDays;

    @Value("${roster.grid.max-days:10}")
    private int maxDays;

    @Value("${roster.grid.min-rooms:1}")
    private int minRooms;

    @Value("${roster.grid.max-rooms:20}")
    private int maxRooms;

    @Value("${roster.repair.swap-budget:100}")
    private int swapBudget;

    @Value("${roster.repair.rounds:3}")
    private int repairRounds;

    @Value("${roster.trials:4}")
    private int trials;

    public RosterPolicy toPolicy() {
        return RosterPolicy.builder()
                .dayRange(minDays, maxDays)
                .roomRange(minRooms, maxRooms)
                .swapBudget(swapBudget)
                .repairRounds(repairRounds)
                .build();
    }

    public int getTrials() {
        return Math.max(1, trials);
    }
}
