package com.example.dutyroster.roster;

import java.util.IntSummaryStatistics;
import java.util.List;

/**
 * Duty distribution per population.
 */
public record RosterStatistics(PopulationStats primary, PopulationStats secondary) {

    public record PopulationStats(double average, int min, int max) {

        static PopulationStats of(List<DutyCountDto> duties) {
            if (duties.isEmpty()) {
                return new PopulationStats(0, 0, 0);
            }
            IntSummaryStatistics stats = duties.stream().mapToInt(DutyCountDto::dutyCount).summaryStatistics();
            double average = Math.round(stats.getAverage() * 100.0) / 100.0;
            return new PopulationStats(average, stats.getMin(), stats.getMax());
        }
    }

    public static RosterStatistics from(RosterResult result) {
        return new RosterStatistics(
                PopulationStats.of(result.primaryDuties()),
                PopulationStats.of(result.secondaryDuties()));
    }
}
