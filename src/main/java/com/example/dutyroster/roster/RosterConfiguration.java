package com.example.dutyroster.roster;

import com.example.dutyroster.exception.RosterCapacityException;
import com.example.dutyroster.exception.RosterConfigurationException;

import java.util.Arrays;

/**
 * Global numeric parameters of a run, derived from population sizes and the grid.
 */
public final class RosterConfiguration {

    private final int days;
    private final int rooms;
    private final int secondaryCount;
    private final int totalPositions;
    private final int secondaryDutyTarget;
    private final int totalSecondaryDuties;
    private final int totalPrimaryDuties;
    private final int minSecondaryPerDay;
    private final int[] primaryCeilings;

    private RosterConfiguration(int days, int rooms, int secondaryCount,
                                int secondaryDutyTarget, int totalPrimaryDuties, int[] primaryCeilings) {
        this.days = days;
        this.rooms = rooms;
        this.secondaryCount = secondaryCount;
        this.totalPositions = days * rooms * 2;
        this.secondaryDutyTarget = secondaryDutyTarget;
        this.totalSecondaryDuties = secondaryCount * secondaryDutyTarget;
        this.totalPrimaryDuties = totalPrimaryDuties;
        this.minSecondaryPerDay = totalSecondaryDuties / days;
        this.primaryCeilings = primaryCeilings;
    }

    /**
     * Validates the grid against {@code policy} and derives the run parameters.
     *
     * @throws RosterConfigurationException if the grid is out of bounds or a population is empty
     * @throws RosterCapacityException if the grid cannot hold the secondary duties, or a single
     *                                 day cannot be staffed
     */
    public static RosterConfiguration resolve(int primaryCount, int secondaryCount, int days, int rooms,
                                              RosterPolicy policy) {
        if (days < policy.getMinDays() || days > policy.getMaxDays()) {
            throw new RosterConfigurationException(String.format("days must be between %d and %d but was %d",
                    policy.getMinDays(), policy.getMaxDays(), days));
        }
        if (rooms < policy.getMinRooms() || rooms > policy.getMaxRooms()) {
            throw new RosterConfigurationException(String.format("rooms must be between %d and %d but was %d",
                    policy.getMinRooms(), policy.getMaxRooms(), rooms));
        }
        if (primaryCount <= 0) {
            throw new RosterConfigurationException("primary population is empty");
        }
        if (secondaryCount <= 0) {
            throw new RosterConfigurationException("secondary population is empty");
        }

        int totalPositions = days * rooms * 2;
        int target = Math.max(1, days - 1);
        int totalSecondary = secondaryCount * target;
        int totalPrimary = totalPositions - totalSecondary;
        if (totalPrimary < 0) {
            throw new RosterCapacityException(String.format(
                    "%d secondary people need %d duties but the grid only has %d positions",
                    secondaryCount, totalSecondary, totalPositions), totalPositions, totalSecondary);
        }
        if (primaryCount + secondaryCount < rooms * 2) {
            throw new RosterCapacityException(String.format(
                    "%d people cannot staff %d rooms on one day", primaryCount + secondaryCount, rooms),
                    rooms * 2, primaryCount + secondaryCount);
        }

        return new RosterConfiguration(days, rooms, secondaryCount, target, totalPrimary,
                stratifyCeilings(totalPrimary, primaryCount));
    }

    /**
     * Even split of {@code total} over {@code people}; the remainder goes one each to the
     * least senior people, so the table never decreases with rank.
     */
    static int[] stratifyCeilings(int total, int people) {
        int[] ceilings = new int[people];
        int base = total / people;
        int remainder = total % people;
        for (int rank = 0; rank < people; rank++) {
            ceilings[rank] = base + (rank >= people - remainder ? 1 : 0);
        }
        return ceilings;
    }

    public int getDays() { return days; }
    public int getRooms() { return rooms; }
    public int getSecondaryCount() { return secondaryCount; }
    public int getTotalPositions() { return totalPositions; }
    public int getSecondaryDutyTarget() { return secondaryDutyTarget; }
    public int getTotalSecondaryDuties() { return totalSecondaryDuties; }
    public int getTotalPrimaryDuties() { return totalPrimaryDuties; }
    public int getMinSecondaryPerDay() { return minSecondaryPerDay; }

    public int ceilingOf(int primaryRank) {
        return primaryCeilings[primaryRank];
    }

    public int[] getPrimaryCeilings() {
        return primaryCeilings.clone();
    }

    @Override
    public String toString() {
        return "RosterConfiguration{days=" + days + ", rooms=" + rooms
                + ", positions=" + totalPositions + ", secondaryTarget=" + secondaryDutyTarget
                + ", primaryDuties=" + totalPrimaryDuties + ", ceilings=" + Arrays.toString(primaryCeilings) + "}";
    }
}
