package com.example.dutyroster.roster;

/**
 * Grid bounds and repair budgets for the engine.
 */
public class RosterPolicy {

    private final int minDays;
    private final int maxDays;
    private final int minRooms;
    private final int maxRooms;
    private final int swapBudget;
    private final int repairRounds;

    public static final RosterPolicy DEFAULT = builder().build();

    public RosterPolicy(int minDays, int maxDays, int minRooms, int maxRooms, int swapBudget, int repairRounds) {
        this.minDays = minDays;
        this.maxDays = maxDays;
        this.minRooms = minRooms;
        this.maxRooms = maxRooms;
        this.swapBudget = swapBudget;
        this.repairRounds = repairRounds;
    }

    public int getMinDays() { return minDays; }
    public int getMaxDays() { return maxDays; }
    public int getMinRooms() { return minRooms; }
    public int getMaxRooms() { return maxRooms; }
    public int getSwapBudget() { return swapBudget; }
    public int getRepairRounds() { return repairRounds; }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int minDays = 1;
        private int maxDays = 10;
        private int minRooms = 1;
        private int maxRooms = 20;
        private int swapBudget = 100;
        private int repairRounds = 3;

        public Builder dayRange(int min, int max) {
            this.minDays = min;
            this.maxDays = max;
            return this;
        }

        public Builder roomRange(int min, int max) {
            this.minRooms = min;
            this.maxRooms = max;
            return this;
        }

        public Builder swapBudget(int budget) {
            this.swapBudget = Math.max(0, budget);
            return this;
        }

        public Builder repairRounds(int rounds) {
            this.repairRounds = Math.max(1, rounds);
            return this;
        }

        public RosterPolicy build() {
            return new RosterPolicy(minDays, maxDays, minRooms, maxRooms, swapBudget, repairRounds);
        }
    }
}
