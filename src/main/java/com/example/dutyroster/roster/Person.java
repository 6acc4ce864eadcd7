package com.example.dutyroster.roster;

/**
 * A rostered person. {@code rank} is the zero-based position in the input list of the
 * person's population; lower means more senior.
 */
public record Person(String name, Population population, int rank) {

    public boolean isPrimary() {
        return population == Population.PRIMARY;
    }

    public boolean isSecondary() {
        return population == Population.SECONDARY;
    }

    public boolean isSeniorTo(Person other) {
        return population == other.population && rank < other.rank;
    }

    @Override
    public String toString() {
        return name;
    }
}
