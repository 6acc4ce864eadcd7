package com.example.dutyroster.roster;

/**
 * Orders the two occupants of a slot. A primary-population member always takes the primary
 * position over a secondary-population member; within one population the more senior person
 * leads. A lone occupant is moved to the primary position.
 */
public class PositionResolver {

    public void resolve(Slot slot) {
        if (!isOrdered(slot)) {
            slot.swapPositions();
        }
    }

    public boolean isOrdered(Slot slot) {
        Person first = slot.getPrimary();
        Person second = slot.getSecondary();
        if (first == null) {
            return second == null;
        }
        if (second == null) {
            return true;
        }
        return !leads(second, first);
    }

    /** True if {@code a} belongs in the primary position when paired with {@code b}. */
    static boolean leads(Person a, Person b) {
        if (a.population() != b.population()) {
            return a.isPrimary();
        }
        return a.rank() < b.rank();
    }
}
