package com.example.dutyroster.roster;

import java.util.ArrayList;
import java.util.List;

/**
 * One room on one day. Holds up to two people; positions are reassigned in place by the
 * engine and never shared between two slots.
 */
public class Slot {

    private final int day;
    private final int room;
    private Person primary;
    private Person secondary;

    public Slot(int day, int room) {
        this.day = day;
        this.room = room;
    }

    public int getDay() { return day; }
    public int getRoom() { return room; }
    public Person getPrimary() { return primary; }
    public Person getSecondary() { return secondary; }

    public Person get(SlotPosition position) {
        return position == SlotPosition.PRIMARY ? primary : secondary;
    }

    void set(SlotPosition position, Person person) {
        if (position == SlotPosition.PRIMARY) {
            primary = person;
        } else {
            secondary = person;
        }
    }

    void swapPositions() {
        Person previous = primary;
        primary = secondary;
        secondary = previous;
    }

    public boolean isFilled() {
        return primary != null && secondary != null;
    }

    public boolean isEmpty() {
        return primary == null && secondary == null;
    }

    public boolean contains(Person person) {
        return person != null && (person.equals(primary) || person.equals(secondary));
    }

    /** Position held by {@code person}, or null if they are not in this slot. */
    public SlotPosition positionOf(Person person) {
        if (person == null) {
            return null;
        }
        if (person.equals(primary)) {
            return SlotPosition.PRIMARY;
        }
        if (person.equals(secondary)) {
            return SlotPosition.SECONDARY;
        }
        return null;
    }

    public List<Person> occupants() {
        List<Person> people = new ArrayList<>(2);
        if (primary != null) people.add(primary);
        if (secondary != null) people.add(secondary);
        return people;
    }

    @Override
    public String toString() {
        return "Slot{day=" + day + ", room=" + room + ", primary=" + primary + ", secondary=" + secondary + "}";
    }
}
