package com.example.dutyroster.roster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Mutable state of one run. Every placement and removal goes through {@link #place} and
 * {@link #vacate} so that counters, room history and per-day sets stay consistent with the
 * matrix. Owned by a single run and never shared between threads.
 */
public class ConstraintTracker {

    private final RosterConfiguration configuration;
    private final AssignmentMatrix matrix;
    private final List<Person> primary;
    private final List<Person> secondary;
    private final List<Person> everyone;

    private final Map<Person, Integer> dutyCounts = new LinkedHashMap<>();
    private final Map<Person, TreeMap<Integer, Integer>> roomsByDay = new HashMap<>();
    private final List<Set<Person>> assignedByDay = new ArrayList<>();
    private final List<Set<Integer>> occupiedRooms = new ArrayList<>();
    private final Map<Person, Set<Integer>> protectedDays = new HashMap<>();

    public ConstraintTracker(RosterConfiguration configuration, AssignmentMatrix matrix,
                             List<Person> primary, List<Person> secondary) {
        this.configuration = configuration;
        this.matrix = matrix;
        this.primary = List.copyOf(primary);
        this.secondary = List.copyOf(secondary);
        List<Person> all = new ArrayList<>(primary);
        all.addAll(secondary);
        this.everyone = Collections.unmodifiableList(all);
        everyone.forEach(p -> {
            dutyCounts.put(p, 0);
            roomsByDay.put(p, new TreeMap<>());
        });
        for (int day = 0; day <= matrix.getDays(); day++) {
            assignedByDay.add(new HashSet<>());
            occupiedRooms.add(new HashSet<>());
        }
    }

    public RosterConfiguration getConfiguration() { return configuration; }
    public AssignmentMatrix getMatrix() { return matrix; }
    public List<Person> getPrimary() { return primary; }
    public List<Person> getSecondary() { return secondary; }
    public List<Person> getEveryone() { return everyone; }

    // --- mutation ---

    public void place(Slot slot, SlotPosition position, Person person) {
        if (slot.get(position) != null) {
            throw new IllegalStateException(position + " of " + slot + " is already taken");
        }
        if (isAssignedOn(person, slot.getDay())) {
            throw new IllegalStateException(person + " is already assigned on day " + slot.getDay());
        }
        slot.set(position, person);
        dutyCounts.merge(person, 1, Integer::sum);
        roomsByDay.get(person).put(slot.getDay(), slot.getRoom());
        assignedByDay.get(slot.getDay()).add(person);
        occupiedRooms.get(slot.getDay()).add(slot.getRoom());
    }

    public Person vacate(Slot slot, SlotPosition position) {
        Person person = slot.get(position);
        if (person == null) {
            return null;
        }
        slot.set(position, null);
        dutyCounts.merge(person, -1, Integer::sum);
        roomsByDay.get(person).remove(slot.getDay());
        assignedByDay.get(slot.getDay()).remove(person);
        if (slot.isEmpty()) {
            occupiedRooms.get(slot.getDay()).remove(slot.getRoom());
        }
        return person;
    }

    /** Replaces {@code outgoing} by {@code incoming} in the same position of {@code slot}. */
    public void substitute(Slot slot, Person outgoing, Person incoming) {
        SlotPosition position = slot.positionOf(outgoing);
        if (position == null) {
            throw new IllegalStateException(outgoing + " is not in " + slot);
        }
        vacate(slot, position);
        place(slot, position, incoming);
    }

    public void protect(Person person, int day) {
        protectedDays.computeIfAbsent(person, p -> new HashSet<>()).add(day);
    }

    // --- queries ---

    public boolean isProtected(Person person, int day) {
        Set<Integer> days = protectedDays.get(person);
        return days != null && days.contains(day);
    }

    public int dutyCount(Person person) {
        return dutyCounts.getOrDefault(person, 0);
    }

    public boolean isAssignedOn(Person person, int day) {
        return day >= 1 && day < assignedByDay.size() && assignedByDay.get(day).contains(person);
    }

    /** Room of {@code person} on {@code day}, or null. */
    public Integer roomOn(Person person, int day) {
        TreeMap<Integer, Integer> rooms = roomsByDay.get(person);
        return rooms == null ? null : rooms.get(day);
    }

    public boolean wasInRoom(Person person, int room, int day) {
        Integer actual = roomOn(person, day);
        return actual != null && actual == room;
    }

    /** True if {@code person} holds {@code room} on the day before or after {@code day}. */
    public boolean conflictsWithNeighbours(Person person, int day, int room) {
        return wasInRoom(person, room, day - 1) || wasInRoom(person, room, day + 1);
    }

    public boolean isRoomOccupied(int day, int room) {
        return occupiedRooms.get(day).contains(room);
    }

    /** Hard constraints only: free that day and no same-room repeat with a neighbouring day. */
    public boolean canTake(Person person, Slot slot) {
        return !isAssignedOn(person, slot.getDay())
                && !conflictsWithNeighbours(person, slot.getDay(), slot.getRoom());
    }

    /** Ceiling for primary people, exact target for secondary people. */
    public int dutyCap(Person person) {
        return person.isPrimary()
                ? configuration.ceilingOf(person.rank())
                : configuration.getSecondaryDutyTarget();
    }

    public boolean isUnderCap(Person person) {
        return dutyCount(person) < dutyCap(person);
    }

    public int secondaryCountOn(int day) {
        return (int) assignedByDay.get(day).stream().filter(Person::isSecondary).count();
    }

    public int remainingSecondaryDemand() {
        int assigned = secondary.stream().mapToInt(this::dutyCount).sum();
        return Math.max(0, configuration.getTotalSecondaryDuties() - assigned);
    }

    /** Slots currently holding {@code person}, by ascending day. */
    public List<Slot> slotsOf(Person person) {
        List<Slot> slots = new ArrayList<>();
        roomsByDay.get(person).forEach((day, room) -> slots.add(matrix.slot(day, room)));
        return slots;
    }

    public int openRoomsOn(int day) {
        return (int) matrix.slotsOn(day).stream().filter(slot -> !slot.isFilled()).count();
    }
}
