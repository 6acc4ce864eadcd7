package com.example.dutyroster.roster;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The {@code days × rooms} grid of slots. Days and rooms are 1-based.
 */
public class AssignmentMatrix {

    private final int days;
    private final int rooms;
    private final Slot[][] slots;

    public AssignmentMatrix(int days, int rooms) {
        this.days = days;
        this.rooms = rooms;
        this.slots = new Slot[days][rooms];
        for (int d = 0; d < days; d++) {
            for (int r = 0; r < rooms; r++) {
                slots[d][r] = new Slot(d + 1, r + 1);
            }
        }
    }

    public int getDays() { return days; }
    public int getRooms() { return rooms; }

    public Slot slot(int day, int room) {
        return slots[day - 1][room - 1];
    }

    public List<Slot> slotsOn(int day) {
        return List.of(slots[day - 1]);
    }

    /** All slots, by day then room. */
    public List<Slot> all() {
        List<Slot> all = new ArrayList<>(days * rooms);
        Arrays.stream(slots).forEach(row -> all.addAll(Arrays.asList(row)));
        return all;
    }

    public boolean isComplete() {
        return all().stream().allMatch(Slot::isFilled);
    }
}
