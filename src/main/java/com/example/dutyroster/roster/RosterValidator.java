package com.example.dutyroster.roster;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only check of a finished run. Recounts everything from the matrix rather than trusting
 * the tracker, and reports every mismatch it finds.
 */
public class RosterValidator {

    private final PositionResolver resolver = new PositionResolver();

    public List<Violation> validate(ConstraintTracker tracker, List<PinRequest> pins) {
        AssignmentMatrix matrix = tracker.getMatrix();
        RosterConfiguration config = tracker.getConfiguration();
        List<Violation> violations = new ArrayList<>();
        Map<Person, Integer> recount = new HashMap<>();
        Map<Person, Map<Integer, Integer>> appearances = new HashMap<>();
        int filledPositions = 0;

        for (Slot slot : matrix.all()) {
            int day = slot.getDay();
            int room = slot.getRoom();
            for (SlotPosition position : SlotPosition.values()) {
                Person person = slot.get(position);
                if (person == null) {
                    violations.add(new Violation(ViolationType.UNFILLED_POSITION, day, room, null,
                            position + " position is empty"));
                    continue;
                }
                filledPositions++;
                recount.merge(person, 1, Integer::sum);
                appearances.computeIfAbsent(person, p -> new HashMap<>()).merge(day, 1, Integer::sum);
            }
            if (slot.getPrimary() != null && slot.getPrimary().equals(slot.getSecondary())) {
                violations.add(new Violation(ViolationType.DUPLICATE_OCCUPANT, day, room, slot.getPrimary().name(),
                        "same person in both positions"));
            }
            if (slot.isFilled() && !resolver.isOrdered(slot)) {
                violations.add(new Violation(ViolationType.POSITION_ORDER, day, room, slot.getPrimary().name(),
                        slot.getSecondary().name() + " should hold the primary position"));
            }
            if (day > 1) {
                Slot previous = matrix.slot(day - 1, room);
                for (Person person : slot.occupants()) {
                    if (previous.contains(person)) {
                        violations.add(new Violation(ViolationType.CONSECUTIVE_ROOM, day, room, person.name(),
                                "also in this room on day " + (day - 1)));
                    }
                }
            }
        }

        appearances.forEach((person, byDay) -> byDay.forEach((day, times) -> {
            if (times > 1) {
                violations.add(new Violation(ViolationType.DOUBLE_BOOKING, day, null, person.name(),
                        "assigned " + times + " times on one day"));
            }
        }));

        int counted = 0;
        for (Person person : tracker.getEveryone()) {
            int actual = recount.getOrDefault(person, 0);
            int tracked = tracker.dutyCount(person);
            counted += tracked;
            if (actual != tracked) {
                violations.add(new Violation(ViolationType.DUTY_TOTAL_MISMATCH, null, null, person.name(),
                        "counter says " + tracked + " but matrix holds " + actual));
            }
            if (person.isSecondary() && actual != config.getSecondaryDutyTarget()) {
                violations.add(new Violation(ViolationType.SECONDARY_TARGET_DEVIATION, null, null, person.name(),
                        "has " + actual + " duties, target is " + config.getSecondaryDutyTarget()));
            }
        }
        if (counted != filledPositions) {
            violations.add(new Violation(ViolationType.DUTY_TOTAL_MISMATCH, null, null, null,
                    "counters total " + counted + " but " + filledPositions + " positions are filled"));
        }

        List<Person> primary = tracker.getPrimary();
        for (Person senior : primary) {
            for (Person junior : primary) {
                if (!senior.isSeniorTo(junior)) {
                    continue;
                }
                int seniorCount = recount.getOrDefault(senior, 0);
                int juniorCount = recount.getOrDefault(junior, 0);
                if (seniorCount > juniorCount) {
                    violations.add(new Violation(ViolationType.SENIORITY_VIOLATION, null, null, senior.name(),
                            String.format("%d duties, more than %s with %d", seniorCount, junior.name(), juniorCount)));
                }
            }
        }

        Map<String, Person> byName = new HashMap<>();
        tracker.getEveryone().forEach(p -> byName.put(p.name(), p));
        for (PinRequest pin : pins) {
            Person person = byName.get(pin.personName().trim());
            int times = person == null ? 0
                    : appearances.getOrDefault(person, Map.of()).getOrDefault(pin.day(), 0);
            if (times != 1) {
                violations.add(new Violation(ViolationType.PIN_UNSATISFIED, pin.day(), null, pin.personName(),
                        "pinned person appears " + times + " times on the pinned day"));
            }
        }
        return violations;
    }
}
