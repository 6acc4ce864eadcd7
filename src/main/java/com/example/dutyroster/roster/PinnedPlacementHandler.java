package com.example.dutyroster.roster;

import com.example.dutyroster.exception.PinValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Places pinned people before the greedy pass and marks their pinned days as protected.
 */
public class PinnedPlacementHandler {

    private static final Logger logger = LoggerFactory.getLogger(PinnedPlacementHandler.class);

    private final ConstraintTracker tracker;
    private final CandidateSelector selector;
    private final PositionResolver resolver;

    public PinnedPlacementHandler(ConstraintTracker tracker, CandidateSelector selector, PositionResolver resolver) {
        this.tracker = tracker;
        this.selector = selector;
        this.resolver = resolver;
    }

    /**
     * Checks every pin and reports all problems at once.
     *
     * @throws PinValidationException if any pin references an unknown person, a day outside
     *                                the grid, repeats a person and day, or a day has more pins than rooms
     */
    public static void validate(List<PinRequest> pins, Map<String, Person> peopleByName, int days, int rooms) {
        List<String> issues = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        Map<Integer, Integer> pinsPerDay = new HashMap<>();
        for (PinRequest pin : pins) {
            String name = pin.personName() == null ? null : pin.personName().trim();
            if (name == null || !peopleByName.containsKey(name)) {
                issues.add("Unknown person: " + name);
            }
            if (pin.day() < 1 || pin.day() > days) {
                issues.add(String.format("Day %d for %s is outside 1..%d", pin.day(), name, days));
                continue;
            }
            if (!seen.add(name + "@" + pin.day())) {
                issues.add(String.format("%s is pinned twice on day %d", name, pin.day()));
                continue;
            }
            pinsPerDay.merge(pin.day(), 1, Integer::sum);
        }
        pinsPerDay.entrySet().stream()
                .filter(e -> e.getValue() > rooms)
                .sorted(Map.Entry.comparingByKey())
                .forEach(e -> issues.add(String.format("Day %d has %d pins but only %d rooms",
                        e.getKey(), e.getValue(), rooms)));
        if (!issues.isEmpty()) {
            throw new PinValidationException(issues);
        }
    }

    /**
     * Places validated pins in day order. A pin that cannot be placed is logged and reported
     * in the returned outcomes.
     */
    public List<PinOutcome> place(List<PinRequest> pins, Map<String, Person> peopleByName) {
        Map<Integer, Set<Person>> pinnedByDay = new HashMap<>();
        for (PinRequest pin : pins) {
            pinnedByDay.computeIfAbsent(pin.day(), d -> new HashSet<>()).add(peopleByName.get(pin.personName().trim()));
        }

        List<PinRequest> ordered = new ArrayList<>(pins);
        ordered.sort(Comparator.comparingInt(PinRequest::day));

        List<PinOutcome> outcomes = new ArrayList<>();
        for (PinRequest pin : ordered) {
            Person person = peopleByName.get(pin.personName().trim());
            int day = pin.day();

            Integer room = placeInFirstRoom(person, day, pinnedByDay.getOrDefault(day, Set.of()));
            if (room == null) {
                logger.warn("Pin for {} on day {} could not be satisfied", person.name(), day);
                outcomes.add(PinOutcome.unsatisfied(pin));
            } else {
                tracker.protect(person, day);
                logger.debug("Pinned {} to day {} room {}", person.name(), day, room);
                outcomes.add(PinOutcome.placed(pin, room));
            }
        }
        return outcomes;
    }

    private Integer placeInFirstRoom(Person person, int day, Set<Person> pinnedToday) {
        Population preferred = tracker.remainingSecondaryDemand() > 0 ? Population.SECONDARY : Population.PRIMARY;
        for (Slot slot : tracker.getMatrix().slotsOn(day)) {
            if (tracker.isRoomOccupied(day, slot.getRoom())) {
                continue;
            }
            if (tracker.conflictsWithNeighbours(person, day, slot.getRoom())) {
                continue;
            }
            List<Person> partners = tracker.getEveryone().stream()
                    .filter(p -> !p.equals(person))
                    .filter(p -> !pinnedToday.contains(p))
                    .filter(p -> tracker.canTake(p, slot))
                    .filter(tracker::isUnderCap)
                    .toList();
            Person partner = selector.selectPartner(partners, preferred);
            if (partner == null) {
                continue;
            }
            tracker.place(slot, SlotPosition.PRIMARY, person);
            tracker.place(slot, SlotPosition.SECONDARY, partner);
            resolver.resolve(slot);
            return slot.getRoom();
        }
        return null;
    }
}
