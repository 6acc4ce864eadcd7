package com.example.dutyroster.roster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Constructive pass: fills every open room day by day, then tops up the day's secondary
 * coverage when it fell short of the day quota.
 */
public class GreedyRoomFiller {

    private static final Logger logger = LoggerFactory.getLogger(GreedyRoomFiller.class);

    private final ConstraintTracker tracker;
    private final CandidateSelector selector;
    private final PositionResolver resolver;

    public GreedyRoomFiller(ConstraintTracker tracker, CandidateSelector selector, PositionResolver resolver) {
        this.tracker = tracker;
        this.selector = selector;
        this.resolver = resolver;
    }

    public void fill() {
        AssignmentMatrix matrix = tracker.getMatrix();
        for (int day = 1; day <= matrix.getDays(); day++) {
            int quota = dayQuota(day);
            for (Slot slot : matrix.slotsOn(day)) {
                if (slot.isFilled()) {
                    continue;
                }
                fillSlot(slot, quota);
            }
            int swaps = topUp(day, quota);
            logger.debug("Day {} filled: quota={}, secondary={}, top-up swaps={}",
                    day, quota, tracker.secondaryCountOn(day), swaps);
        }
    }

    /**
     * Secondary seats wanted on {@code day}: the even share of what is still owed, at least
     * the configured daily minimum, and never more than can be seated.
     */
    int dayQuota(int day) {
        RosterConfiguration config = tracker.getConfiguration();
        int demand = tracker.remainingSecondaryDemand() + tracker.secondaryCountOn(day);
        int remainingDays = config.getDays() - day + 1;
        int share = (demand + remainingDays - 1) / remainingDays;
        int quota = Math.max(config.getMinSecondaryPerDay(), share);
        quota = Math.min(quota, demand);
        quota = Math.min(quota, config.getSecondaryCount());
        return Math.min(quota, config.getRooms() * 2);
    }

    private void fillSlot(Slot slot, int quota) {
        if (slot.get(SlotPosition.PRIMARY) == null) {
            Person lead = pickLead(slot, quota);
            if (lead != null) {
                tracker.place(slot, SlotPosition.PRIMARY, lead);
            }
        }
        if (slot.get(SlotPosition.SECONDARY) == null) {
            Person second = pickSecond(slot, quota);
            if (second != null) {
                tracker.place(slot, SlotPosition.SECONDARY, second);
            }
        }
        resolver.resolve(slot);
        if (!slot.isFilled()) {
            logger.warn("No eligible candidate left for day {} room {}", slot.getDay(), slot.getRoom());
        }
    }

    private Person pickLead(Slot slot, int quota) {
        int day = slot.getDay();
        int needed = quota - tracker.secondaryCountOn(day);
        if (needed > tracker.openRoomsOn(day)) {
            // secondary slots alone can no longer meet today's quota
            Person urgent = selector.select(eligible(tracker.getSecondary(), slot));
            if (urgent != null) {
                return urgent;
            }
        }
        return firstAvailable(slot,
                tracker.getPrimary(),
                tracker.getSecondary());
    }

    private Person pickSecond(Slot slot, int quota) {
        if (tracker.secondaryCountOn(slot.getDay()) < quota) {
            Person forced = selector.select(eligible(tracker.getSecondary(), slot));
            if (forced != null) {
                return forced;
            }
        }
        return firstAvailable(slot, tracker.getEveryone());
    }

    @SafeVarargs
    private Person firstAvailable(Slot slot, List<Person>... pools) {
        for (List<Person> pool : pools) {
            Person picked = selector.select(eligible(pool, slot));
            if (picked != null) {
                return picked;
            }
        }
        // last resort: allow a duty cap to be exceeded, never the room rule
        List<Person> relaxed = tracker.getEveryone().stream()
                .filter(p -> tracker.canTake(p, slot))
                .toList();
        Person picked = selector.selectRelaxed(relaxed);
        if (picked != null) {
            logger.debug("Relaxed duty cap for {} on day {} room {}", picked.name(), slot.getDay(), slot.getRoom());
        }
        return picked;
    }

    private List<Person> eligible(List<Person> pool, Slot slot) {
        return pool.stream()
                .filter(p -> tracker.canTake(p, slot))
                .filter(tracker::isUnderCap)
                .toList();
    }

    /**
     * Swaps unprotected primary-population occupants of {@code day} for under-target secondary
     * people until the day reaches {@code quota}. Occupants of the secondary position go first.
     *
     * @return number of swaps made
     */
    int topUp(int day, int quota) {
        int swaps = 0;
        while (tracker.secondaryCountOn(day) < quota) {
            Optional<Swap> swap = findTopUpSwap(day);
            if (swap.isEmpty()) {
                break;
            }
            Swap s = swap.get();
            tracker.substitute(s.slot(), s.outgoing(), s.incoming());
            resolver.resolve(s.slot());
            swaps++;
        }
        return swaps;
    }

    private Optional<Swap> findTopUpSwap(int day) {
        Predicate<Person> replaceable = p -> p != null && p.isPrimary() && !tracker.isProtected(p, day);
        List<Slot> slots = tracker.getMatrix().slotsOn(day);
        for (SlotPosition position : List.of(SlotPosition.SECONDARY, SlotPosition.PRIMARY)) {
            List<Slot> candidates = slots.stream()
                    .filter(slot -> replaceable.test(slot.get(position)))
                    // give back duties from whoever holds the most first
                    .sorted(Comparator.comparingInt((Slot slot) -> tracker.dutyCount(slot.get(position))
                            - tracker.dutyCap(slot.get(position))).reversed())
                    .toList();
            for (Slot slot : candidates) {
                Person incoming = selector.select(eligible(tracker.getSecondary(), slot));
                if (incoming != null) {
                    return Optional.of(new Swap(slot, slot.get(position), incoming));
                }
            }
        }
        return Optional.empty();
    }

    private record Swap(Slot slot, Person outgoing, Person incoming) {
    }
}
