package com.example.dutyroster.roster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Local search over a constructed matrix. Fills leftover vacancies, then runs rounds of
 * secondary-target correction, seniority correction and primary load smoothing. Every phase
 * moves duties with {@link #transfer} and stops when it finds no legal move or spends its budget.
 */
public class BalanceRepairEngine {

    private static final Logger logger = LoggerFactory.getLogger(BalanceRepairEngine.class);

    private final ConstraintTracker tracker;
    private final CandidateSelector selector;
    private final PositionResolver resolver;
    private final RosterPolicy policy;

    public BalanceRepairEngine(ConstraintTracker tracker, CandidateSelector selector,
                               PositionResolver resolver, RosterPolicy policy) {
        this.tracker = tracker;
        this.selector = selector;
        this.resolver = resolver;
        this.policy = policy;
    }

    /** @return total number of placements and moves made */
    public int repair() {
        int total = fillVacancies();
        for (int round = 1; round <= policy.getRepairRounds(); round++) {
            int targetMoves = correctSecondaryTargets();
            int seniorityMoves = correctSeniority();
            int smoothingMoves = smoothPrimaryLoad();
            int moves = targetMoves + seniorityMoves + smoothingMoves;
            logger.debug("Repair round {}: target={}, seniority={}, smoothing={}",
                    round, targetMoves, seniorityMoves, smoothingMoves);
            total += moves;
            if (moves == 0) {
                break;
            }
        }
        return total;
    }

    /**
     * Fills positions the greedy pass left empty. Under-cap people are preferred; the cap is
     * relaxed only when nobody under it can legally take the position.
     */
    int fillVacancies() {
        int filled = 0;
        for (Slot slot : tracker.getMatrix().all()) {
            if (slot.isFilled()) {
                continue;
            }
            for (SlotPosition position : SlotPosition.values()) {
                if (slot.get(position) != null) {
                    continue;
                }
                List<Person> open = tracker.getEveryone().stream()
                        .filter(p -> tracker.canTake(p, slot))
                        .toList();
                List<Person> underCap = open.stream().filter(tracker::isUnderCap).toList();
                Population preferred = tracker.remainingSecondaryDemand() > 0
                        ? Population.SECONDARY : Population.PRIMARY;
                Person person = underCap.isEmpty()
                        ? selector.selectRelaxed(open)
                        : selector.selectPartner(underCap, preferred);
                if (person == null) {
                    logger.warn("Vacancy on day {} room {} cannot be filled", slot.getDay(), slot.getRoom());
                    continue;
                }
                tracker.place(slot, position, person);
                filled++;
            }
            resolver.resolve(slot);
        }
        return filled;
    }

    /**
     * Moves duties away from secondary people above target and towards those below it.
     */
    int correctSecondaryTargets() {
        int target = tracker.getConfiguration().getSecondaryDutyTarget();
        int budget = policy.getSwapBudget();
        int moves = 0;
        boolean progress = true;
        while (progress && moves < budget) {
            progress = false;
            for (Person person : tracker.getSecondary()) {
                if (moves >= budget) {
                    break;
                }
                int count = tracker.dutyCount(person);
                if (count > target && shedDuty(person)) {
                    moves++;
                    progress = true;
                } else if (count < target && gainDuty(person)) {
                    moves++;
                    progress = true;
                }
            }
        }
        return moves;
    }

    private boolean shedDuty(Person secondary) {
        List<Person> receivers = new ArrayList<>();
        tracker.getPrimary().stream()
                .filter(tracker::isUnderCap)
                .sorted(Comparator.comparingInt((Person p) -> tracker.dutyCount(p) - tracker.dutyCap(p))
                        .thenComparing(Comparator.comparingInt(Person::rank).reversed()))
                .forEach(receivers::add);
        tracker.getSecondary().stream()
                .filter(tracker::isUnderCap)
                .forEach(receivers::add);
        for (Person receiver : receivers) {
            if (transfer(secondary, receiver)) {
                logger.debug("Moved a duty from {} (above target) to {}", secondary.name(), receiver.name());
                return true;
            }
        }
        return false;
    }

    private boolean gainDuty(Person secondary) {
        int target = tracker.getConfiguration().getSecondaryDutyTarget();
        List<Person> donors = new ArrayList<>();
        // primaries above their ceiling, largest excess and most senior first
        tracker.getPrimary().stream()
                .filter(p -> tracker.dutyCount(p) > tracker.dutyCap(p))
                .sorted(Comparator.comparingInt((Person p) -> tracker.dutyCap(p) - tracker.dutyCount(p))
                        .thenComparingInt(Person::rank))
                .forEach(donors::add);
        tracker.getSecondary().stream()
                .filter(p -> tracker.dutyCount(p) > target)
                .forEach(donors::add);
        tracker.getPrimary().stream()
                .filter(p -> tracker.dutyCount(p) > 0 && tracker.dutyCount(p) <= tracker.dutyCap(p))
                .sorted(Comparator.comparingInt((Person p) -> -tracker.dutyCount(p))
                        .thenComparingInt(Person::rank))
                .forEach(donors::add);
        for (Person donor : donors) {
            if (transfer(donor, secondary)) {
                logger.debug("Moved a duty from {} to {} (below target)", donor.name(), secondary.name());
                return true;
            }
        }
        return false;
    }

    /**
     * Repairs pairs where a more senior primary person holds more duties than a less senior
     * one. A move is kept only if it lowers the total number of such pairs and leaves the
     * receiving junior above nobody they were not already above.
     */
    int correctSeniority() {
        int budget = policy.getSwapBudget();
        int moves = 0;
        while (moves < budget) {
            List<SeniorityPair> pairs = violatingPairs();
            if (pairs.isEmpty()) {
                break;
            }
            int before = seniorityViolations(tracker.getPrimary(), tracker::dutyCount);
            boolean moved = false;
            for (SeniorityPair pair : pairs) {
                ToIntFunction<Person> shifted = shifted(pair.senior(), pair.junior());
                int after = seniorityViolations(tracker.getPrimary(), shifted);
                if (after >= before || overtakesJuniors(pair.junior(), shifted)) {
                    continue;
                }
                if (transfer(pair.senior(), pair.junior())) {
                    logger.debug("Seniority fix: {} -> {}", pair.senior().name(), pair.junior().name());
                    moves++;
                    moved = true;
                    break;
                }
            }
            if (!moved) {
                break;
            }
        }
        return moves;
    }

    /**
     * Violating pairs, most constrained first: the junior with the fewest duties (least senior on
     * ties) paired with their seniors by most duties (most senior on ties).
     */
    private List<SeniorityPair> violatingPairs() {
        List<Person> primary = tracker.getPrimary();
        List<SeniorityPair> pairs = new ArrayList<>();
        for (Person junior : primary) {
            for (Person senior : primary) {
                if (senior.isSeniorTo(junior) && tracker.dutyCount(senior) > tracker.dutyCount(junior)) {
                    pairs.add(new SeniorityPair(senior, junior));
                }
            }
        }
        pairs.sort(Comparator.comparingInt((SeniorityPair p) -> tracker.dutyCount(p.junior()))
                .thenComparing(p -> p.junior().rank(), Comparator.reverseOrder())
                .thenComparing(p -> tracker.dutyCount(p.senior()), Comparator.reverseOrder())
                .thenComparingInt(p -> p.senior().rank()));
        return pairs;
    }

    /**
     * Evens out primary load: first from people above their ceiling to people below it, then
     * across gaps of two or more where one side is off its ceiling. Never adds a seniority violation.
     */
    int smoothPrimaryLoad() {
        int budget = policy.getSwapBudget();
        int moves = 0;
        while (moves < budget) {
            int before = seniorityViolations(tracker.getPrimary(), tracker::dutyCount);
            boolean moved = false;
            for (SmoothingMove move : smoothingCandidates()) {
                int after = seniorityViolations(tracker.getPrimary(), shifted(move.donor(), move.receiver()));
                if (after > before) {
                    continue;
                }
                if (transfer(move.donor(), move.receiver())) {
                    logger.debug("Smoothing: {} -> {}", move.donor().name(), move.receiver().name());
                    moves++;
                    moved = true;
                    break;
                }
            }
            if (!moved) {
                break;
            }
        }
        return moves;
    }

    private List<SmoothingMove> smoothingCandidates() {
        List<SmoothingMove> candidates = new ArrayList<>();
        for (Person donor : tracker.getPrimary()) {
            for (Person receiver : tracker.getPrimary()) {
                if (donor.equals(receiver)) {
                    continue;
                }
                int donorCount = tracker.dutyCount(donor);
                int receiverCount = tracker.dutyCount(receiver);
                boolean over = donorCount > tracker.dutyCap(donor);
                boolean under = receiverCount < tracker.dutyCap(receiver);
                int gap = donorCount - receiverCount;
                if (over && under) {
                    candidates.add(new SmoothingMove(donor, receiver, 0, gap));
                } else if (gap >= 2 && (over || under)) {
                    candidates.add(new SmoothingMove(donor, receiver, 1, gap));
                }
            }
        }
        candidates.sort(Comparator.comparingInt(SmoothingMove::priority)
                .thenComparing(SmoothingMove::gap, Comparator.reverseOrder()));
        return candidates;
    }

    /**
     * Moves one unprotected assignment of {@code donor} to {@code receiver}. Tries, in order:
     * <ol>
     *     <li>a direct move into the donor's slot;</li>
     *     <li>a same-day exchange, when the receiver is free that day but barred from the donor's room;</li>
     *     <li>a chain through an intermediate person who takes the donor's slot and hands one of
     *     their own slots on another day to the receiver, keeping their own count unchanged.</li>
     * </ol>
     *
     * @return true if a move was made
     */
    boolean transfer(Person donor, Person receiver) {
        List<Slot> donorSlots = tracker.slotsOf(donor);
        for (Slot slot : donorSlots) {
            if (!tracker.isProtected(donor, slot.getDay()) && tracker.canTake(receiver, slot)) {
                move(slot, donor, receiver);
                return true;
            }
        }
        for (Slot slot : donorSlots) {
            if (!tracker.isProtected(donor, slot.getDay()) && exchange(slot, donor, receiver)) {
                return true;
            }
        }
        for (Slot first : donorSlots) {
            if (tracker.isProtected(donor, first.getDay())) {
                continue;
            }
            for (Person middle : tracker.getEveryone()) {
                if (middle.equals(donor) || middle.equals(receiver) || !tracker.canTake(middle, first)) {
                    continue;
                }
                for (Slot second : tracker.slotsOf(middle)) {
                    if (second.getDay() == first.getDay()
                            || tracker.isProtected(middle, second.getDay())
                            || !tracker.canTake(receiver, second)) {
                        continue;
                    }
                    move(first, donor, middle);
                    move(second, middle, receiver);
                    logger.debug("Chained move {} -> {} -> {} (days {} and {})",
                            donor.name(), middle.name(), receiver.name(), first.getDay(), second.getDay());
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Donor leaves {@code slot}; an unprotected occupant of another room that day moves into it
     * and the receiver takes the seat they left. Nobody's count changes except donor and receiver.
     */
    private boolean exchange(Slot slot, Person donor, Person receiver) {
        int day = slot.getDay();
        if (tracker.isAssignedOn(receiver, day)) {
            return false;
        }
        for (Slot other : tracker.getMatrix().slotsOn(day)) {
            if (other == slot || tracker.conflictsWithNeighbours(receiver, day, other.getRoom())) {
                continue;
            }
            for (Person occupant : other.occupants()) {
                if (tracker.isProtected(occupant, day)
                        || tracker.conflictsWithNeighbours(occupant, day, slot.getRoom())) {
                    continue;
                }
                SlotPosition donorPosition = slot.positionOf(donor);
                SlotPosition occupantPosition = other.positionOf(occupant);
                tracker.vacate(slot, donorPosition);
                tracker.vacate(other, occupantPosition);
                tracker.place(slot, donorPosition, occupant);
                tracker.place(other, occupantPosition, receiver);
                resolver.resolve(slot);
                resolver.resolve(other);
                logger.debug("Exchanged on day {}: {} -> room {}, {} out, {} -> room {}",
                        day, occupant.name(), slot.getRoom(), donor.name(), receiver.name(), other.getRoom());
                return true;
            }
        }
        return false;
    }

    private void move(Slot slot, Person outgoing, Person incoming) {
        tracker.substitute(slot, outgoing, incoming);
        resolver.resolve(slot);
    }

    /** True if {@code receiver} would hold more duties than a less senior person they do not outnumber now. */
    private boolean overtakesJuniors(Person receiver, ToIntFunction<Person> shifted) {
        for (Person other : tracker.getPrimary()) {
            if (receiver.isSeniorTo(other)
                    && shifted.applyAsInt(receiver) > shifted.applyAsInt(other)
                    && tracker.dutyCount(receiver) <= tracker.dutyCount(other)) {
                return true;
            }
        }
        return false;
    }

    private ToIntFunction<Person> shifted(Person donor, Person receiver) {
        return p -> tracker.dutyCount(p) + (p.equals(donor) ? -1 : 0) + (p.equals(receiver) ? 1 : 0);
    }

    /** Number of (senior, junior) primary pairs where the senior holds more duties. */
    static int seniorityViolations(List<Person> primary, ToIntFunction<Person> counts) {
        int violations = 0;
        for (int i = 0; i < primary.size(); i++) {
            for (int j = i + 1; j < primary.size(); j++) {
                Person a = primary.get(i);
                Person b = primary.get(j);
                Person senior = a.rank() < b.rank() ? a : b;
                Person junior = senior == a ? b : a;
                if (counts.applyAsInt(senior) > counts.applyAsInt(junior)) {
                    violations++;
                }
            }
        }
        return violations;
    }

    private record SeniorityPair(Person senior, Person junior) {
    }

    private record SmoothingMove(Person donor, Person receiver, int priority, int gap) {
    }
}
