package com.example.dutyroster.roster;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * Runs one generation: configuration, pins, greedy fill, repair, validation. Holds no state
 * between calls, so one instance can serve concurrent runs.
 */
public class RosterEngine {

    private static final Logger logger = LoggerFactory.getLogger(RosterEngine.class);

    private final RosterPolicy policy;

    public RosterEngine(RosterPolicy policy) {
        this.policy = policy;
    }

    /**
     * Fails fast on configuration, capacity and pin errors without building anything.
     */
    public RosterConfiguration check(RosterInput input) {
        RosterConfiguration configuration = RosterConfiguration.resolve(
                input.primary().size(), input.secondary().size(), input.days(), input.rooms(), policy);
        PinnedPlacementHandler.validate(input.pins(), input.peopleByName(), input.days(), input.rooms());
        return configuration;
    }

    public RosterResult generate(RosterInput input, long seed) {
        RosterConfiguration configuration = check(input);
        Map<String, Person> peopleByName = input.peopleByName();

        AssignmentMatrix matrix = new AssignmentMatrix(input.days(), input.rooms());
        ConstraintTracker tracker = new ConstraintTracker(configuration, matrix, input.primary(), input.secondary());
        Random random = new Random(seed);
        PositionResolver resolver = new PositionResolver();
        CandidateSelector selector = new CandidateSelector(tracker, random);

        List<PinOutcome> pinOutcomes = new PinnedPlacementHandler(tracker, selector, resolver)
                .place(input.pins(), peopleByName);
        new GreedyRoomFiller(tracker, selector, resolver).fill();
        int moves = new BalanceRepairEngine(tracker, selector, resolver, policy).repair();
        List<Violation> violations = new RosterValidator().validate(tracker, input.pins());

        if (violations.isEmpty()) {
            logger.debug("Seed {} produced a clean roster after {} repair moves", seed, moves);
        } else {
            logger.debug("Seed {} left {} findings after {} repair moves", seed, violations.size(), moves);
        }

        return new RosterResult(
                configuration,
                seed,
                matrix.all().stream().map(SlotAssignmentDto::from).toList(),
                dutyTable(tracker, input.primary()),
                dutyTable(tracker, input.secondary()),
                List.copyOf(violations),
                pinOutcomes);
    }

    private static List<DutyCountDto> dutyTable(ConstraintTracker tracker, List<Person> people) {
        return people.stream()
                .map(p -> new DutyCountDto(p.name(), tracker.dutyCount(p)))
                .sorted(Comparator.comparingInt(DutyCountDto::dutyCount).reversed())
                .toList();
    }
}
