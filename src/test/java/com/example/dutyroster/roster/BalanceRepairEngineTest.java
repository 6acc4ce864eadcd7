package com.example.dutyroster.roster;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.dutyroster.roster.RosterFixtures.person;
import static com.example.dutyroster.roster.RosterFixtures.seat;
import static com.example.dutyroster.roster.RosterFixtures.selector;
import static com.example.dutyroster.roster.RosterFixtures.tracker;
import static org.assertj.core.api.Assertions.assertThat;

class BalanceRepairEngineTest {

    private static BalanceRepairEngine engine(ConstraintTracker tracker) {
        return new BalanceRepairEngine(tracker, selector(tracker), new PositionResolver(), RosterPolicy.DEFAULT);
    }

    @Test
    void transfer_movesDutyDirectlyWhenReceiverIsFree() {
        ConstraintTracker tracker = tracker(3, 3, 2, 3);
        seat(tracker, 1, 1, "P0", "S0");

        assertThat(engine(tracker).transfer(person(tracker, "P0"), person(tracker, "P1"))).isTrue();

        Slot slot = tracker.getMatrix().slot(1, 1);
        assertThat(slot.getPrimary()).isEqualTo(person(tracker, "P1"));
        assertThat(tracker.dutyCount(person(tracker, "P0"))).isZero();
        assertThat(tracker.dutyCount(person(tracker, "P1"))).isEqualTo(1);
    }

    @Test
    void transfer_chainsThroughIntermediateWhenReceiverIsBusyThatDay() {
        // 12 positions, target 1, ceilings [3, 3, 3]
        ConstraintTracker tracker = tracker(3, 3, 2, 3);
        seat(tracker, 1, 1, "P0", "S0");
        seat(tracker, 1, 2, "P2", "S1");
        seat(tracker, 2, 3, "P1", "S2");

        assertThat(engine(tracker).transfer(person(tracker, "P0"), person(tracker, "P2"))).isTrue();

        assertThat(tracker.getMatrix().slot(1, 1).contains(person(tracker, "P1"))).isTrue();
        assertThat(tracker.getMatrix().slot(2, 3).contains(person(tracker, "P2"))).isTrue();
        assertThat(tracker.dutyCount(person(tracker, "P0"))).isZero();
        assertThat(tracker.dutyCount(person(tracker, "P1"))).isEqualTo(1);
        assertThat(tracker.dutyCount(person(tracker, "P2"))).isEqualTo(2);
    }

    @Test
    void transfer_exchangesRoomsWhenReceiverIsBarredFromDonorsRoom() {
        // target 1, ceilings [1, 1, 2, 2]; S1 was seated over target on day 2
        ConstraintTracker tracker = tracker(4, 2, 2, 2);
        seat(tracker, 1, 1, "P3", "S1");
        seat(tracker, 1, 2, "P1", "P2");
        seat(tracker, 2, 1, "P0", "S0");
        seat(tracker, 2, 2, "P3", "S1");

        assertThat(engine(tracker).transfer(person(tracker, "S1"), person(tracker, "P2"))).isTrue();

        Slot room1 = tracker.getMatrix().slot(2, 1);
        Slot room2 = tracker.getMatrix().slot(2, 2);
        assertThat(room1.occupants()).containsExactly(person(tracker, "P2"), person(tracker, "S0"));
        assertThat(room2.occupants()).containsExactly(person(tracker, "P0"), person(tracker, "P3"));
        assertThat(tracker.dutyCount(person(tracker, "S1"))).isEqualTo(1);
        assertThat(tracker.dutyCount(person(tracker, "P2"))).isEqualTo(2);
        assertThat(tracker.dutyCount(person(tracker, "P0"))).isEqualTo(1);
    }

    @Test
    void repair_bringsOverTargetSecondaryBackWhenOnlyARoomTradeHelps() {
        ConstraintTracker tracker = tracker(4, 2, 2, 2);
        seat(tracker, 1, 1, "P3", "S1");
        seat(tracker, 1, 2, "P1", "P2");
        seat(tracker, 2, 1, "P0", "S0");
        seat(tracker, 2, 2, "P3", "S1");

        engine(tracker).repair();

        assertThat(tracker.getSecondary()).extracting(tracker::dutyCount).containsExactly(1, 1);
        assertThat(tracker.getPrimary()).extracting(tracker::dutyCount).containsExactly(1, 1, 2, 2);
        assertThat(new RosterValidator().validate(tracker, List.of())).isEmpty();
    }

    @Test
    void transfer_neverMovesProtectedAssignment() {
        ConstraintTracker tracker = tracker(3, 3, 2, 3);
        seat(tracker, 1, 1, "P0", "S0");
        tracker.protect(person(tracker, "P0"), 1);

        assertThat(engine(tracker).transfer(person(tracker, "P0"), person(tracker, "P1"))).isFalse();
        assertThat(tracker.getMatrix().slot(1, 1).contains(person(tracker, "P0"))).isTrue();
    }

    @Test
    void fillVacancies_seatsUnderCapPeopleFirst() {
        // primaries have a ceiling of 0 here
        ConstraintTracker tracker = tracker(2, 2, 1, 1);

        int filled = engine(tracker).fillVacancies();

        Slot slot = tracker.getMatrix().slot(1, 1);
        assertThat(filled).isEqualTo(2);
        assertThat(slot.getPrimary()).isEqualTo(person(tracker, "S0"));
        assertThat(slot.getSecondary()).isEqualTo(person(tracker, "S1"));
    }

    @Test
    void correctSecondaryTargets_shedsAndGainsUntilEverySecondaryIsOnTarget() {
        // 12 positions, target 2, ceilings [2, 3, 3]
        ConstraintTracker tracker = tracker(3, 2, 3, 2);
        seat(tracker, 1, 1, "P0", "S0");
        seat(tracker, 1, 2, "P1", "P2");
        seat(tracker, 2, 1, "P1", "P2");
        seat(tracker, 2, 2, "P0", "S0");
        seat(tracker, 3, 1, "P0", "S0");
        seat(tracker, 3, 2, "P1", "P2");

        int moves = engine(tracker).correctSecondaryTargets();

        assertThat(moves).isEqualTo(2);
        assertThat(tracker.dutyCount(person(tracker, "S0"))).isEqualTo(2);
        assertThat(tracker.dutyCount(person(tracker, "S1"))).isEqualTo(2);
        assertThat(tracker.dutyCount(person(tracker, "P0"))).isEqualTo(2);
    }

    @Test
    void correctSeniority_movesDutyFromSeniorToJunior() {
        // 12 positions, target 2, ceilings [2, 2, 2]; P0 starts with 3, P2 with 1
        ConstraintTracker tracker = tracker(3, 3, 3, 2);
        seat(tracker, 1, 1, "P0", "S0");
        seat(tracker, 1, 2, "P1", "S1");
        seat(tracker, 2, 1, "S1", "S2");
        seat(tracker, 2, 2, "P0", "P2");
        seat(tracker, 3, 1, "P0", "S0");
        seat(tracker, 3, 2, "P1", "S2");
        assertThat(BalanceRepairEngine.seniorityViolations(tracker.getPrimary(), tracker::dutyCount)).isEqualTo(3);

        int moves = engine(tracker).correctSeniority();

        assertThat(moves).isEqualTo(1);
        assertThat(tracker.getPrimary()).extracting(tracker::dutyCount).containsExactly(2, 2, 2);
        assertThat(tracker.getMatrix().slot(1, 1).contains(person(tracker, "P2"))).isTrue();
        assertThat(BalanceRepairEngine.seniorityViolations(tracker.getPrimary(), tracker::dutyCount)).isZero();
    }

    @Test
    void correctSeniority_rejectsMoveThatLiftsJuniorAboveAThirdPerson() {
        // P2 and P3 cannot take any of P0's days; P1 can, but would then outnumber P2 and P3
        ConstraintTracker tracker = tracker(4, 3, 3, 3);
        seat(tracker, 1, 1, "P0", "S0");
        seat(tracker, 1, 2, "P2", "P3");
        seat(tracker, 1, 3, "P1", "S1");
        seat(tracker, 2, 2, "P0", "S2");
        seat(tracker, 3, 1, "P0", "S0");
        seat(tracker, 3, 2, "P2", "P3");
        seat(tracker, 3, 3, "P1", "S1");
        assertThat(BalanceRepairEngine.seniorityViolations(tracker.getPrimary(), tracker::dutyCount)).isEqualTo(3);

        int moves = engine(tracker).correctSeniority();

        assertThat(moves).isZero();
        assertThat(tracker.getPrimary()).extracting(tracker::dutyCount).containsExactly(3, 2, 2, 2);
        assertThat(tracker.getMatrix().slot(2, 2).contains(person(tracker, "P0"))).isTrue();
    }

    @Test
    void smoothPrimaryLoad_movesDutyFromAboveCeilingToBelowCeiling() {
        ConstraintTracker tracker = tracker(3, 3, 3, 2);
        seat(tracker, 1, 1, "P2", "S0");
        seat(tracker, 1, 2, "P1", "S1");
        seat(tracker, 2, 1, "S1", "S2");
        seat(tracker, 2, 2, "P2", "P0");
        seat(tracker, 3, 1, "P2", "S0");
        seat(tracker, 3, 2, "P1", "S2");

        int moves = engine(tracker).smoothPrimaryLoad();

        assertThat(moves).isEqualTo(1);
        assertThat(tracker.getPrimary()).extracting(tracker::dutyCount).containsExactly(2, 2, 2);
    }

    @Test
    void seniorityViolations_countsEveryOrderedPair() {
        Person a = new Person("A", Population.PRIMARY, 0);
        Person b = new Person("B", Population.PRIMARY, 1);
        Person c = new Person("C", Population.PRIMARY, 2);
        Map<Person, Integer> counts = Map.of(a, 3, b, 2, c, 1);

        assertThat(BalanceRepairEngine.seniorityViolations(List.of(a, b, c), counts::get)).isEqualTo(3);
        assertThat(BalanceRepairEngine.seniorityViolations(List.of(c, b, a), counts::get)).isEqualTo(3);
    }
}
