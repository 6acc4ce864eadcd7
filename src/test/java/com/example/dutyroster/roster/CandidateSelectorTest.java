package com.example.dutyroster.roster;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.dutyroster.roster.RosterFixtures.person;
import static com.example.dutyroster.roster.RosterFixtures.seat;
import static com.example.dutyroster.roster.RosterFixtures.selector;
import static com.example.dutyroster.roster.RosterFixtures.tracker;
import static org.assertj.core.api.Assertions.assertThat;

class CandidateSelectorTest {

    @Test
    void select_prefersFewestDuties() {
        ConstraintTracker tracker = tracker(5, 5, 6, 3);
        seat(tracker, 1, 1, "P4", "S4");

        Person picked = selector(tracker).select(List.of(person(tracker, "P4"), person(tracker, "P1")));

        assertThat(picked).isEqualTo(person(tracker, "P1"));
    }

    @Test
    void select_withinOnePopulation_prefersLessSenior() {
        ConstraintTracker tracker = tracker(5, 5, 6, 3);

        Person picked = selector(tracker).select(List.of(
                person(tracker, "S1"), person(tracker, "S3"), person(tracker, "S0")));

        assertThat(picked).isEqualTo(person(tracker, "S3"));
    }

    @Test
    void select_mixedPool_doesNotCompareRanksAcrossPopulations() {
        ConstraintTracker tracker = tracker(5, 5, 6, 3);
        List<Person> pool = List.of(person(tracker, "S4"), person(tracker, "P0"), person(tracker, "P2"));

        for (int i = 0; i < 5; i++) {
            assertThat(selector(tracker).select(pool)).isEqualTo(person(tracker, "P2"));
        }
    }

    @Test
    void selectRelaxed_prefersSmallestOvershoot() {
        // target 1, ceilings [1, 1, 2, 2]
        ConstraintTracker tracker = tracker(4, 2, 2, 2);
        seat(tracker, 1, 1, "P3", "S1");
        seat(tracker, 1, 2, "P1", "P2");

        Person picked = selector(tracker).selectRelaxed(List.of(person(tracker, "S1"), person(tracker, "P1"),
                person(tracker, "P3")));

        // S1 and P1 sit at their cap, P3 is one below it
        assertThat(picked).isEqualTo(person(tracker, "P3"));
    }
}
