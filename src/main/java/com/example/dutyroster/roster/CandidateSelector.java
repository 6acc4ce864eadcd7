package com.example.dutyroster.roster;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Picks one person out of an already filtered pool. Ordering is fewest duties first, then the
 * less senior person; whatever is still tied is settled by the run's random source. Rank is only
 * compared within a population: in a mixed pool primary-population members come first.
 */
public class CandidateSelector {

    private final ConstraintTracker tracker;
    private final Random random;

    public CandidateSelector(ConstraintTracker tracker, Random random) {
        this.tracker = tracker;
        this.random = random;
    }

    public Person select(List<Person> pool) {
        return pickAmongTies(pool, fewestDuties().thenComparing(lessSeniorFirst()));
    }

    /** Same as {@link #select} but prefers {@code preferred} when duty counts tie. */
    public Person selectPartner(List<Person> pool, Population preferred) {
        Comparator<Person> order = fewestDuties()
                .thenComparingInt(p -> p.population() == preferred ? 0 : 1)
                .thenComparing(lessSeniorFirst());
        return pickAmongTies(pool, order);
    }

    /** Cap-relaxed pick: whoever would end least over their cap. */
    public Person selectRelaxed(List<Person> pool) {
        Comparator<Person> order = Comparator.<Person>comparingInt(p -> tracker.dutyCount(p) - tracker.dutyCap(p))
                .thenComparing(fewestDuties())
                .thenComparing(lessSeniorFirst());
        return pickAmongTies(pool, order);
    }

    private Comparator<Person> fewestDuties() {
        return Comparator.comparingInt(tracker::dutyCount);
    }

    private static Comparator<Person> lessSeniorFirst() {
        return Comparator.comparing(Person::population)
                .thenComparing(Comparator.comparingInt(Person::rank).reversed());
    }

    private Person pickAmongTies(List<Person> pool, Comparator<Person> order) {
        if (pool.isEmpty()) {
            return null;
        }
        List<Person> best = new ArrayList<>();
        for (Person candidate : pool) {
            if (best.isEmpty()) {
                best.add(candidate);
                continue;
            }
            int cmp = order.compare(candidate, best.get(0));
            if (cmp < 0) {
                best.clear();
                best.add(candidate);
            } else if (cmp == 0) {
                best.add(candidate);
            }
        }
        return best.size() == 1 ? best.get(0) : best.get(random.nextInt(best.size()));
    }
}
