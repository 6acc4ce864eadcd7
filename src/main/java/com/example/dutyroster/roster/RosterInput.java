package com.example.dutyroster.roster;

import com.example.dutyroster.exception.RosterConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable input of one generation run. People are listed in seniority order within
 * their population.
 */
public record RosterInput(List<Person> primary, List<Person> secondary, int days, int rooms, List<PinRequest> pins) {

    public RosterInput {
        primary = List.copyOf(primary);
        secondary = List.copyOf(secondary);
        pins = pins == null ? List.of() : List.copyOf(pins);
    }

    /**
     * Builds an input from two ordered name lists, assigning ranks by position.
     *
     * @throws RosterConfigurationException when a name is blank or used twice across both lists
     */
    public static RosterInput of(List<String> primaryNames, List<String> secondaryNames,
                                 int days, int rooms, List<PinRequest> pins) {
        Set<String> seen = new HashSet<>();
        List<Person> primary = toPeople(primaryNames, Population.PRIMARY, seen);
        List<Person> secondary = toPeople(secondaryNames, Population.SECONDARY, seen);
        return new RosterInput(primary, secondary, days, rooms, pins);
    }

    private static List<Person> toPeople(List<String> names, Population population, Set<String> seen) {
        if (names == null) {
            return List.of();
        }
        List<Person> people = new ArrayList<>(names.size());
        for (String raw : names) {
            if (raw == null || raw.isBlank()) {
                throw new RosterConfigurationException("Blank name in " + population.name().toLowerCase() + " list");
            }
            String name = raw.trim();
            if (!seen.add(name)) {
                throw new RosterConfigurationException("Duplicate person name: " + name);
            }
            people.add(new Person(name, population, people.size()));
        }
        return people;
    }

    public List<Person> everyone() {
        List<Person> all = new ArrayList<>(primary.size() + secondary.size());
        all.addAll(primary);
        all.addAll(secondary);
        return Collections.unmodifiableList(all);
    }

    public Map<String, Person> peopleByName() {
        Map<String, Person> byName = new LinkedHashMap<>();
        everyone().forEach(p -> byName.put(p.name(), p));
        return byName;
    }
}
