package com.example.dutyroster.roster;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.StringJoiner;

/**
 * Writes a roster as CSV: a header row of day labels, two rows per room (room label on the
 * first row only), then one duty-count section per population.
 */
@Component
public class RosterCsvExporter {

    public CsvFile export(RosterResult result) {
        RosterConfiguration config = result.configuration();
        int days = config.getDays();
        int rooms = config.getRooms();
        Map<String, SlotAssignmentDto> byPosition = new HashMap<>();
        result.slots().forEach(s -> byPosition.put(key(s.day(), s.room()), s));

        StringBuilder builder = new StringBuilder();
        builder.append('\uFEFF');

        StringJoiner header = new StringJoiner(",");
        header.add("Room");
        for (int day = 1; day <= days; day++) {
            header.add("Day " + day);
        }
        builder.append(header).append('\n');

        for (int room = 1; room <= rooms; room++) {
            StringJoiner first = new StringJoiner(",");
            StringJoiner second = new StringJoiner(",");
            first.add(escapeCsv("Room " + room));
            second.add("");
            for (int day = 1; day <= days; day++) {
                SlotAssignmentDto slot = byPosition.get(key(day, room));
                first.add(escapeCsv(slot == null ? null : slot.primaryPerson()));
                second.add(escapeCsv(slot == null ? null : slot.secondaryPerson()));
            }
            builder.append(first).append('\n');
            builder.append(second).append('\n');
        }

        appendDuties(builder, "Primary duties", result.primaryDuties());
        appendDuties(builder, "Secondary duties", result.secondaryDuties());

        byte[] data = builder.toString().getBytes(StandardCharsets.UTF_8);
        String filename = String.format("duty-roster-%dd-%dr.csv", days, rooms);
        return new CsvFile(filename, data);
    }

    private void appendDuties(StringBuilder builder, String title, List<DutyCountDto> duties) {
        builder.append('\n');
        builder.append(escapeCsv(title)).append(",Duties\n");
        for (DutyCountDto duty : duties) {
            builder.append(escapeCsv(duty.name())).append(',').append(duty.dutyCount()).append('\n');
        }
    }

    private static String key(int day, int room) {
        return day + ":" + room;
    }

    private String escapeCsv(String value) {
        String target = value == null ? "" : value;
        if (target.contains(",") || target.contains("\"") || target.contains("\n")) {
            return "\"" + target.replace("\"", "\"\"") + "\"";
        }
        return target;
    }

    public record CsvFile(String filename, byte[] data) { }
}
