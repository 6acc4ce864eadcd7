package com.example.dutyroster.roster;

public record SlotAssignmentDto(int day, int room, String primaryPerson, String secondaryPerson) {

    public static SlotAssignmentDto from(Slot slot) {
        return new SlotAssignmentDto(slot.getDay(), slot.getRoom(),
                slot.getPrimary() == null ? null : slot.getPrimary().name(),
                slot.getSecondary() == null ? null : slot.getSecondary().name());
    }
}
