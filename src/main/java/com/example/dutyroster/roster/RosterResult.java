package com.example.dutyroster.roster;

import java.util.List;

/**
 * Frozen output of one run. Duty lists are sorted by descending count; equal counts keep
 * seniority order.
 */
public record RosterResult(
        RosterConfiguration configuration,
        long seed,
        List<SlotAssignmentDto> slots,
        List<DutyCountDto> primaryDuties,
        List<DutyCountDto> secondaryDuties,
        List<Violation> violations,
        List<PinOutcome> pinOutcomes
) {

    public boolean isClean() {
        return violations.isEmpty();
    }
}
