package com.example.dutyroster.roster;

import java.util.List;

public record RosterResponse(
        List<SlotAssignmentDto> slots,
        List<DutyCountDto> primaryDuties,
        List<DutyCountDto> secondaryDuties,
        List<Violation> violations,
        List<PinOutcome> pins,
        RosterStatistics statistics,
        int secondaryDutyTarget,
        long seed
) {

    public static RosterResponse from(RosterResult result) {
        return new RosterResponse(
                result.slots(),
                result.primaryDuties(),
                result.secondaryDuties(),
                result.violations(),
                result.pinOutcomes(),
                RosterStatistics.from(result),
                result.configuration().getSecondaryDutyTarget(),
                result.seed());
    }
}
