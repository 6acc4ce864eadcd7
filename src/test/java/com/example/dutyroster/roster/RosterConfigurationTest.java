package com.example.dutyroster.roster;

import com.example.dutyroster.exception.RosterCapacityException;
import com.example.dutyroster.exception.RosterConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RosterConfigurationTest {

    private final RosterPolicy policy = RosterPolicy.DEFAULT;

    @Test
    void resolve_fivePlusFiveOverSixDaysThreeRooms_derivesTargetsAndCeilings() {
        RosterConfiguration config = RosterConfiguration.resolve(5, 5, 6, 3, policy);

        assertThat(config.getTotalPositions()).isEqualTo(36);
        assertThat(config.getSecondaryDutyTarget()).isEqualTo(5);
        assertThat(config.getTotalSecondaryDuties()).isEqualTo(25);
        assertThat(config.getTotalPrimaryDuties()).isEqualTo(11);
        assertThat(config.getMinSecondaryPerDay()).isEqualTo(4);
        assertThat(config.getPrimaryCeilings()).containsExactly(2, 2, 2, 2, 3);
    }

    @Test
    void resolve_singleDay_usesTargetOfOne() {
        RosterConfiguration config = RosterConfiguration.resolve(2, 2, 1, 2, policy);

        assertThat(config.getSecondaryDutyTarget()).isEqualTo(1);
        assertThat(config.getTotalPrimaryDuties()).isEqualTo(2);
        assertThat(config.getPrimaryCeilings()).containsExactly(1, 1);
    }

    @Test
    void resolve_smallPrimaryShare_allowsZeroCeilingsForSeniors() {
        RosterConfiguration config = RosterConfiguration.resolve(3, 3, 2, 1, policy);

        assertThat(config.getTotalPrimaryDuties()).isEqualTo(1);
        assertThat(config.getPrimaryCeilings()).containsExactly(0, 0, 1);
    }

    @Test
    void stratifyCeilings_neverDecreasesWithRank() {
        assertThat(RosterConfiguration.stratifyCeilings(7, 3)).containsExactly(2, 2, 3);
        assertThat(RosterConfiguration.stratifyCeilings(10, 4)).containsExactly(2, 2, 3, 3);
        assertThat(RosterConfiguration.stratifyCeilings(8, 4)).containsExactly(2, 2, 2, 2);
    }

    @Test
    void resolve_secondaryDutiesExceedGrid_throwsCapacityError() {
        assertThatThrownBy(() -> RosterConfiguration.resolve(5, 5, 6, 2, policy))
                .isInstanceOf(RosterCapacityException.class)
                .satisfies(ex -> {
                    RosterCapacityException capacity = (RosterCapacityException) ex;
                    assertThat(capacity.getTotalPositions()).isEqualTo(24);
                    assertThat(capacity.getRequiredPositions()).isEqualTo(25);
                    assertThat(capacity.getErrorCode()).isEqualTo("ROSTER_CAPACITY");
                });
    }

    @Test
    void resolve_tooFewPeopleForOneDay_throwsCapacityError() {
        assertThatThrownBy(() -> RosterConfiguration.resolve(1, 1, 1, 2, policy))
                .isInstanceOf(RosterCapacityException.class);
    }

    @Test
    void resolve_gridOutsideBounds_throwsConfigurationError() {
        assertThatThrownBy(() -> RosterConfiguration.resolve(3, 3, 0, 2, policy))
                .isInstanceOf(RosterConfigurationException.class)
                .hasMessageContaining("days");
        assertThatThrownBy(() -> RosterConfiguration.resolve(3, 3, 11, 2, policy))
                .isInstanceOf(RosterConfigurationException.class);
        assertThatThrownBy(() -> RosterConfiguration.resolve(3, 3, 3, 21, policy))
                .isInstanceOf(RosterConfigurationException.class)
                .hasMessageContaining("rooms");
    }

    @Test
    void resolve_customPolicyBounds_areHonoured() {
        RosterPolicy narrow = RosterPolicy.builder().dayRange(2, 4).roomRange(1, 2).build();

        assertThatThrownBy(() -> RosterConfiguration.resolve(3, 3, 5, 1, narrow))
                .isInstanceOf(RosterConfigurationException.class);
        assertThat(RosterConfiguration.resolve(3, 1, 4, 1, narrow).getDays()).isEqualTo(4);
    }

    @Test
    void resolve_emptyPopulation_throwsConfigurationError() {
        assertThatThrownBy(() -> RosterConfiguration.resolve(0, 3, 3, 1, policy))
                .isInstanceOf(RosterConfigurationException.class)
                .hasMessageContaining("primary");
        assertThatThrownBy(() -> RosterConfiguration.resolve(3, 0, 3, 1, policy))
                .isInstanceOf(RosterConfigurationException.class)
                .hasMessageContaining("secondary");
    }

    @Test
    void rosterInput_assignsRanksByInputOrder() {
        RosterInput input = RosterInput.of(List.of("Ada", "Ben"), List.of("Cy", " Dee "), 2, 1, null);

        assertThat(input.primary()).extracting(Person::rank).containsExactly(0, 1);
        assertThat(input.secondary()).extracting(Person::name).containsExactly("Cy", "Dee");
        assertThat(input.pins()).isEmpty();
        assertThat(input.peopleByName()).containsKeys("Ada", "Ben", "Cy", "Dee");
    }

    @Test
    void rosterInput_duplicateOrBlankName_throwsConfigurationError() {
        assertThatThrownBy(() -> RosterInput.of(List.of("Ada"), List.of("Ada"), 2, 1, List.of()))
                .isInstanceOf(RosterConfigurationException.class)
                .hasMessageContaining("Duplicate");
        assertThatThrownBy(() -> RosterInput.of(List.of("Ada", " "), List.of("Cy"), 2, 1, List.of()))
                .isInstanceOf(RosterConfigurationException.class)
                .hasMessageContaining("Blank");
    }
}
