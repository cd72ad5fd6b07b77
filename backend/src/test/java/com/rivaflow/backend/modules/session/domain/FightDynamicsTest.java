package com.rivaflow.backend.modules.session.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FightDynamicsTest {

    @Test
    @DisplayName("decrementing at zero stays at zero")
    void decrementNeverGoesNegative() {
        FightDynamics dynamics = FightDynamics.ZERO.decrement(FightDynamics.Field.ATTACKS_ATTEMPTED);

        assertThat(dynamics.attacksAttempted()).isZero();
    }

    @Test
    @DisplayName("successful count cannot exceed attempted")
    void successfulCappedByAttempted() {
        FightDynamics dynamics = FightDynamics.ZERO
                .set(FightDynamics.Field.DEFENSES_ATTEMPTED, 2)
                .set(FightDynamics.Field.DEFENSES_SUCCESSFUL, 5);

        assertThat(dynamics.defensesSuccessful()).isEqualTo(2);
    }

    @Test
    @DisplayName("lowering attempted pulls successful down with it")
    void decrementAttemptedClampsSuccessful() {
        FightDynamics dynamics = new FightDynamics(3, 3, 0, 0)
                .decrement(FightDynamics.Field.ATTACKS_ATTEMPTED);

        assertThat(dynamics.attacksAttempted()).isEqualTo(2);
        assertThat(dynamics.attacksSuccessful()).isEqualTo(2);
    }

    @Test
    @DisplayName("increment raises only the chosen counter")
    void incrementSingleField() {
        FightDynamics dynamics = FightDynamics.ZERO
                .increment(FightDynamics.Field.ATTACKS_ATTEMPTED)
                .increment(FightDynamics.Field.ATTACKS_SUCCESSFUL);

        assertThat(dynamics).isEqualTo(new FightDynamics(1, 1, 0, 0));
        assertThat(dynamics.isEmpty()).isFalse();
    }
}
