package com.rivaflow.backend.modules.session.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Attack and defence counters of a sparring session. Counters never go below zero and a
 * successful count never exceeds its attempted count.
 */
public record FightDynamics(
        int attacksAttempted,
        int attacksSuccessful,
        int defensesAttempted,
        int defensesSuccessful
) {

    public static final FightDynamics ZERO = new FightDynamics(0, 0, 0, 0);

    public FightDynamics {
        attacksAttempted = Math.max(0, attacksAttempted);
        defensesAttempted = Math.max(0, defensesAttempted);
        attacksSuccessful = Math.min(attacksAttempted, Math.max(0, attacksSuccessful));
        defensesSuccessful = Math.min(defensesAttempted, Math.max(0, defensesSuccessful));
    }

    public enum Field {
        ATTACKS_ATTEMPTED,
        ATTACKS_SUCCESSFUL,
        DEFENSES_ATTEMPTED,
        DEFENSES_SUCCESSFUL
    }

    public FightDynamics increment(Field field) {
        return set(field, get(field) + 1);
    }

    public FightDynamics decrement(Field field) {
        return set(field, get(field) - 1);
    }

    public FightDynamics set(Field field, int value) {
        return switch (field) {
            case ATTACKS_ATTEMPTED -> new FightDynamics(value, attacksSuccessful, defensesAttempted, defensesSuccessful);
            case ATTACKS_SUCCESSFUL -> new FightDynamics(attacksAttempted, value, defensesAttempted, defensesSuccessful);
            case DEFENSES_ATTEMPTED -> new FightDynamics(attacksAttempted, attacksSuccessful, value, defensesSuccessful);
            case DEFENSES_SUCCESSFUL -> new FightDynamics(attacksAttempted, attacksSuccessful, defensesAttempted, value);
        };
    }

    public int get(Field field) {
        return switch (field) {
            case ATTACKS_ATTEMPTED -> attacksAttempted;
            case ATTACKS_SUCCESSFUL -> attacksSuccessful;
            case DEFENSES_ATTEMPTED -> defensesAttempted;
            case DEFENSES_SUCCESSFUL -> defensesSuccessful;
        };
    }

    @JsonIgnore
    public boolean isEmpty() {
        return attacksAttempted == 0 && defensesAttempted == 0;
    }
}
