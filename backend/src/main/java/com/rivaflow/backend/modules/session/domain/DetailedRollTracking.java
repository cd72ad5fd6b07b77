package com.rivaflow.backend.modules.session.domain;

import java.util.List;

/**
 * Detailed tracking carries only the rolls; every total is computed from them.
 */
public record DetailedRollTracking(List<RollPayload> rolls) implements RollTracking {

    public DetailedRollTracking {
        rolls = rolls == null ? List.of() : List.copyOf(rolls);
    }

    @Override
    public TrackingMode mode() {
        return TrackingMode.DETAILED;
    }

    @Override
    public int rollCount() {
        return rolls.size();
    }

    @Override
    public int submissionsFor() {
        return rolls.stream().mapToInt(roll -> roll.submissionsFor().size()).sum();
    }

    @Override
    public int submissionsAgainst() {
        return rolls.stream().mapToInt(roll -> roll.submissionsAgainst().size()).sum();
    }
}
