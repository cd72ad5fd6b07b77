package com.rivaflow.backend.modules.session.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

/**
 * What a session edit hands to the {@link SessionStore}: the editable fields, one roll
 * tracking variant and the complete techniques.
 */
public record SessionPayload(
        LocalDate sessionDate,
        LocalTime classTime,
        ClassType classType,
        String gymName,
        String location,
        String notes,
        Integer durationMinutes,
        Integer intensity,
        RollTracking rollTracking,
        List<TechniquePayload> techniques,
        FightDynamics fightDynamics,
        WearableMetrics wearable
) {

    public SessionPayload {
        techniques = techniques == null ? List.of() : List.copyOf(techniques);
        fightDynamics = fightDynamics == null ? FightDynamics.ZERO : fightDynamics;
        wearable = wearable == null ? WearableMetrics.EMPTY : wearable;
    }

    public TrackingMode mode() {
        return rollTracking.mode();
    }
}
