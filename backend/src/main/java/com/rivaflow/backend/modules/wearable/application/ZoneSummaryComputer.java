package com.rivaflow.backend.modules.wearable.application;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;
import com.rivaflow.backend.modules.wearable.domain.ZoneDurations;

/**
 * Heart-rate zone minutes per session. Sessions without a matched workout, or whose workout
 * carries no zone data, are left out rather than reported as zero.
 */
public final class ZoneSummaryComputer {

    private ZoneSummaryComputer() {
    }

    public static Map<UUID, ZoneDurations> summarize(List<UUID> sessionIds, Map<UUID, WearableWorkout> workoutsBySessionId) {
        Map<UUID, ZoneDurations> summary = new LinkedHashMap<>();
        for (UUID sessionId : sessionIds) {
            WearableWorkout workout = workoutsBySessionId.get(sessionId);
            if (workout == null || workout.getZoneDurations() == null) {
                continue;
            }
            summary.putIfAbsent(sessionId, new ZoneDurations(workout.getZoneDurations()));
        }
        return summary;
    }
}
