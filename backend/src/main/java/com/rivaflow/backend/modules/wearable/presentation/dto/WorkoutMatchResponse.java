package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;
import com.rivaflow.backend.modules.wearable.domain.WorkoutMatch;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkoutMatchResponse(
        UUID sessionId,
        UUID workoutId,
        double score,
        long startDeltaMinutes,
        double overlapPercent,
        boolean confirmed,
        WorkoutSummary workout
) {

    public static WorkoutMatchResponse from(WorkoutMatch match, WearableWorkout workout) {
        return new WorkoutMatchResponse(
                match.sessionId(),
                match.workoutId(),
                match.score(),
                match.startDeltaMinutes(),
                match.overlapPercent(),
                match.confirmed(),
                workout != null ? WorkoutSummary.from(workout) : null
        );
    }
}
