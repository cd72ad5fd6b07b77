package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.time.Instant;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkoutSummary(
        UUID id,
        String externalId,
        Instant startTime,
        Instant endTime,
        String timezoneOffset,
        long durationMinutes,
        String sportName,
        Double strain,
        Integer calories,
        Integer avgHeartRate,
        Integer maxHeartRate,
        UUID linkedSessionId
) {

    public static WorkoutSummary from(WearableWorkout workout) {
        return new WorkoutSummary(
                workout.getId(),
                workout.getExternalId(),
                workout.getStartTime(),
                workout.getEndTime(),
                workout.getTimezoneOffset(),
                workout.durationMinutes(),
                workout.getSportName(),
                workout.getStrain(),
                workout.getCalories(),
                workout.getAvgHeartRate(),
                workout.getMaxHeartRate(),
                workout.getLinkedSessionId()
        );
    }
}
