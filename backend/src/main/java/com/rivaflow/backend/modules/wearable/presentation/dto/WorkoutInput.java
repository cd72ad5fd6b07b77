package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.time.Instant;
import java.util.Map;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record WorkoutInput(
        @NotBlank
        @Size(max = 100)
        String externalId,
        @NotNull
        Instant startTime,
        @NotNull
        Instant endTime,
        @Size(max = 10)
        String timezoneOffset,
        @Size(max = 100)
        String sportName,
        @PositiveOrZero
        @DecimalMax("21.0")
        Double strain,
        @PositiveOrZero
        Integer calories,
        @PositiveOrZero
        Double kilojoules,
        @PositiveOrZero
        @Max(250)
        Integer avgHeartRate,
        @PositiveOrZero
        @Max(250)
        Integer maxHeartRate,
        Map<String, Integer> zoneDurations
) {
}
