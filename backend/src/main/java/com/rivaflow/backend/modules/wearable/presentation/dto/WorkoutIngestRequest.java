package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;

public record WorkoutIngestRequest(
        @NotEmpty
        @Size(max = 500)
        List<@Valid WorkoutInput> workouts
) {
}
