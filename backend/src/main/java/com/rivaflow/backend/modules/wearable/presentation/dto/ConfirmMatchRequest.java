package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.UUID;

import jakarta.validation.constraints.NotNull;

public record ConfirmMatchRequest(
        @NotNull
        UUID workoutId
) {
}
