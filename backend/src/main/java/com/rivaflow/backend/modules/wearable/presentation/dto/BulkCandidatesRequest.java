package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.List;
import java.util.UUID;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BulkCandidatesRequest(
        @NotEmpty
        @Size(max = 100)
        List<@NotNull UUID> sessionIds
) {
}
