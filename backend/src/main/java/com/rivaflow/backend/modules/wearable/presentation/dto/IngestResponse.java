package com.rivaflow.backend.modules.wearable.presentation.dto;

public record IngestResponse(
        int created,
        int updated
) {
}
