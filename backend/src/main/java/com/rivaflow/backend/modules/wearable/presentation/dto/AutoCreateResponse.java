package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.modules.wearable.application.AutoCreateStatus;

public record AutoCreateResponse(
        AutoCreateStatus status,
        List<UUID> createdSessionIds,
        int skipped
) {
}
