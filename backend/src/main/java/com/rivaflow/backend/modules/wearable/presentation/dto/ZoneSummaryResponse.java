package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.Map;
import java.util.UUID;

import com.rivaflow.backend.modules.wearable.domain.ZoneDurations;

public record ZoneSummaryResponse(
        Map<UUID, ZoneDurations> zones
) {
}
