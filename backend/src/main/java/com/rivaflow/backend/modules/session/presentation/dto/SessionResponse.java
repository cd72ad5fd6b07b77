package com.rivaflow.backend.modules.session.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.rivaflow.backend.modules.session.domain.ClassType;
import com.rivaflow.backend.modules.session.domain.FightDynamics;
import com.rivaflow.backend.modules.session.domain.PartnerRef;
import com.rivaflow.backend.modules.session.domain.RollPayload;
import com.rivaflow.backend.modules.session.domain.SessionSource;
import com.rivaflow.backend.modules.session.domain.TechniquePayload;
import com.rivaflow.backend.modules.session.domain.TrackingMode;
import com.rivaflow.backend.modules.session.domain.WearableMetrics;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
        UUID id,
        LocalDate sessionDate,
        @JsonFormat(pattern = "HH:mm") LocalTime classTime,
        ClassType classType,
        String gymName,
        String location,
        String notes,
        Integer durationMinutes,
        Integer intensity,
        TrackingMode mode,
        int rollCount,
        int submissionsFor,
        int submissionsAgainst,
        List<PartnerRef> partners,
        List<RollPayload> rolls,
        List<TechniquePayload> techniques,
        FightDynamics fightDynamics,
        WearableMetrics wearable,
        UUID wearableWorkoutId,
        boolean needsReview,
        SessionSource source,
        long version,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
