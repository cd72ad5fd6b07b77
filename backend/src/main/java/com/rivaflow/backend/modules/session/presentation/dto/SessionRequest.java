package com.rivaflow.backend.modules.session.presentation.dto;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.rivaflow.backend.modules.session.domain.ClassType;
import com.rivaflow.backend.modules.session.domain.FightDynamics;
import com.rivaflow.backend.modules.session.domain.PartnerRef;
import com.rivaflow.backend.modules.session.domain.TrackingMode;
import com.rivaflow.backend.modules.session.domain.WearableMetrics;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Size;

/**
 * Full session edit. Required fields and ranges are checked by the session validator so
 * that every problem comes back as a field violation in one response.
 */
public record SessionRequest(
        LocalDate sessionDate,
        @JsonFormat(pattern = "HH:mm") LocalTime classTime,
        ClassType classType,
        String gymName,
        String location,
        @Size(max = 4000) String notes,
        Integer durationMinutes,
        Integer intensity,
        TrackingMode mode,
        Integer rollCount,
        Integer submissionsFor,
        Integer submissionsAgainst,
        List<PartnerRef> partners,
        List<@Valid RollInput> rolls,
        List<@Valid TechniqueInput> techniques,
        FightDynamics fightDynamics,
        WearableMetrics wearable,
        Long version
) {
}
