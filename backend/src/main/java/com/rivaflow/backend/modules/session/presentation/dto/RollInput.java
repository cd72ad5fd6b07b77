package com.rivaflow.backend.modules.session.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.Size;

public record RollInput(
        String partnerId,
        String partnerName,
        Integer durationMinutes,
        List<Long> submissionsFor,
        List<Long> submissionsAgainst,
        @Size(max = 2000) String notes
) {
}
