package com.rivaflow.backend.modules.session.domain;

import java.util.List;

public record RollPayload(
        int rollNumber,
        String partnerId,
        String partnerName,
        int durationMinutes,
        List<Long> submissionsFor,
        List<Long> submissionsAgainst,
        String notes
) {

    public RollPayload {
        submissionsFor = submissionsFor == null ? List.of() : List.copyOf(submissionsFor);
        submissionsAgainst = submissionsAgainst == null ? List.of() : List.copyOf(submissionsAgainst);
    }
}
