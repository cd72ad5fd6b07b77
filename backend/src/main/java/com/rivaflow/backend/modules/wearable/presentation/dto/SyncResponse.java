package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rivaflow.backend.modules.session.presentation.dto.SessionResponse;
import com.rivaflow.backend.modules.wearable.application.SyncStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SyncResponse(
        SyncStatus status,
        SessionResponse session,
        List<WorkoutMatchResponse> candidates,
        List<String> missingScopes
) {
}
