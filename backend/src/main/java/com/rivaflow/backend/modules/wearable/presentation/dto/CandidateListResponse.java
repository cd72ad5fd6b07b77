package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.List;
import java.util.UUID;

public record CandidateListResponse(
        UUID sessionId,
        List<WorkoutMatchResponse> candidates
) {
}
