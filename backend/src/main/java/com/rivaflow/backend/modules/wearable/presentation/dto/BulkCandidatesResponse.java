package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.List;

public record BulkCandidatesResponse(
        List<CandidateListResponse> items
) {
}
