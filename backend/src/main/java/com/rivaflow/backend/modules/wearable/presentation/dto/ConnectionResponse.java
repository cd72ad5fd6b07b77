package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConnectionResponse(
        boolean connected,
        List<String> grantedScopes,
        boolean autoCreateSessions,
        boolean needsReauthorization,
        List<String> missingScopes,
        OffsetDateTime connectedAt,
        OffsetDateTime lastSyncedAt
) {
}
