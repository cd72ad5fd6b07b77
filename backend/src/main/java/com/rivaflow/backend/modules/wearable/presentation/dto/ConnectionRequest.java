package com.rivaflow.backend.modules.wearable.presentation.dto;

import java.util.List;

import jakarta.validation.constraints.NotBlank;

/**
 * Absent fields keep their current value.
 */
public record ConnectionRequest(
        List<@NotBlank String> grantedScopes,
        Boolean autoCreateSessions
) {
}
