package com.rivaflow.backend.modules.session.presentation.dto;

import java.util.List;

import com.rivaflow.backend.modules.session.domain.MediaUrl;

import jakarta.validation.constraints.Size;

/**
 * A technique entry; one without {@code movementId} is an unfinished draft and is not stored.
 */
public record TechniqueInput(
        Long movementId,
        String movementName,
        @Size(max = 2000) String notes,
        List<MediaUrl> mediaUrls
) {
}
