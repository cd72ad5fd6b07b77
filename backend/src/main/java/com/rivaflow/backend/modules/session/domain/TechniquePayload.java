package com.rivaflow.backend.modules.session.domain;

import java.util.List;

public record TechniquePayload(
        int techniqueNumber,
        Long movementId,
        String movementName,
        String notes,
        List<MediaUrl> mediaUrls
) {

    public TechniquePayload {
        mediaUrls = mediaUrls == null ? List.of() : List.copyOf(mediaUrls);
    }
}
