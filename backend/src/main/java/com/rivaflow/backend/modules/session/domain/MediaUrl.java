package com.rivaflow.backend.modules.session.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Reference media attached to a technique. Stored inside the technique row as JSON.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MediaUrl(MediaType type, String url, String title) {

    public MediaUrl {
        type = type == null ? MediaType.VIDEO : type;
    }

    public static MediaUrl blank() {
        return new MediaUrl(MediaType.VIDEO, "", null);
    }

    public boolean hasUrl() {
        return url != null && !url.isBlank();
    }

    MediaUrl apply(MediaPatch patch) {
        return new MediaUrl(
                patch.type() != null ? patch.type() : type,
                patch.url() != null ? patch.url().trim() : url,
                patch.title() != null ? (patch.title().isBlank() ? null : patch.title()) : title
        );
    }
}
