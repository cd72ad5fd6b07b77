package com.rivaflow.backend.modules.session.domain;

public record MediaPatch(MediaType type, String url, String title) {
}
