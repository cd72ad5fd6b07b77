package com.rivaflow.backend.modules.session.domain;

public enum SessionSource {
    MANUAL,
    WEARABLE
}
