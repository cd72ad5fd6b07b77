package com.rivaflow.backend.modules.glossary.domain;

import com.fasterxml.jackson.annotation.JsonValue;

public enum MovementCategory {
    POSITION,
    SUBMISSION,
    SWEEP,
    PASS,
    TAKEDOWN,
    ESCAPE,
    MOVEMENT,
    CONCEPT;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
