package com.rivaflow.backend.modules.session.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum MediaType {
    VIDEO,
    IMAGE;

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }

    @JsonCreator
    public static MediaType fromCode(String value) {
        return value == null ? null : MediaType.valueOf(value.trim().toUpperCase());
    }
}
