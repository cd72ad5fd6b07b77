package com.rivaflow.backend.modules.session.domain;

import java.util.Arrays;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ClassType {
    GI("gi", true),
    NO_GI("no-gi", true),
    OPEN_MAT("open-mat", true),
    COMPETITION("competition", true),
    STRENGTH_AND_CONDITIONING("s&c", false),
    CARDIO("cardio", false),
    MOBILITY("mobility", false),
    DRILLING("drilling", false);

    private final String code;
    private final boolean sparring;

    ClassType(String code, boolean sparring) {
        this.code = code;
        this.sparring = sparring;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * Sparring classes are the ones where rolls, partners and fight dynamics are tracked.
     */
    public boolean isSparring() {
        return sparring;
    }

    @JsonCreator
    public static ClassType fromCode(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown class type: " + value));
    }
}
