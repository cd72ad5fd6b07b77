package com.rivaflow.backend.modules.partner.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a partner record came from, in merge priority order.
 */
public enum PartnerSource {
    INSTRUCTOR(0),
    MANUAL(1),
    SOCIAL(2);

    private final int priority;

    PartnerSource(int priority) {
        this.priority = priority;
    }

    public int getPriority() {
        return priority;
    }

    @JsonValue
    public String getCode() {
        return name().toLowerCase();
    }
}
