package com.rivaflow.backend.modules.wearable.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Minutes spent per heart-rate zone, keyed by zone name in vendor order.
 */
public record ZoneDurations(Map<String, Integer> minutesByZone) {

    public ZoneDurations {
        minutesByZone = Collections.unmodifiableMap(new LinkedHashMap<>(minutesByZone));
    }

    @JsonValue
    public Map<String, Integer> minutesByZone() {
        return minutesByZone;
    }

    public int totalMinutes() {
        return minutesByZone.values().stream().mapToInt(minutes -> minutes == null ? 0 : minutes).sum();
    }
}
