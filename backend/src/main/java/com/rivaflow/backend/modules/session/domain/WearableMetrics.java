package com.rivaflow.backend.modules.session.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record WearableMetrics(
        Double strain,
        Integer calories,
        Integer avgHeartRate,
        Integer maxHeartRate
) {

    public static final WearableMetrics EMPTY = new WearableMetrics(null, null, null, null);

    @JsonIgnore
    public boolean isEmpty() {
        return strain == null && calories == null && avgHeartRate == null && maxHeartRate == null;
    }
}
