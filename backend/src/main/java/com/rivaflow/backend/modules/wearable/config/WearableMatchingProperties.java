package com.rivaflow.backend.modules.wearable.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "rivaflow.wearable.matching")
public class WearableMatchingProperties {

    /** Workouts starting further than this from the session's estimated start are not candidates. */
    private Duration window = Duration.ofMinutes(180);

    private double proximityWeight = 0.7;

    private double durationWeight = 0.3;

    /** A lone candidate at or above this score is applied without asking (flagged for review). */
    private double highConfidenceThreshold = 0.90;

    private List<String> requiredScopes = new ArrayList<>(List.of(
            "read:workout",
            "read:recovery",
            "read:sleep",
            "read:cycles",
            "read:body_measurement",
            "read:profile",
            "offline"
    ));

    public Duration getWindow() {
        return window;
    }

    public void setWindow(Duration window) {
        this.window = window;
    }

    public double getProximityWeight() {
        return proximityWeight;
    }

    public void setProximityWeight(double proximityWeight) {
        this.proximityWeight = proximityWeight;
    }

    public double getDurationWeight() {
        return durationWeight;
    }

    public void setDurationWeight(double durationWeight) {
        this.durationWeight = durationWeight;
    }

    public double getHighConfidenceThreshold() {
        return highConfidenceThreshold;
    }

    public void setHighConfidenceThreshold(double highConfidenceThreshold) {
        this.highConfidenceThreshold = highConfidenceThreshold;
    }

    public List<String> getRequiredScopes() {
        return requiredScopes;
    }

    public void setRequiredScopes(List<String> requiredScopes) {
        this.requiredScopes = requiredScopes;
    }
}
