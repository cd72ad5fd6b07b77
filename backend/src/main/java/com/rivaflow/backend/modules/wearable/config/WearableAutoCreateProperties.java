package com.rivaflow.backend.modules.wearable.config;

import java.time.Duration;

import com.rivaflow.backend.modules.session.domain.ClassType;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Defaults for sessions created from unlinked workouts. The user edits them afterwards,
 * which is why those sessions are flagged for review.
 */
@ConfigurationProperties(prefix = "rivaflow.wearable.auto-create")
public class WearableAutoCreateProperties {

    private Duration lookback = Duration.ofDays(7);

    private String defaultGymName = "(Set in Profile)";

    private ClassType defaultClassType = ClassType.NO_GI;

    private int defaultIntensity = 4;

    public Duration getLookback() {
        return lookback;
    }

    public void setLookback(Duration lookback) {
        this.lookback = lookback;
    }

    public String getDefaultGymName() {
        return defaultGymName;
    }

    public void setDefaultGymName(String defaultGymName) {
        this.defaultGymName = defaultGymName;
    }

    public ClassType getDefaultClassType() {
        return defaultClassType;
    }

    public void setDefaultClassType(ClassType defaultClassType) {
        this.defaultClassType = defaultClassType;
    }

    public int getDefaultIntensity() {
        return defaultIntensity;
    }

    public void setDefaultIntensity(int defaultIntensity) {
        this.defaultIntensity = defaultIntensity;
    }
}
