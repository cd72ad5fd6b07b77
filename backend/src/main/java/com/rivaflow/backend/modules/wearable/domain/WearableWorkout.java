package com.rivaflow.backend.modules.wearable.domain;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import com.rivaflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

/**
 * Local copy of a workout reported by the wearable vendor. Only {@code linkedSessionId} is
 * written by this service; everything else comes from the vendor.
 */
@Entity
@Table(name = "wearable_workout")
public class WearableWorkout extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ownerId;

    @Column(name = "external_id", nullable = false, length = 100)
    private String externalId;

    @Column(name = "start_time", nullable = false)
    private Instant startTime;

    @Column(name = "end_time", nullable = false)
    private Instant endTime;

    @Column(name = "timezone_offset", length = 8)
    private String timezoneOffset;

    @Column(name = "sport_name", length = 100)
    private String sportName;

    @Column(name = "strain")
    private Double strain;

    @Column(name = "calories")
    private Integer calories;

    @Column(name = "kilojoules")
    private Double kilojoules;

    @Column(name = "avg_heart_rate")
    private Integer avgHeartRate;

    @Column(name = "max_heart_rate")
    private Integer maxHeartRate;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "zone_durations", columnDefinition = "jsonb")
    private Map<String, Integer> zoneDurations;

    @Column(name = "linked_session_id", columnDefinition = "uuid")
    private UUID linkedSessionId;

    protected WearableWorkout() {
    }

    public WearableWorkout(UUID ownerId, String externalId, Instant startTime, Instant endTime) {
        this.ownerId = ownerId;
        this.externalId = externalId;
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public long durationMinutes() {
        return Duration.between(startTime, endTime).toMinutes();
    }

    public boolean isLinked() {
        return linkedSessionId != null;
    }

    public boolean isLinkedToOtherThan(UUID sessionId) {
        return linkedSessionId != null && !linkedSessionId.equals(sessionId);
    }

    /**
     * Vendor offset such as {@code +11:00}; {@code null} when absent or unparseable.
     */
    public ZoneOffset parsedOffset() {
        if (timezoneOffset == null || timezoneOffset.isBlank()) {
            return null;
        }
        try {
            return ZoneOffset.of(timezoneOffset.trim());
        } catch (DateTimeException ex) {
            return null;
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public String getExternalId() {
        return externalId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public void setStartTime(Instant startTime) {
        this.startTime = startTime;
    }

    public Instant getEndTime() {
        return endTime;
    }

    public void setEndTime(Instant endTime) {
        this.endTime = endTime;
    }

    public String getTimezoneOffset() {
        return timezoneOffset;
    }

    public void setTimezoneOffset(String timezoneOffset) {
        this.timezoneOffset = timezoneOffset;
    }

    public String getSportName() {
        return sportName;
    }

    public void setSportName(String sportName) {
        this.sportName = sportName;
    }

    public Double getStrain() {
        return strain;
    }

    public void setStrain(Double strain) {
        this.strain = strain;
    }

    public Integer getCalories() {
        return calories;
    }

    public void setCalories(Integer calories) {
        this.calories = calories;
    }

    public Double getKilojoules() {
        return kilojoules;
    }

    public void setKilojoules(Double kilojoules) {
        this.kilojoules = kilojoules;
    }

    public Integer getAvgHeartRate() {
        return avgHeartRate;
    }

    public void setAvgHeartRate(Integer avgHeartRate) {
        this.avgHeartRate = avgHeartRate;
    }

    public Integer getMaxHeartRate() {
        return maxHeartRate;
    }

    public void setMaxHeartRate(Integer maxHeartRate) {
        this.maxHeartRate = maxHeartRate;
    }

    public Map<String, Integer> getZoneDurations() {
        return zoneDurations;
    }

    public void setZoneDurations(Map<String, Integer> zoneDurations) {
        this.zoneDurations = zoneDurations == null ? null : new LinkedHashMap<>(zoneDurations);
    }

    public UUID getLinkedSessionId() {
        return linkedSessionId;
    }

    public void setLinkedSessionId(UUID linkedSessionId) {
        this.linkedSessionId = linkedSessionId;
    }
}
