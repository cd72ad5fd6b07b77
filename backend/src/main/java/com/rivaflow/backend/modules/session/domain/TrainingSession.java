package com.rivaflow.backend.modules.session.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.Table;
import jakarta.persistence.Version;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "training_session")
public class TrainingSession extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ownerId;

    @Version
    @Column(name = "version", nullable = false)
    private long version;

    @Column(name = "session_date", nullable = false)
    private LocalDate sessionDate;

    @Column(name = "class_time")
    private LocalTime classTime;

    @Enumerated(EnumType.STRING)
    @Column(name = "class_type", nullable = false, length = 32)
    private ClassType classType;

    @Column(name = "gym_name", nullable = false, length = 100)
    private String gymName;

    @Column(name = "location", length = 200)
    private String location;

    @Column(name = "notes")
    private String notes;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @Column(name = "intensity", nullable = false)
    private int intensity;

    @Enumerated(EnumType.STRING)
    @Column(name = "tracking_mode", nullable = false, length = 16)
    private TrackingMode mode = TrackingMode.SIMPLE;

    @Column(name = "roll_count", nullable = false)
    private int rollCount;

    @Column(name = "submissions_for", nullable = false)
    private int submissionsFor;

    @Column(name = "submissions_against", nullable = false)
    private int submissionsAgainst;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "partners", columnDefinition = "jsonb")
    private List<PartnerRef> partners = new ArrayList<>();

    @Column(name = "attacks_attempted", nullable = false)
    private int attacksAttempted;

    @Column(name = "attacks_successful", nullable = false)
    private int attacksSuccessful;

    @Column(name = "defenses_attempted", nullable = false)
    private int defensesAttempted;

    @Column(name = "defenses_successful", nullable = false)
    private int defensesSuccessful;

    @Column(name = "strain")
    private Double strain;

    @Column(name = "calories")
    private Integer calories;

    @Column(name = "avg_heart_rate")
    private Integer avgHeartRate;

    @Column(name = "max_heart_rate")
    private Integer maxHeartRate;

    @Column(name = "wearable_workout_id", columnDefinition = "uuid")
    private UUID wearableWorkoutId;

    @Column(name = "needs_review", nullable = false)
    private boolean needsReview;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private SessionSource source = SessionSource.MANUAL;

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("rollNumber ASC")
    private List<SessionRoll> rolls = new ArrayList<>();

    @OneToMany(mappedBy = "session", cascade = CascadeType.ALL, fetch = FetchType.LAZY, orphanRemoval = true)
    @OrderBy("techniqueNumber ASC")
    private List<SessionTechnique> techniques = new ArrayList<>();

    protected TrainingSession() {
    }

    public TrainingSession(UUID ownerId) {
        this.ownerId = ownerId;
    }

    public FightDynamics getFightDynamics() {
        return new FightDynamics(attacksAttempted, attacksSuccessful, defensesAttempted, defensesSuccessful);
    }

    public void setFightDynamics(FightDynamics dynamics) {
        this.attacksAttempted = dynamics.attacksAttempted();
        this.attacksSuccessful = dynamics.attacksSuccessful();
        this.defensesAttempted = dynamics.defensesAttempted();
        this.defensesSuccessful = dynamics.defensesSuccessful();
    }

    public WearableMetrics getWearableMetrics() {
        return new WearableMetrics(strain, calories, avgHeartRate, maxHeartRate);
    }

    public void setWearableMetrics(WearableMetrics metrics) {
        this.strain = metrics.strain();
        this.calories = metrics.calories();
        this.avgHeartRate = metrics.avgHeartRate();
        this.maxHeartRate = metrics.maxHeartRate();
    }

    public void replaceRolls(List<SessionRoll> newRolls) {
        rolls.clear();
        for (SessionRoll roll : newRolls) {
            roll.setSession(this);
            rolls.add(roll);
        }
    }

    public void replaceTechniques(List<SessionTechnique> newTechniques) {
        techniques.clear();
        for (SessionTechnique technique : newTechniques) {
            technique.setSession(this);
            techniques.add(technique);
        }
    }

    public UUID getId() {
        return id;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public long getVersion() {
        return version;
    }

    public LocalDate getSessionDate() {
        return sessionDate;
    }

    public void setSessionDate(LocalDate sessionDate) {
        this.sessionDate = sessionDate;
    }

    public LocalTime getClassTime() {
        return classTime;
    }

    public void setClassTime(LocalTime classTime) {
        this.classTime = classTime;
    }

    public ClassType getClassType() {
        return classType;
    }

    public void setClassType(ClassType classType) {
        this.classType = classType;
    }

    public String getGymName() {
        return gymName;
    }

    public void setGymName(String gymName) {
        this.gymName = gymName;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(int durationMinutes) {
        this.durationMinutes = durationMinutes;
    }

    public int getIntensity() {
        return intensity;
    }

    public void setIntensity(int intensity) {
        this.intensity = intensity;
    }

    public TrackingMode getMode() {
        return mode;
    }

    public void setMode(TrackingMode mode) {
        this.mode = mode;
    }

    public int getRollCount() {
        return rollCount;
    }

    public void setRollCount(int rollCount) {
        this.rollCount = rollCount;
    }

    public int getSubmissionsFor() {
        return submissionsFor;
    }

    public void setSubmissionsFor(int submissionsFor) {
        this.submissionsFor = submissionsFor;
    }

    public int getSubmissionsAgainst() {
        return submissionsAgainst;
    }

    public void setSubmissionsAgainst(int submissionsAgainst) {
        this.submissionsAgainst = submissionsAgainst;
    }

    public List<PartnerRef> getPartners() {
        return partners == null ? List.of() : partners;
    }

    public void setPartners(List<PartnerRef> partners) {
        this.partners = partners == null ? new ArrayList<>() : new ArrayList<>(partners);
    }

    public Double getStrain() {
        return strain;
    }

    public Integer getCalories() {
        return calories;
    }

    public Integer getAvgHeartRate() {
        return avgHeartRate;
    }

    public Integer getMaxHeartRate() {
        return maxHeartRate;
    }

    public UUID getWearableWorkoutId() {
        return wearableWorkoutId;
    }

    public void setWearableWorkoutId(UUID wearableWorkoutId) {
        this.wearableWorkoutId = wearableWorkoutId;
    }

    public boolean isNeedsReview() {
        return needsReview;
    }

    public void setNeedsReview(boolean needsReview) {
        this.needsReview = needsReview;
    }

    public SessionSource getSource() {
        return source;
    }

    public void setSource(SessionSource source) {
        this.source = source;
    }

    public List<SessionRoll> getRolls() {
        return rolls;
    }

    public List<SessionTechnique> getTechniques() {
        return techniques;
    }
}
