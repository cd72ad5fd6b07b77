package com.rivaflow.backend.modules.wearable.application;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.rivaflow.backend.modules.session.domain.SessionValidator;
import com.rivaflow.backend.modules.session.domain.TrainingSession;
import com.rivaflow.backend.modules.session.domain.WearableMetrics;
import com.rivaflow.backend.modules.wearable.config.WearableMatchingProperties;
import com.rivaflow.backend.modules.wearable.domain.MatchableSession;
import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;
import com.rivaflow.backend.modules.wearable.domain.WorkoutMatch;

import org.springframework.stereotype.Component;

/**
 * Pairs wearable workouts with logged sessions.
 *
 * <p>A session's start is its date and class time in the training zone, or midday when no
 * time was logged. Workouts starting outside the configured window around that instant are
 * not candidates at all. The rest are scored as
 * {@code proximityWeight * (1 - |startDelta| / window) + durationWeight * min(d1, d2) / max(d1, d2)}.
 * A workout linked to another session is never offered.</p>
 */
@Component
public class WearableReconciler {

    private static final double KILOJOULES_PER_KILOCALORIE = 4.184;

    private final WearableMatchingProperties properties;
    private final ZoneId trainingZone;

    public WearableReconciler(WearableMatchingProperties properties, ZoneId trainingZone) {
        this.properties = properties;
        this.trainingZone = trainingZone;
    }

    public ZonedDateTime estimatedStart(LocalDate sessionDate, LocalTime classTime) {
        LocalTime time = classTime != null ? classTime : LocalTime.NOON;
        return ZonedDateTime.of(sessionDate, time, trainingZone);
    }

    public List<WorkoutMatch> findCandidates(MatchableSession session, List<WearableWorkout> workouts) {
        Instant sessionStart = estimatedStart(session.sessionDate(), session.classTime()).toInstant();
        Instant sessionEnd = sessionStart.plus(Duration.ofMinutes(session.durationMinutes()));
        double windowSeconds = properties.getWindow().toSeconds();

        List<WorkoutMatch> matches = new ArrayList<>();
        for (WearableWorkout workout : workouts) {
            if (workout.isLinkedToOtherThan(session.sessionId())) {
                continue;
            }
            long deltaSeconds = Math.abs(Duration.between(sessionStart, workout.getStartTime()).toSeconds());
            if (deltaSeconds > windowSeconds) {
                continue;
            }
            double proximity = 1.0 - deltaSeconds / windowSeconds;
            double workoutMinutes = Duration.between(workout.getStartTime(), workout.getEndTime()).toSeconds() / 60.0;
            double score = properties.getProximityWeight() * proximity
                    + properties.getDurationWeight() * durationRatio(session.durationMinutes(), workoutMinutes);
            boolean confirmed = session.sessionId() != null && session.sessionId().equals(workout.getLinkedSessionId());
            matches.add(new WorkoutMatch(
                    session.sessionId(),
                    workout.getId(),
                    round(score, 4),
                    deltaSeconds / 60,
                    overlapPercent(sessionStart, sessionEnd, workout.getStartTime(), workout.getEndTime()),
                    confirmed
            ));
        }

        matches.sort(Comparator.comparingDouble(WorkoutMatch::score).reversed()
                .thenComparingLong(WorkoutMatch::startDeltaMinutes)
                .thenComparing(WorkoutMatch::workoutId, Comparator.nullsLast(Comparator.naturalOrder())));
        return List.copyOf(matches);
    }

    /**
     * The candidate to pre-apply, present only when exactly one candidate reaches the
     * high-confidence threshold.
     */
    public Optional<WorkoutMatch> selectHighConfidence(List<WorkoutMatch> candidates) {
        List<WorkoutMatch> confident = candidates.stream()
                .filter(match -> match.score() >= properties.getHighConfidenceThreshold())
                .toList();
        return confident.size() == 1 ? Optional.of(confident.get(0)) : Optional.empty();
    }

    public boolean needsReauthorization(Collection<String> grantedScopes, Collection<String> requiredScopes) {
        Set<String> granted = grantedScopes == null ? Set.of() : new HashSet<>(grantedScopes);
        return !granted.containsAll(requiredScopes);
    }

    public boolean needsReauthorization(Collection<String> grantedScopes) {
        return needsReauthorization(grantedScopes, properties.getRequiredScopes());
    }

    public List<String> missingScopes(Collection<String> grantedScopes) {
        Set<String> granted = grantedScopes == null ? Set.of() : new HashSet<>(grantedScopes);
        return properties.getRequiredScopes().stream()
                .filter(scope -> !granted.contains(scope))
                .toList();
    }

    /**
     * Copies the workout's metrics into the session and links both sides. Applying the same
     * pair again leaves them as they are.
     */
    public void confirm(TrainingSession session, WearableWorkout workout, boolean needsReview) {
        session.setWearableMetrics(metricsOf(workout));
        session.setWearableWorkoutId(workout.getId());
        session.setNeedsReview(needsReview);
        workout.setLinkedSessionId(session.getId());
    }

    public void clear(TrainingSession session, WearableWorkout linkedWorkout) {
        session.setWearableMetrics(WearableMetrics.EMPTY);
        session.setWearableWorkoutId(null);
        session.setNeedsReview(false);
        if (linkedWorkout != null && session.getId() != null && session.getId().equals(linkedWorkout.getLinkedSessionId())) {
            linkedWorkout.setLinkedSessionId(null);
        }
    }

    /**
     * Session-side metrics for a workout. Values are brought inside the ranges a session
     * accepts: strain is capped, out-of-range heart rates are dropped and an average above the
     * maximum is dropped, so a linked session always stays editable.
     */
    public WearableMetrics metricsOf(WearableWorkout workout) {
        Double strain = workout.getStrain() != null
                ? round(Math.max(0.0, Math.min(SessionValidator.MAX_STRAIN, workout.getStrain())), 1)
                : null;
        Integer calories = workout.getCalories();
        if ((calories == null || calories == 0) && workout.getKilojoules() != null && workout.getKilojoules() > 0) {
            calories = (int) Math.round(workout.getKilojoules() / KILOJOULES_PER_KILOCALORIE);
        }
        if (calories != null && calories < 0) {
            calories = null;
        }
        Integer maxHeartRate = heartRateOrNull(workout.getMaxHeartRate());
        Integer avgHeartRate = heartRateOrNull(workout.getAvgHeartRate());
        if (avgHeartRate != null && maxHeartRate != null && avgHeartRate > maxHeartRate) {
            avgHeartRate = null;
        }
        return new WearableMetrics(strain, calories, avgHeartRate, maxHeartRate);
    }

    /**
     * Start of the workout in its own recorded offset, falling back to the training zone.
     */
    public ZonedDateTime localStart(WearableWorkout workout) {
        ZoneId zone = workout.parsedOffset() != null ? workout.parsedOffset() : trainingZone;
        return workout.getStartTime().atZone(zone);
    }

    private static Integer heartRateOrNull(Integer heartRate) {
        if (heartRate == null || heartRate < 0 || heartRate > SessionValidator.MAX_HEART_RATE) {
            return null;
        }
        return heartRate;
    }

    private static double durationRatio(double sessionMinutes, double workoutMinutes) {
        double longer = Math.max(sessionMinutes, workoutMinutes);
        if (longer <= 0) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(sessionMinutes, workoutMinutes)) / longer;
    }

    private static double overlapPercent(Instant sessionStart, Instant sessionEnd, Instant workoutStart, Instant workoutEnd) {
        Instant overlapStart = sessionStart.isAfter(workoutStart) ? sessionStart : workoutStart;
        Instant overlapEnd = sessionEnd.isBefore(workoutEnd) ? sessionEnd : workoutEnd;
        long overlapSeconds = Math.max(0, Duration.between(overlapStart, overlapEnd).toSeconds());
        long shorter = Math.min(Duration.between(sessionStart, sessionEnd).toSeconds(),
                Duration.between(workoutStart, workoutEnd).toSeconds());
        if (shorter <= 0) {
            return 0.0;
        }
        return round(100.0 * overlapSeconds / shorter, 1);
    }

    private static double round(double value, int decimals) {
        double factor = Math.pow(10, decimals);
        return Math.round(value * factor) / factor;
    }
}
