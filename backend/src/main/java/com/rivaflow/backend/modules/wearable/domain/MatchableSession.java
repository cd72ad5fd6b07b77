package com.rivaflow.backend.modules.wearable.domain;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.UUID;

import com.rivaflow.backend.modules.session.domain.TrainingSession;

/**
 * The parts of a session that matching looks at.
 */
public record MatchableSession(
        UUID sessionId,
        LocalDate sessionDate,
        LocalTime classTime,
        int durationMinutes,
        UUID linkedWorkoutId
) {

    public static MatchableSession of(TrainingSession session) {
        return new MatchableSession(
                session.getId(),
                session.getSessionDate(),
                session.getClassTime(),
                session.getDurationMinutes(),
                session.getWearableWorkoutId()
        );
    }
}
