package com.rivaflow.backend.modules.wearable.domain;

import java.util.UUID;

/**
 * A scored pairing proposal between one session and one workout.
 *
 * @param startDeltaMinutes absolute distance between the session's estimated start and the
 *                          workout start
 * @param overlapPercent    time overlap relative to the shorter of the two, for display only
 * @param confirmed         the workout is already linked to this session
 */
public record WorkoutMatch(
        UUID sessionId,
        UUID workoutId,
        double score,
        long startDeltaMinutes,
        double overlapPercent,
        boolean confirmed
) {
}
