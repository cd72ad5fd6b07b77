package com.rivaflow.backend.modules.wearable.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Read access to the wearable vendor's data for one user. Implementations are already
 * authenticated; this service never runs the OAuth flow.
 */
public interface WearableIntegrationGateway {

    List<WearableWorkout> listRecentWorkouts(UUID ownerId, Duration window);

    List<WearableWorkout> listWorkoutsBetween(UUID ownerId, Instant from, Instant to);

    Set<String> getGrantedScopes(UUID ownerId);

    /**
     * Workouts linked to the given sessions, keyed by session id. Sessions without a linked
     * workout are absent from the map.
     */
    Map<UUID, WearableWorkout> getWorkoutsForSessions(UUID ownerId, Collection<UUID> sessionIds);
}
