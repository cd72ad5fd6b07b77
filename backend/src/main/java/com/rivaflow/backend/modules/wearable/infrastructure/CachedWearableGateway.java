package com.rivaflow.backend.modules.wearable.infrastructure;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.rivaflow.backend.modules.wearable.domain.WearableIntegrationGateway;
import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableConnectionRepository;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableWorkoutRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Serves vendor data from the local cache that {@code POST /wearable/workouts} fills.
 */
@Component
@Transactional(readOnly = true)
public class CachedWearableGateway implements WearableIntegrationGateway {

    private final WearableWorkoutRepository workoutRepository;
    private final WearableConnectionRepository connectionRepository;
    private final Clock clock;

    public CachedWearableGateway(
            WearableWorkoutRepository workoutRepository,
            WearableConnectionRepository connectionRepository,
            Clock clock
    ) {
        this.workoutRepository = workoutRepository;
        this.connectionRepository = connectionRepository;
        this.clock = clock;
    }

    @Override
    public List<WearableWorkout> listRecentWorkouts(UUID ownerId, Duration window) {
        Instant now = clock.instant();
        return workoutRepository.findStartingBetween(ownerId, now.minus(window), now);
    }

    @Override
    public List<WearableWorkout> listWorkoutsBetween(UUID ownerId, Instant from, Instant to) {
        return workoutRepository.findStartingBetween(ownerId, from, to);
    }

    @Override
    public Set<String> getGrantedScopes(UUID ownerId) {
        return connectionRepository.findById(ownerId)
                .map(connection -> (Set<String>) new LinkedHashSet<>(connection.getGrantedScopes()))
                .orElseGet(Set::of);
    }

    @Override
    public Map<UUID, WearableWorkout> getWorkoutsForSessions(UUID ownerId, Collection<UUID> sessionIds) {
        if (sessionIds.isEmpty()) {
            return Map.of();
        }
        return workoutRepository.findByOwnerIdAndLinkedSessionIdIn(ownerId, sessionIds).stream()
                .collect(Collectors.toMap(WearableWorkout::getLinkedSessionId, Function.identity(),
                        (first, second) -> first));
    }
}
