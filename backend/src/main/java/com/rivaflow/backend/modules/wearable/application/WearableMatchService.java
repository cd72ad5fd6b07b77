package com.rivaflow.backend.modules.wearable.application;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.rivaflow.backend.global.error.ProblemException;
import com.rivaflow.backend.modules.session.domain.TrainingSession;
import com.rivaflow.backend.modules.session.infrastructure.persistence.SessionPersistenceMapper;
import com.rivaflow.backend.modules.session.infrastructure.persistence.TrainingSessionRepository;
import com.rivaflow.backend.modules.session.presentation.dto.SessionDtoMapper;
import com.rivaflow.backend.modules.session.presentation.dto.SessionResponse;
import com.rivaflow.backend.modules.wearable.config.WearableMatchingProperties;
import com.rivaflow.backend.modules.wearable.domain.MatchableSession;
import com.rivaflow.backend.modules.wearable.domain.WearableIntegrationGateway;
import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;
import com.rivaflow.backend.modules.wearable.domain.WorkoutMatch;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableConnectionRepository;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableWorkoutRepository;
import com.rivaflow.backend.modules.wearable.presentation.dto.BulkCandidatesResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.CandidateListResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.SyncResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.WorkoutMatchResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.ZoneSummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class WearableMatchService {

    private static final Logger log = LoggerFactory.getLogger(WearableMatchService.class);

    private final TrainingSessionRepository sessionRepository;
    private final WearableWorkoutRepository workoutRepository;
    private final WearableConnectionRepository connectionRepository;
    private final WearableIntegrationGateway gateway;
    private final WearableReconciler reconciler;
    private final WearableMatchingProperties matchingProperties;
    private final Clock clock;

    public WearableMatchService(
            TrainingSessionRepository sessionRepository,
            WearableWorkoutRepository workoutRepository,
            WearableConnectionRepository connectionRepository,
            WearableIntegrationGateway gateway,
            WearableReconciler reconciler,
            WearableMatchingProperties matchingProperties,
            Clock clock
    ) {
        this.sessionRepository = sessionRepository;
        this.workoutRepository = workoutRepository;
        this.connectionRepository = connectionRepository;
        this.gateway = gateway;
        this.reconciler = reconciler;
        this.matchingProperties = matchingProperties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public CandidateListResponse candidates(UUID ownerId, UUID sessionId) {
        TrainingSession session = sessionRepository.findByIdAndOwnerId(sessionId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
        return candidatesFor(ownerId, session);
    }

    /**
     * Candidates for several sessions at once. Each session is looked up on its own; unknown ids
     * are left out of the result.
     */
    @Transactional(readOnly = true)
    public BulkCandidatesResponse candidatesForSessions(UUID ownerId, List<UUID> sessionIds) {
        Set<UUID> requested = new LinkedHashSet<>(sessionIds);
        Map<UUID, TrainingSession> sessions = sessionRepository.findByOwnerIdAndIdIn(ownerId, requested).stream()
                .collect(Collectors.toMap(TrainingSession::getId, Function.identity()));
        List<CandidateListResponse> items = new ArrayList<>();
        for (UUID sessionId : requested) {
            TrainingSession session = sessions.get(sessionId);
            if (session != null) {
                items.add(candidatesFor(ownerId, session));
            }
        }
        return new BulkCandidatesResponse(items);
    }

    /**
     * Looks for workouts around the session and pre-applies the match when exactly one candidate
     * is a high-confidence hit. An applied match stays flagged for review until the user keeps it.
     */
    public SyncResponse sync(UUID ownerId, UUID sessionId) {
        TrainingSession session = sessionRepository.findByIdAndOwnerIdForUpdate(sessionId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));

        Set<String> granted = gateway.getGrantedScopes(ownerId);
        if (reconciler.needsReauthorization(granted)) {
            log.info("Wearable sync for session {} needs reauthorization", sessionId);
            return new SyncResponse(SyncStatus.REAUTHORIZATION_REQUIRED, toResponse(session), null,
                    reconciler.missingScopes(granted));
        }
        touchLastSynced(ownerId);

        List<WearableWorkout> workouts = workoutsAround(ownerId, session);
        List<WorkoutMatch> matches = reconciler.findCandidates(MatchableSession.of(session), workouts);
        if (matches.isEmpty()) {
            return new SyncResponse(SyncStatus.NO_CANDIDATES, toResponse(session), List.of(), null);
        }

        Map<UUID, WearableWorkout> byId = indexById(workouts);
        Optional<WorkoutMatch> confident = session.getWearableWorkoutId() == null
                ? reconciler.selectHighConfidence(matches)
                : Optional.empty();
        if (confident.isPresent()) {
            WearableWorkout workout = workoutRepository.findByIdAndOwnerIdForUpdate(confident.get().workoutId(), ownerId)
                    .orElseThrow(() -> ProblemException.notFound("WORKOUT_NOT_FOUND"));
            if (!workout.isLinkedToOtherThan(sessionId)) {
                reconciler.confirm(session, workout, true);
                workoutRepository.saveAndFlush(workout);
                TrainingSession saved = sessionRepository.saveAndFlush(session);
                log.info("Auto-applied workout {} to session {} (score {})", workout.getId(), sessionId,
                        confident.get().score());
                List<WorkoutMatch> refreshed = reconciler.findCandidates(MatchableSession.of(saved), workouts);
                return new SyncResponse(SyncStatus.AUTO_APPLIED, toResponse(saved), toResponses(refreshed, byId), null);
            }
        }
        return new SyncResponse(SyncStatus.CANDIDATES, toResponse(session), toResponses(matches, byId), null);
    }

    /**
     * Links the workout to the session and copies its metrics. Confirming the pair that is already
     * linked changes nothing; confirming a different workout releases the previous one.
     */
    public SessionResponse confirm(UUID ownerId, UUID sessionId, UUID workoutId) {
        TrainingSession session = sessionRepository.findByIdAndOwnerIdForUpdate(sessionId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
        WearableWorkout workout = workoutRepository.findByIdAndOwnerIdForUpdate(workoutId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("WORKOUT_NOT_FOUND"));
        if (workout.isLinkedToOtherThan(sessionId)) {
            log.warn("Rejected confirm of workout {} for session {}: linked to session {}", workoutId, sessionId,
                    workout.getLinkedSessionId());
            throw ProblemException.conflict("WORKOUT_ALREADY_MATCHED",
                    "Workout is already matched to another session");
        }

        UUID previousId = session.getWearableWorkoutId();
        if (previousId != null && !previousId.equals(workoutId)) {
            workoutRepository.findByIdAndOwnerIdForUpdate(previousId, ownerId)
                    .filter(previous -> sessionId.equals(previous.getLinkedSessionId()))
                    .ifPresent(previous -> {
                        previous.setLinkedSessionId(null);
                        workoutRepository.saveAndFlush(previous);
                    });
        }

        reconciler.confirm(session, workout, false);
        workoutRepository.saveAndFlush(workout);
        TrainingSession saved = sessionRepository.saveAndFlush(session);
        log.info("Confirmed workout {} for session {}", workoutId, sessionId);
        return toResponse(saved);
    }

    public SessionResponse clear(UUID ownerId, UUID sessionId) {
        TrainingSession session = sessionRepository.findByIdAndOwnerIdForUpdate(sessionId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
        WearableWorkout linked = session.getWearableWorkoutId() == null
                ? null
                : workoutRepository.findByIdAndOwnerIdForUpdate(session.getWearableWorkoutId(), ownerId).orElse(null);

        reconciler.clear(session, linked);
        if (linked != null) {
            workoutRepository.saveAndFlush(linked);
        }
        TrainingSession saved = sessionRepository.saveAndFlush(session);
        log.info("Cleared wearable match for session {}", sessionId);
        return toResponse(saved);
    }

    @Transactional(readOnly = true)
    public ZoneSummaryResponse zoneSummary(UUID ownerId, List<UUID> sessionIds) {
        List<UUID> ids = List.copyOf(new LinkedHashSet<>(sessionIds));
        Map<UUID, WearableWorkout> workouts = gateway.getWorkoutsForSessions(ownerId, ids);
        return new ZoneSummaryResponse(ZoneSummaryComputer.summarize(ids, workouts));
    }

    private CandidateListResponse candidatesFor(UUID ownerId, TrainingSession session) {
        List<WearableWorkout> workouts = workoutsAround(ownerId, session);
        List<WorkoutMatch> matches = reconciler.findCandidates(MatchableSession.of(session), workouts);
        return new CandidateListResponse(session.getId(), toResponses(matches, indexById(workouts)));
    }

    private List<WearableWorkout> workoutsAround(UUID ownerId, TrainingSession session) {
        Instant start = reconciler.estimatedStart(session.getSessionDate(), session.getClassTime()).toInstant();
        Duration window = matchingProperties.getWindow();
        return gateway.listWorkoutsBetween(ownerId, start.minus(window), start.plus(window));
    }

    private void touchLastSynced(UUID ownerId) {
        connectionRepository.findById(ownerId)
                .ifPresent(connection -> connection.setLastSyncedAt(OffsetDateTime.now(clock)));
    }

    private static Map<UUID, WearableWorkout> indexById(List<WearableWorkout> workouts) {
        return workouts.stream()
                .filter(workout -> workout.getId() != null)
                .collect(Collectors.toMap(WearableWorkout::getId, Function.identity(), (first, second) -> first));
    }

    private static List<WorkoutMatchResponse> toResponses(List<WorkoutMatch> matches, Map<UUID, WearableWorkout> byId) {
        return matches.stream()
                .map(match -> WorkoutMatchResponse.from(match, byId.get(match.workoutId())))
                .toList();
    }

    private static SessionResponse toResponse(TrainingSession session) {
        return SessionDtoMapper.toResponse(SessionPersistenceMapper.toStored(session));
    }
}
