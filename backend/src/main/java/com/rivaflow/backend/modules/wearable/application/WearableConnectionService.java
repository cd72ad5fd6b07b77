package com.rivaflow.backend.modules.wearable.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import com.rivaflow.backend.global.error.ProblemException;
import com.rivaflow.backend.modules.session.domain.FieldViolation;
import com.rivaflow.backend.modules.session.domain.SessionDraft;
import com.rivaflow.backend.modules.session.domain.SessionSaveResult;
import com.rivaflow.backend.modules.session.domain.SessionSource;
import com.rivaflow.backend.modules.session.domain.SessionStore;
import com.rivaflow.backend.modules.session.domain.SessionValidator;
import com.rivaflow.backend.modules.session.domain.TrainingSession;
import com.rivaflow.backend.modules.session.infrastructure.persistence.TrainingSessionRepository;
import com.rivaflow.backend.modules.wearable.config.WearableAutoCreateProperties;
import com.rivaflow.backend.modules.wearable.domain.WearableConnection;
import com.rivaflow.backend.modules.wearable.domain.WearableIntegrationGateway;
import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableConnectionRepository;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableWorkoutRepository;
import com.rivaflow.backend.modules.wearable.presentation.dto.AutoCreateResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.ConnectionRequest;
import com.rivaflow.backend.modules.wearable.presentation.dto.ConnectionResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.IngestResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.WorkoutInput;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Connection state, the local workout cache and sessions created from unmatched workouts.
 */
@Service
@Transactional
public class WearableConnectionService {

    private static final Logger log = LoggerFactory.getLogger(WearableConnectionService.class);
    private static final int MAX_SESSION_MINUTES = 480;

    private final WearableConnectionRepository connectionRepository;
    private final WearableWorkoutRepository workoutRepository;
    private final WearableIntegrationGateway gateway;
    private final TrainingSessionRepository sessionRepository;
    private final SessionStore sessionStore;
    private final SessionValidator sessionValidator;
    private final WearableReconciler reconciler;
    private final WearableAutoCreateProperties autoCreateProperties;
    private final Clock clock;

    public WearableConnectionService(
            WearableConnectionRepository connectionRepository,
            WearableWorkoutRepository workoutRepository,
            WearableIntegrationGateway gateway,
            TrainingSessionRepository sessionRepository,
            SessionStore sessionStore,
            SessionValidator sessionValidator,
            WearableReconciler reconciler,
            WearableAutoCreateProperties autoCreateProperties,
            Clock clock
    ) {
        this.connectionRepository = connectionRepository;
        this.workoutRepository = workoutRepository;
        this.gateway = gateway;
        this.sessionRepository = sessionRepository;
        this.sessionStore = sessionStore;
        this.sessionValidator = sessionValidator;
        this.reconciler = reconciler;
        this.autoCreateProperties = autoCreateProperties;
        this.clock = clock;
    }

    @Transactional(readOnly = true)
    public ConnectionResponse connectionStatus(UUID ownerId) {
        return connectionRepository.findById(ownerId)
                .map(this::toResponse)
                .orElseGet(() -> new ConnectionResponse(false, List.of(), false, true,
                        reconciler.missingScopes(List.of()), null, null));
    }

    public ConnectionResponse updateConnection(UUID ownerId, ConnectionRequest request) {
        WearableConnection connection = connectionRepository.findById(ownerId)
                .orElseGet(() -> new WearableConnection(ownerId, OffsetDateTime.now(clock)));
        if (request.grantedScopes() != null) {
            connection.setGrantedScopes(new ArrayList<>(new LinkedHashSet<>(request.grantedScopes())));
        }
        if (request.autoCreateSessions() != null) {
            connection.setAutoCreateSessions(request.autoCreateSessions());
        }
        boolean firstConnect = !connection.isPersisted();
        WearableConnection saved = connectionRepository.saveAndFlush(connection);
        log.info("{} wearable connection for owner {} (scopes={}, autoCreate={})",
                firstConnect ? "Created" : "Updated", ownerId, saved.getGrantedScopes().size(),
                saved.isAutoCreateSessions());
        return toResponse(saved);
    }

    /**
     * Drops the connection and every cached workout, and blanks the wearable fields of the
     * owner's linked sessions.
     */
    public void disconnect(UUID ownerId) {
        List<TrainingSession> linked = sessionRepository.findByOwnerIdAndWearableWorkoutIdIsNotNull(ownerId);
        for (TrainingSession session : linked) {
            reconciler.clear(session, null);
        }
        sessionRepository.saveAllAndFlush(linked);
        int removed = workoutRepository.deleteAllByOwner(ownerId);
        connectionRepository.findById(ownerId).ifPresent(connectionRepository::delete);
        log.info("Disconnected wearable for owner {}: {} sessions cleared, {} workouts removed",
                ownerId, linked.size(), removed);
    }

    /**
     * Upserts vendor workouts by their external id. The link to a session is never touched here.
     */
    public IngestResponse ingest(UUID ownerId, List<WorkoutInput> workouts) {
        Map<String, WorkoutInput> byExternalId = new LinkedHashMap<>();
        for (WorkoutInput input : workouts) {
            if (input.endTime().isBefore(input.startTime())) {
                throw ProblemException.badRequest("INVALID_WORKOUT_WINDOW",
                        "endTime must not be before startTime for workout " + input.externalId());
            }
            byExternalId.put(input.externalId().trim(), input);
        }

        int created = 0;
        int updated = 0;
        for (Map.Entry<String, WorkoutInput> entry : byExternalId.entrySet()) {
            Optional<WearableWorkout> existing = workoutRepository.findByOwnerIdAndExternalId(ownerId, entry.getKey());
            WorkoutInput input = entry.getValue();
            WearableWorkout workout = existing
                    .orElseGet(() -> new WearableWorkout(ownerId, entry.getKey(), input.startTime(), input.endTime()));
            applyInput(workout, input);
            workoutRepository.save(workout);
            if (existing.isPresent()) {
                updated++;
            } else {
                created++;
            }
        }
        workoutRepository.flush();
        log.debug("Ingested workouts for owner {}: {} created, {} updated", ownerId, created, updated);
        return new IngestResponse(created, updated);
    }

    /**
     * Creates a session for each recent unlinked workout. A workout whose session would not
     * validate is logged and skipped; the others still go through.
     */
    public AutoCreateResponse autoCreateSessions(UUID ownerId) {
        Optional<WearableConnection> connection = connectionRepository.findById(ownerId);
        if (connection.isEmpty() || !connection.get().isAutoCreateSessions()) {
            return new AutoCreateResponse(AutoCreateStatus.DISABLED, List.of(), 0);
        }
        if (reconciler.needsReauthorization(connection.get().getGrantedScopes())) {
            return new AutoCreateResponse(AutoCreateStatus.REAUTHORIZATION_REQUIRED, List.of(), 0);
        }

        List<UUID> createdIds = new ArrayList<>();
        int skipped = 0;
        for (WearableWorkout workout : gateway.listRecentWorkouts(ownerId, autoCreateProperties.getLookback())) {
            if (workout.getLinkedSessionId() != null) {
                continue;
            }
            Optional<UUID> sessionId = createFromWorkout(ownerId, workout);
            if (sessionId.isPresent()) {
                createdIds.add(sessionId.get());
            } else {
                skipped++;
            }
        }
        connection.get().setLastSyncedAt(OffsetDateTime.now(clock));
        log.info("Auto-created {} sessions from workouts for owner {} ({} skipped)", createdIds.size(), ownerId, skipped);
        return new AutoCreateResponse(AutoCreateStatus.COMPLETED, createdIds, skipped);
    }

    private Optional<UUID> createFromWorkout(UUID ownerId, WearableWorkout workout) {
        ZonedDateTime localStart = reconciler.localStart(workout);
        long minutes = Math.max(1, Math.min(MAX_SESSION_MINUTES, workout.durationMinutes()));

        SessionDraft draft = SessionDraft.create(ownerId);
        draft.setSessionDate(localStart.toLocalDate());
        draft.setClassTime(localStart.toLocalTime().withSecond(0).withNano(0));
        draft.setClassType(autoCreateProperties.getDefaultClassType());
        draft.setGymName(autoCreateProperties.getDefaultGymName());
        draft.setDurationMinutes((int) minutes);
        draft.setIntensity(autoCreateProperties.getDefaultIntensity());
        draft.setWearable(reconciler.metricsOf(workout));

        SessionSaveResult result = draft.save(sessionStore, sessionValidator);
        if (result instanceof SessionSaveResult.Rejected rejected) {
            log.warn("Skipping workout {} for owner {}: {}", workout.getExternalId(), ownerId,
                    rejected.violations().stream().map(FieldViolation::field).toList());
            return Optional.empty();
        }

        UUID sessionId = ((SessionSaveResult.Saved) result).session().id();
        TrainingSession session = sessionRepository.findByIdAndOwnerIdForUpdate(sessionId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
        session.setSource(SessionSource.WEARABLE);
        reconciler.confirm(session, workout, true);
        workoutRepository.saveAndFlush(workout);
        sessionRepository.saveAndFlush(session);
        return Optional.of(sessionId);
    }

    private static void applyInput(WearableWorkout workout, WorkoutInput input) {
        workout.setStartTime(input.startTime());
        workout.setEndTime(input.endTime());
        workout.setTimezoneOffset(input.timezoneOffset());
        workout.setSportName(input.sportName());
        workout.setStrain(input.strain());
        workout.setCalories(input.calories());
        workout.setKilojoules(input.kilojoules());
        workout.setAvgHeartRate(input.avgHeartRate());
        workout.setMaxHeartRate(input.maxHeartRate());
        workout.setZoneDurations(input.zoneDurations() != null ? new LinkedHashMap<>(input.zoneDurations()) : null);
    }

    private ConnectionResponse toResponse(WearableConnection connection) {
        List<String> granted = List.copyOf(connection.getGrantedScopes());
        return new ConnectionResponse(
                true,
                granted,
                connection.isAutoCreateSessions(),
                reconciler.needsReauthorization(granted),
                reconciler.missingScopes(granted),
                connection.getConnectedAt(),
                connection.getLastSyncedAt()
        );
    }
}
