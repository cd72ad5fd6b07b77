package com.rivaflow.backend.modules.wearable.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.rivaflow.backend.global.error.ProblemException;
import com.rivaflow.backend.modules.glossary.domain.MovementGlossary;
import com.rivaflow.backend.modules.session.domain.ClassType;
import com.rivaflow.backend.modules.session.domain.SessionDraft;
import com.rivaflow.backend.modules.session.domain.SessionValidator;
import com.rivaflow.backend.modules.session.domain.TrainingSession;
import com.rivaflow.backend.modules.session.infrastructure.persistence.SessionPersistenceMapper;
import com.rivaflow.backend.modules.session.infrastructure.persistence.TrainingSessionRepository;
import com.rivaflow.backend.modules.session.presentation.dto.SessionResponse;
import com.rivaflow.backend.modules.wearable.config.WearableMatchingProperties;
import com.rivaflow.backend.modules.wearable.domain.WearableIntegrationGateway;
import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableConnectionRepository;
import com.rivaflow.backend.modules.wearable.infrastructure.persistence.WearableWorkoutRepository;
import com.rivaflow.backend.modules.wearable.presentation.dto.SyncResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class WearableMatchServiceTest {

    private static final UUID OWNER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");
    private static final UUID SESSION_ID = UUID.fromString("00000000-0000-0000-0000-000000000501");
    private static final UUID OTHER_SESSION_ID = UUID.fromString("00000000-0000-0000-0000-000000000502");

    @Mock
    private TrainingSessionRepository sessionRepository;

    @Mock
    private WearableWorkoutRepository workoutRepository;

    @Mock
    private WearableConnectionRepository connectionRepository;

    @Mock
    private WearableIntegrationGateway gateway;

    @Mock
    private MovementGlossary movementGlossary;

    private Clock clock;
    private WearableMatchingProperties properties;
    private WearableMatchService service;
    private TrainingSession session;

    @BeforeEach
    void setUp() {
        properties = new WearableMatchingProperties();
        clock = Clock.fixed(Instant.parse("2025-03-10T00:00:00Z"), ZoneOffset.UTC);
        WearableReconciler reconciler = new WearableReconciler(properties, ZoneId.of("UTC"));
        service = new WearableMatchService(sessionRepository, workoutRepository, connectionRepository, gateway,
                reconciler, properties, clock);

        session = new TrainingSession(OWNER_ID);
        ReflectionTestUtils.setField(session, "id", SESSION_ID);
        session.setSessionDate(LocalDate.of(2025, 3, 9));
        session.setClassTime(LocalTime.of(18, 0));
        session.setClassType(ClassType.GI);
        session.setGymName("Riverside BJJ");
        session.setDurationMinutes(90);
        session.setIntensity(4);

        lenient().when(sessionRepository.findByIdAndOwnerIdForUpdate(SESSION_ID, OWNER_ID))
                .thenReturn(Optional.of(session));
        lenient().when(sessionRepository.saveAndFlush(any(TrainingSession.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(workoutRepository.saveAndFlush(any(WearableWorkout.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        lenient().when(connectionRepository.findById(OWNER_ID)).thenReturn(Optional.empty());
    }

    @Test
    @DisplayName("a workout matched to another session cannot be confirmed")
    void confirmRejectsWorkoutOfOtherSession() {
        WearableWorkout workout = workout("00000000-0000-0000-0000-00000000000a", "2025-03-09T18:00:00Z");
        workout.setLinkedSessionId(OTHER_SESSION_ID);
        when(workoutRepository.findByIdAndOwnerIdForUpdate(workout.getId(), OWNER_ID)).thenReturn(Optional.of(workout));

        assertThatThrownBy(() -> service.confirm(OWNER_ID, SESSION_ID, workout.getId()))
                .isInstanceOf(ProblemException.class)
                .extracting("code")
                .isEqualTo("WORKOUT_ALREADY_MATCHED");
        verify(sessionRepository, never()).saveAndFlush(any(TrainingSession.class));
    }

    @Test
    @DisplayName("confirming a different workout releases the previous one first")
    void confirmReleasesPreviousWorkout() {
        WearableWorkout previous = workout("00000000-0000-0000-0000-00000000000a", "2025-03-09T18:00:00Z");
        previous.setLinkedSessionId(SESSION_ID);
        session.setWearableWorkoutId(previous.getId());
        WearableWorkout next = workout("00000000-0000-0000-0000-00000000000b", "2025-03-09T18:10:00Z");
        next.setStrain(12.04);
        when(workoutRepository.findByIdAndOwnerIdForUpdate(previous.getId(), OWNER_ID)).thenReturn(Optional.of(previous));
        when(workoutRepository.findByIdAndOwnerIdForUpdate(next.getId(), OWNER_ID)).thenReturn(Optional.of(next));

        SessionResponse response = service.confirm(OWNER_ID, SESSION_ID, next.getId());

        assertThat(previous.getLinkedSessionId()).isNull();
        assertThat(next.getLinkedSessionId()).isEqualTo(SESSION_ID);
        assertThat(response.wearableWorkoutId()).isEqualTo(next.getId());
        assertThat(response.wearable().strain()).isEqualTo(12.0);
        assertThat(response.needsReview()).isFalse();
        InOrder order = inOrder(workoutRepository);
        order.verify(workoutRepository).saveAndFlush(previous);
        order.verify(workoutRepository).saveAndFlush(next);
    }

    @Test
    @DisplayName("confirming the linked pair again leaves it linked")
    void confirmIsIdempotent() {
        WearableWorkout workout = workout("00000000-0000-0000-0000-00000000000a", "2025-03-09T18:00:00Z");
        workout.setLinkedSessionId(SESSION_ID);
        session.setWearableWorkoutId(workout.getId());
        when(workoutRepository.findByIdAndOwnerIdForUpdate(workout.getId(), OWNER_ID)).thenReturn(Optional.of(workout));

        SessionResponse first = service.confirm(OWNER_ID, SESSION_ID, workout.getId());
        SessionResponse second = service.confirm(OWNER_ID, SESSION_ID, workout.getId());

        assertThat(second.wearableWorkoutId()).isEqualTo(first.wearableWorkoutId());
        assertThat(workout.getLinkedSessionId()).isEqualTo(SESSION_ID);
    }

    @Test
    @DisplayName("a confirmed workout with out-of-range readings leaves the session editable")
    void confirmedOutlierKeepsSessionEditable() {
        WearableWorkout workout = workout("00000000-0000-0000-0000-00000000000a", "2025-03-09T18:00:00Z");
        workout.setStrain(23.4);
        workout.setAvgHeartRate(260);
        workout.setMaxHeartRate(255);
        when(workoutRepository.findByIdAndOwnerIdForUpdate(workout.getId(), OWNER_ID)).thenReturn(Optional.of(workout));

        SessionResponse response = service.confirm(OWNER_ID, SESSION_ID, workout.getId());

        assertThat(response.wearable().strain()).isEqualTo(SessionValidator.MAX_STRAIN);
        assertThat(response.wearable().avgHeartRate()).isNull();
        assertThat(response.wearable().maxHeartRate()).isNull();

        SessionDraft edit = SessionDraft.edit(SessionPersistenceMapper.toStored(session));
        edit.setNotes("worked on back takes");
        SessionValidator validator = new SessionValidator(clock, ZoneId.of("UTC"), movementGlossary);
        assertThat(edit.validate(validator)).isEmpty();
    }

    @Test
    @DisplayName("an average heart rate above the maximum is not copied")
    void confirmDropsInconsistentAverage() {
        WearableWorkout workout = workout("00000000-0000-0000-0000-00000000000a", "2025-03-09T18:00:00Z");
        workout.setAvgHeartRate(190);
        workout.setMaxHeartRate(180);
        when(workoutRepository.findByIdAndOwnerIdForUpdate(workout.getId(), OWNER_ID)).thenReturn(Optional.of(workout));

        SessionResponse response = service.confirm(OWNER_ID, SESSION_ID, workout.getId());

        assertThat(response.wearable().avgHeartRate()).isNull();
        assertThat(response.wearable().maxHeartRate()).isEqualTo(180);
    }

    @Test
    @DisplayName("sync stops when required scopes are missing")
    void syncRequiresScopes() {
        when(gateway.getGrantedScopes(OWNER_ID)).thenReturn(Set.of("read:workout"));

        SyncResponse response = service.sync(OWNER_ID, SESSION_ID);

        assertThat(response.status()).isEqualTo(SyncStatus.REAUTHORIZATION_REQUIRED);
        assertThat(response.missingScopes()).contains("offline", "read:recovery");
        verify(gateway, never()).listWorkoutsBetween(eq(OWNER_ID), any(), any());
    }

    @Test
    @DisplayName("sync applies a lone high-confidence match and flags it for review")
    void syncAutoApplies() {
        when(gateway.getGrantedScopes(OWNER_ID)).thenReturn(Set.copyOf(properties.getRequiredScopes()));
        WearableWorkout workout = workout("00000000-0000-0000-0000-00000000000a", "2025-03-09T17:55:00Z");
        when(gateway.listWorkoutsBetween(eq(OWNER_ID), any(), any())).thenReturn(List.of(workout));
        when(workoutRepository.findByIdAndOwnerIdForUpdate(workout.getId(), OWNER_ID)).thenReturn(Optional.of(workout));

        SyncResponse response = service.sync(OWNER_ID, SESSION_ID);

        assertThat(response.status()).isEqualTo(SyncStatus.AUTO_APPLIED);
        assertThat(response.session().needsReview()).isTrue();
        assertThat(response.session().wearableWorkoutId()).isEqualTo(workout.getId());
        assertThat(response.candidates()).singleElement().satisfies(match -> assertThat(match.confirmed()).isTrue());
    }

    @Test
    @DisplayName("sync reports no candidates when nothing is in the window")
    void syncWithoutCandidates() {
        when(gateway.getGrantedScopes(OWNER_ID)).thenReturn(Set.copyOf(properties.getRequiredScopes()));
        when(gateway.listWorkoutsBetween(eq(OWNER_ID), any(), any())).thenReturn(List.of());

        SyncResponse response = service.sync(OWNER_ID, SESSION_ID);

        assertThat(response.status()).isEqualTo(SyncStatus.NO_CANDIDATES);
        assertThat(session.getWearableWorkoutId()).isNull();
    }

    private static WearableWorkout workout(String id, String start) {
        Instant startTime = Instant.parse(start);
        WearableWorkout workout = new WearableWorkout(OWNER_ID, "ext-" + id.substring(id.length() - 2),
                startTime, startTime.plusSeconds(95 * 60));
        ReflectionTestUtils.setField(workout, "id", UUID.fromString(id));
        return workout;
    }
}
