package com.rivaflow.backend.modules.session.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import com.rivaflow.backend.modules.glossary.domain.MovementGlossary;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionDraftTest {

    private static final UUID OWNER_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private SessionStore sessionStore;

    @Mock
    private MovementGlossary movementGlossary;

    private SessionValidator validator;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-03-10T12:00:00Z"), ZoneOffset.UTC);
        validator = new SessionValidator(clock, ZoneId.of("UTC"), movementGlossary);
        lenient().when(movementGlossary.existingIds(anyCollection()))
                .thenAnswer(invocation -> new HashSet<Long>(invocation.getArgument(0)));
    }

    @Test
    @DisplayName("detailed mode derives totals from the roll ledger")
    void detailedModeDerivesTotals() {
        SessionDraft draft = validDraft();
        draft.setMode(TrackingMode.DETAILED);
        draft.addRoll();
        draft.addRoll();
        draft.addRoll();
        draft.toggleSubmission(0, Side.FOR, 19L);
        draft.toggleSubmission(0, Side.FOR, 34L);
        draft.toggleSubmission(2, Side.AGAINST, 20L);

        assertThat(draft.getRollCount()).isEqualTo(3);
        assertThat(draft.getSubmissionsFor()).isEqualTo(2);
        assertThat(draft.getSubmissionsAgainst()).isEqualTo(1);

        SessionPayload payload = draft.toPayload();
        assertThat(payload.rollTracking()).isInstanceOf(DetailedRollTracking.class);
        assertThat(payload.rollTracking().rollCount()).isEqualTo(3);
        assertThat(payload.rollTracking().submissionsFor()).isEqualTo(2);
    }

    @Test
    @DisplayName("switching to simple keeps the rolls in memory but leaves them out of the payload")
    void switchingModesRetainsRolls() {
        SessionDraft draft = validDraft();
        draft.setMode(TrackingMode.DETAILED);
        draft.addRoll();
        draft.addRoll();

        draft.setMode(TrackingMode.SIMPLE);
        SessionPayload simplePayload = draft.toPayload();
        assertThat(simplePayload.rollTracking()).isInstanceOf(SimpleRollTracking.class);

        draft.setMode(TrackingMode.DETAILED);
        assertThat(draft.getRolls().size()).isEqualTo(2);
        assertThat(((DetailedRollTracking) draft.toPayload().rollTracking()).rolls()).hasSize(2);
    }

    @Test
    @DisplayName("simple totals cannot be set while in detailed mode")
    void simpleTotalsRejectedInDetailedMode() {
        SessionDraft draft = validDraft();
        draft.setMode(TrackingMode.DETAILED);

        assertThatThrownBy(() -> draft.setSimpleTotals(4, 1, 1))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("an invalid draft is rejected and never reaches the store")
    void invalidDraftNeverSaved() {
        SessionDraft draft = SessionDraft.create(OWNER_ID);
        draft.setSessionDate(LocalDate.of(2025, 3, 10));
        draft.setDurationMinutes(0);
        draft.setIntensity(9);

        SessionSaveResult result = draft.save(sessionStore, validator);

        assertThat(result).isInstanceOf(SessionSaveResult.Rejected.class);
        assertThat(((SessionSaveResult.Rejected) result).violations())
                .extracting(FieldViolation::field)
                .contains("classType", "gymName", "durationMinutes", "intensity");
        verifyNoInteractions(sessionStore);
    }

    @Test
    @DisplayName("a valid draft is handed to the store with trimmed text")
    void validDraftSaved() {
        SessionDraft draft = validDraft();
        draft.setGymName("  Riverside BJJ  ");
        draft.setSimpleTotals(5, 2, 1);
        draft.setPartners(List.of(new PartnerRef("c-1", "Ana")));
        StoredSession stored = storedFrom(draft.toPayload());
        when(sessionStore.saveSession(eq(OWNER_ID), isNull(), isNull(), any(SessionPayload.class))).thenReturn(stored);

        SessionSaveResult result = draft.save(sessionStore, validator);

        ArgumentCaptor<SessionPayload> captor = ArgumentCaptor.forClass(SessionPayload.class);
        verify(sessionStore).saveSession(eq(OWNER_ID), isNull(), isNull(), captor.capture());
        assertThat(captor.getValue().gymName()).isEqualTo("Riverside BJJ");
        assertThat(captor.getValue().rollTracking().rollCount()).isEqualTo(5);
        assertThat(result.isSaved()).isTrue();
    }

    @Test
    @DisplayName("editing a stored detailed session restores its ledgers")
    void editRestoresLedgers() {
        SessionDraft original = validDraft();
        original.setMode(TrackingMode.DETAILED);
        original.addRoll();
        original.toggleSubmission(0, Side.AGAINST, 35L);
        original.getTechniques().add();
        original.getTechniques().selectMovement(0, 34L, "Armbar");
        StoredSession stored = storedFrom(original.toPayload());

        SessionDraft edited = SessionDraft.edit(stored);

        assertThat(edited.getMode()).isEqualTo(TrackingMode.DETAILED);
        assertThat(edited.getRolls().get(0).getSubmissionsAgainst()).containsExactly(35L);
        assertThat(edited.getTechniques().get(0).getMovementId()).isEqualTo(34L);
        assertThat(edited.getSessionId()).isEqualTo(stored.id());
        assertThat(edited.getVersion()).isEqualTo(3L);
    }

    @Test
    @DisplayName("fight dynamics keep successful within attempted")
    void dynamicsClamp() {
        SessionDraft draft = validDraft();
        draft.incrementDynamics(FightDynamics.Field.ATTACKS_ATTEMPTED);
        draft.incrementDynamics(FightDynamics.Field.ATTACKS_SUCCESSFUL);
        draft.incrementDynamics(FightDynamics.Field.ATTACKS_SUCCESSFUL);
        draft.decrementDynamics(FightDynamics.Field.DEFENSES_ATTEMPTED);

        assertThat(draft.getFightDynamics()).isEqualTo(new FightDynamics(1, 1, 0, 0));
    }

    @Test
    @DisplayName("unknown movement references are reported per field")
    void unknownMovementReported() {
        when(movementGlossary.existingIds(anyCollection())).thenReturn(Set.of(19L));
        SessionDraft draft = validDraft();
        draft.setMode(TrackingMode.DETAILED);
        draft.addRoll();
        draft.toggleSubmission(0, Side.FOR, 999L);

        List<FieldViolation> violations = draft.validate(validator);

        assertThat(violations).extracting(FieldViolation::field).containsExactly("rolls[1].submissionsFor");
    }

    private SessionDraft validDraft() {
        SessionDraft draft = SessionDraft.create(OWNER_ID);
        draft.setSessionDate(LocalDate.of(2025, 3, 9));
        draft.setClassTime(LocalTime.of(18, 0));
        draft.setClassType(ClassType.GI);
        draft.setGymName("Riverside BJJ");
        draft.setDurationMinutes(90);
        draft.setIntensity(4);
        return draft;
    }

    private static StoredSession storedFrom(SessionPayload payload) {
        OffsetDateTime now = OffsetDateTime.parse("2025-03-10T12:00:00Z");
        return new StoredSession(UUID.fromString("00000000-0000-0000-0000-000000000501"), OWNER_ID, 3L,
                SessionSource.MANUAL, false, null, payload, now, now);
    }
}
