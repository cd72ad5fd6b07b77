package com.rivaflow.backend.modules.session.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Set;

import com.rivaflow.backend.modules.glossary.domain.MovementGlossary;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SessionValidatorTest {

    @Mock
    private MovementGlossary movementGlossary;

    private SessionValidator validator;

    @BeforeEach
    void setUp() {
        // 23:30 UTC on the 9th is already the 10th in Sydney
        Clock clock = Clock.fixed(Instant.parse("2025-03-09T23:30:00Z"), ZoneId.of("UTC"));
        validator = new SessionValidator(clock, ZoneId.of("Australia/Sydney"), movementGlossary);
        lenient().when(movementGlossary.existingIds(anyCollection())).thenReturn(Set.of(34L));
    }

    @Test
    @DisplayName("a complete session passes without touching the glossary")
    void validPayloadHasNoViolations() {
        List<FieldViolation> violations = validator.validate(payload(LocalDate.of(2025, 3, 10), WearableMetrics.EMPTY,
                new SimpleRollTracking(3, 1, 0, List.of())));

        assertThat(violations).isEmpty();
        verify(movementGlossary, never()).existingIds(anyCollection());
    }

    @Test
    @DisplayName("future dates are judged in the training zone")
    void futureDateRejected() {
        List<FieldViolation> violations = validator.validate(payload(LocalDate.of(2025, 3, 11), WearableMetrics.EMPTY,
                new SimpleRollTracking(0, 0, 0, List.of())));

        assertThat(violations).containsExactly(new FieldViolation("sessionDate", "must not be in the future"));
    }

    @Test
    @DisplayName("wearable ranges and heart rate ordering are checked")
    void wearableRangesChecked() {
        WearableMetrics wearable = new WearableMetrics(22.5, -1, 180, 170);

        List<FieldViolation> violations = validator.validate(payload(LocalDate.of(2025, 3, 10), wearable,
                new SimpleRollTracking(0, 0, 0, List.of())));

        assertThat(violations).extracting(FieldViolation::field)
                .containsExactlyInAnyOrder("strain", "calories", "avgHeartRate");
    }

    @Test
    @DisplayName("simple partners need a name and totals cannot be negative")
    void simpleTrackingChecked() {
        List<FieldViolation> violations = validator.validate(payload(LocalDate.of(2025, 3, 10), WearableMetrics.EMPTY,
                new SimpleRollTracking(-1, 0, 0, List.of(new PartnerRef("c-1", " ")))));

        assertThat(violations).extracting(FieldViolation::field)
                .containsExactlyInAnyOrder("rollCount", "partners[0].name");
    }

    @Test
    @DisplayName("detailed rolls are checked individually")
    void detailedRollsChecked() {
        RollPayload roll = new RollPayload(1, null, "A".repeat(101), 0, List.of(34L), List.of(), null);

        List<FieldViolation> violations = validator.validate(payload(LocalDate.of(2025, 3, 10), WearableMetrics.EMPTY,
                new DetailedRollTracking(List.of(roll))));

        assertThat(violations).extracting(FieldViolation::field)
                .containsExactlyInAnyOrder("rolls[1].durationMinutes", "rolls[1].partnerName");
    }

    private static SessionPayload payload(LocalDate date, WearableMetrics wearable, RollTracking tracking) {
        return new SessionPayload(date, LocalTime.of(18, 0), ClassType.NO_GI, "Riverside BJJ", null, null,
                60, 3, tracking, List.of(), FightDynamics.ZERO, wearable);
    }
}
