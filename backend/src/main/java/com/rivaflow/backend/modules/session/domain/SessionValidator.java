package com.rivaflow.backend.modules.session.domain;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import com.rivaflow.backend.modules.glossary.domain.MovementGlossary;

import org.springframework.stereotype.Component;

/**
 * Field-level checks run before a session reaches the store. Every problem is reported,
 * not just the first one.
 */
@Component
public class SessionValidator {

    public static final int MAX_GYM_NAME_LENGTH = 100;
    public static final int MAX_LOCATION_LENGTH = 200;
    public static final int MAX_PARTNER_NAME_LENGTH = 100;
    public static final int MIN_DURATION_MINUTES = 1;
    public static final int MAX_DURATION_MINUTES = 480;
    public static final int MIN_INTENSITY = 1;
    public static final int MAX_INTENSITY = 5;
    public static final double MAX_STRAIN = 21.0;
    public static final int MAX_HEART_RATE = 250;

    private final Clock clock;
    private final ZoneId trainingZone;
    private final MovementGlossary movementGlossary;

    public SessionValidator(Clock clock, ZoneId trainingZone, MovementGlossary movementGlossary) {
        this.clock = clock;
        this.trainingZone = trainingZone;
        this.movementGlossary = movementGlossary;
    }

    public List<FieldViolation> validate(SessionPayload payload) {
        List<FieldViolation> violations = new ArrayList<>();

        if (payload.sessionDate() == null) {
            violations.add(new FieldViolation("sessionDate", "is required"));
        } else if (payload.sessionDate().isAfter(LocalDate.now(clock.withZone(trainingZone)))) {
            violations.add(new FieldViolation("sessionDate", "must not be in the future"));
        }

        if (payload.classType() == null) {
            violations.add(new FieldViolation("classType", "is required"));
        }

        if (payload.gymName() == null || payload.gymName().isBlank()) {
            violations.add(new FieldViolation("gymName", "is required"));
        } else if (payload.gymName().length() > MAX_GYM_NAME_LENGTH) {
            violations.add(new FieldViolation("gymName", "must be at most " + MAX_GYM_NAME_LENGTH + " characters"));
        }

        if (payload.location() != null && payload.location().length() > MAX_LOCATION_LENGTH) {
            violations.add(new FieldViolation("location", "must be at most " + MAX_LOCATION_LENGTH + " characters"));
        }

        if (payload.durationMinutes() == null) {
            violations.add(new FieldViolation("durationMinutes", "is required"));
        } else {
            checkRange(violations, "durationMinutes", payload.durationMinutes(), MIN_DURATION_MINUTES, MAX_DURATION_MINUTES);
        }

        if (payload.intensity() == null) {
            violations.add(new FieldViolation("intensity", "is required"));
        } else {
            checkRange(violations, "intensity", payload.intensity(), MIN_INTENSITY, MAX_INTENSITY);
        }

        validateRollTracking(payload.rollTracking(), violations);
        validateWearable(payload.wearable(), violations);
        validateMovementReferences(payload, violations);
        return violations;
    }

    private void validateRollTracking(RollTracking tracking, List<FieldViolation> violations) {
        if (tracking == null) {
            violations.add(new FieldViolation("mode", "is required"));
            return;
        }
        if (tracking instanceof SimpleRollTracking simple) {
            checkNonNegative(violations, "rollCount", simple.rollCount());
            checkNonNegative(violations, "submissionsFor", simple.submissionsFor());
            checkNonNegative(violations, "submissionsAgainst", simple.submissionsAgainst());
            for (int i = 0; i < simple.partners().size(); i++) {
                PartnerRef partner = simple.partners().get(i);
                if (partner.name() == null || partner.name().isBlank()) {
                    violations.add(new FieldViolation("partners[" + i + "].name", "is required"));
                }
            }
        } else if (tracking instanceof DetailedRollTracking detailed) {
            for (RollPayload roll : detailed.rolls()) {
                String prefix = "rolls[" + roll.rollNumber() + "].";
                checkRange(violations, prefix + "durationMinutes", roll.durationMinutes(),
                        MIN_DURATION_MINUTES, MAX_DURATION_MINUTES);
                if (roll.partnerName() != null && roll.partnerName().length() > MAX_PARTNER_NAME_LENGTH) {
                    violations.add(new FieldViolation(prefix + "partnerName",
                            "must be at most " + MAX_PARTNER_NAME_LENGTH + " characters"));
                }
            }
        }
    }

    private void validateWearable(WearableMetrics wearable, List<FieldViolation> violations) {
        if (wearable.strain() != null && (wearable.strain() < 0 || wearable.strain() > MAX_STRAIN)) {
            violations.add(new FieldViolation("strain", "must be between 0 and " + MAX_STRAIN));
        }
        if (wearable.calories() != null) {
            checkNonNegative(violations, "calories", wearable.calories());
        }
        if (wearable.avgHeartRate() != null) {
            checkRange(violations, "avgHeartRate", wearable.avgHeartRate(), 0, MAX_HEART_RATE);
        }
        if (wearable.maxHeartRate() != null) {
            checkRange(violations, "maxHeartRate", wearable.maxHeartRate(), 0, MAX_HEART_RATE);
        }
        if (wearable.avgHeartRate() != null && wearable.maxHeartRate() != null
                && wearable.avgHeartRate() > wearable.maxHeartRate()) {
            violations.add(new FieldViolation("avgHeartRate", "must not exceed maxHeartRate"));
        }
    }

    private void validateMovementReferences(SessionPayload payload, List<FieldViolation> violations) {
        Set<Long> referenced = new HashSet<>();
        payload.techniques().forEach(technique -> referenced.add(technique.movementId()));
        if (payload.rollTracking() instanceof DetailedRollTracking detailed) {
            detailed.rolls().forEach(roll -> {
                referenced.addAll(roll.submissionsFor());
                referenced.addAll(roll.submissionsAgainst());
            });
        }
        referenced.remove(null);
        if (referenced.isEmpty()) {
            return;
        }
        Set<Long> known = movementGlossary.existingIds(referenced);
        for (TechniquePayload technique : payload.techniques()) {
            if (!known.contains(technique.movementId())) {
                violations.add(new FieldViolation("techniques[" + technique.techniqueNumber() + "].movementId",
                        "unknown movement " + technique.movementId()));
            }
        }
        if (payload.rollTracking() instanceof DetailedRollTracking detailed) {
            for (RollPayload roll : detailed.rolls()) {
                checkKnownSubmissions(violations, "rolls[" + roll.rollNumber() + "].submissionsFor",
                        roll.submissionsFor(), known);
                checkKnownSubmissions(violations, "rolls[" + roll.rollNumber() + "].submissionsAgainst",
                        roll.submissionsAgainst(), known);
            }
        }
    }

    private static void checkKnownSubmissions(List<FieldViolation> violations, String field,
                                              List<Long> movementIds, Set<Long> known) {
        movementIds.stream()
                .filter(id -> !known.contains(id))
                .findFirst()
                .ifPresent(id -> violations.add(new FieldViolation(field, "unknown movement " + id)));
    }

    private static void checkRange(List<FieldViolation> violations, String field, int value, int min, int max) {
        if (value < min || value > max) {
            violations.add(new FieldViolation(field, "must be between " + min + " and " + max));
        }
    }

    private static void checkNonNegative(List<FieldViolation> violations, String field, int value) {
        if (value < 0) {
            violations.add(new FieldViolation(field, "must not be negative"));
        }
    }
}
