package com.rivaflow.backend.modules.session.infrastructure.persistence;

import java.util.List;

import com.rivaflow.backend.modules.session.domain.DetailedRollTracking;
import com.rivaflow.backend.modules.session.domain.RollPayload;
import com.rivaflow.backend.modules.session.domain.RollTracking;
import com.rivaflow.backend.modules.session.domain.SessionPayload;
import com.rivaflow.backend.modules.session.domain.SessionRoll;
import com.rivaflow.backend.modules.session.domain.SessionTechnique;
import com.rivaflow.backend.modules.session.domain.SimpleRollTracking;
import com.rivaflow.backend.modules.session.domain.StoredSession;
import com.rivaflow.backend.modules.session.domain.TechniquePayload;
import com.rivaflow.backend.modules.session.domain.TrackingMode;
import com.rivaflow.backend.modules.session.domain.TrainingSession;

/**
 * Moves session payloads in and out of the JPA entities. Roll totals are written from the
 * tracking variant, so detailed sessions always store the totals of their rolls.
 */
public final class SessionPersistenceMapper {

    private SessionPersistenceMapper() {
    }

    public static void applyPayload(TrainingSession session, SessionPayload payload) {
        session.setSessionDate(payload.sessionDate());
        session.setClassTime(payload.classTime());
        session.setClassType(payload.classType());
        session.setGymName(payload.gymName());
        session.setLocation(payload.location());
        session.setNotes(payload.notes());
        session.setDurationMinutes(payload.durationMinutes());
        session.setIntensity(payload.intensity());

        RollTracking tracking = payload.rollTracking();
        session.setMode(tracking.mode());
        session.setRollCount(tracking.rollCount());
        session.setSubmissionsFor(tracking.submissionsFor());
        session.setSubmissionsAgainst(tracking.submissionsAgainst());
        if (tracking instanceof SimpleRollTracking simple) {
            session.setPartners(simple.partners());
            session.replaceRolls(List.of());
        } else if (tracking instanceof DetailedRollTracking detailed) {
            session.setPartners(List.of());
            session.replaceRolls(detailed.rolls().stream().map(SessionPersistenceMapper::toRollEntity).toList());
        }

        session.replaceTechniques(payload.techniques().stream()
                .map(SessionPersistenceMapper::toTechniqueEntity)
                .toList());
        session.setFightDynamics(payload.fightDynamics());
        session.setWearableMetrics(payload.wearable());
    }

    public static StoredSession toStored(TrainingSession session) {
        RollTracking tracking = session.getMode() == TrackingMode.DETAILED
                ? new DetailedRollTracking(session.getRolls().stream().map(SessionPersistenceMapper::toRollPayload).toList())
                : new SimpleRollTracking(session.getRollCount(), session.getSubmissionsFor(),
                        session.getSubmissionsAgainst(), session.getPartners());
        SessionPayload payload = new SessionPayload(
                session.getSessionDate(),
                session.getClassTime(),
                session.getClassType(),
                session.getGymName(),
                session.getLocation(),
                session.getNotes(),
                session.getDurationMinutes(),
                session.getIntensity(),
                tracking,
                session.getTechniques().stream().map(SessionPersistenceMapper::toTechniquePayload).toList(),
                session.getFightDynamics(),
                session.getWearableMetrics()
        );
        return new StoredSession(
                session.getId(),
                session.getOwnerId(),
                session.getVersion(),
                session.getSource(),
                session.isNeedsReview(),
                session.getWearableWorkoutId(),
                payload,
                session.getCreatedAt(),
                session.getUpdatedAt()
        );
    }

    private static SessionRoll toRollEntity(RollPayload payload) {
        SessionRoll roll = new SessionRoll();
        roll.setRollNumber(payload.rollNumber());
        roll.setPartnerId(payload.partnerId());
        roll.setPartnerName(payload.partnerName());
        roll.setDurationMinutes(payload.durationMinutes());
        roll.setSubmissionsFor(payload.submissionsFor());
        roll.setSubmissionsAgainst(payload.submissionsAgainst());
        roll.setNotes(payload.notes());
        return roll;
    }

    private static RollPayload toRollPayload(SessionRoll roll) {
        return new RollPayload(
                roll.getRollNumber(),
                roll.getPartnerId(),
                roll.getPartnerName(),
                roll.getDurationMinutes(),
                roll.getSubmissionsFor(),
                roll.getSubmissionsAgainst(),
                roll.getNotes()
        );
    }

    private static SessionTechnique toTechniqueEntity(TechniquePayload payload) {
        SessionTechnique technique = new SessionTechnique();
        technique.setTechniqueNumber(payload.techniqueNumber());
        technique.setMovementId(payload.movementId());
        technique.setMovementName(payload.movementName());
        technique.setNotes(payload.notes());
        technique.setMediaUrls(payload.mediaUrls());
        return technique;
    }

    private static TechniquePayload toTechniquePayload(SessionTechnique technique) {
        return new TechniquePayload(
                technique.getTechniqueNumber(),
                technique.getMovementId(),
                technique.getMovementName(),
                technique.getNotes(),
                technique.getMediaUrls()
        );
    }
}
