package com.rivaflow.backend.modules.session.presentation.dto;

import java.util.List;

import com.rivaflow.backend.modules.session.domain.DetailedRollTracking;
import com.rivaflow.backend.modules.session.domain.PartnerRef;
import com.rivaflow.backend.modules.session.domain.RollPayload;
import com.rivaflow.backend.modules.session.domain.RollTracking;
import com.rivaflow.backend.modules.session.domain.SessionPayload;
import com.rivaflow.backend.modules.session.domain.SimpleRollTracking;
import com.rivaflow.backend.modules.session.domain.StoredSession;

public final class SessionDtoMapper {

    private SessionDtoMapper() {
    }

    public static SessionResponse toResponse(StoredSession session) {
        SessionPayload payload = session.payload();
        RollTracking tracking = payload.rollTracking();
        List<PartnerRef> partners =
                tracking instanceof SimpleRollTracking simple ? simple.partners() : null;
        List<RollPayload> rolls =
                tracking instanceof DetailedRollTracking detailed ? detailed.rolls() : null;
        return new SessionResponse(
                session.id(),
                payload.sessionDate(),
                payload.classTime(),
                payload.classType(),
                payload.gymName(),
                payload.location(),
                payload.notes(),
                payload.durationMinutes(),
                payload.intensity(),
                tracking.mode(),
                tracking.rollCount(),
                tracking.submissionsFor(),
                tracking.submissionsAgainst(),
                partners,
                rolls,
                payload.techniques(),
                payload.fightDynamics(),
                payload.wearable(),
                session.wearableWorkoutId(),
                session.needsReview(),
                session.source(),
                session.version(),
                session.createdAt(),
                session.updatedAt()
        );
    }
}
