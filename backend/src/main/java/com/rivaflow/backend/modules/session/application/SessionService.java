package com.rivaflow.backend.modules.session.application;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.rivaflow.backend.global.error.ProblemException;
import com.rivaflow.backend.modules.session.domain.RollEntry;
import com.rivaflow.backend.modules.session.domain.RollLedger;
import com.rivaflow.backend.modules.session.domain.SessionDraft;
import com.rivaflow.backend.modules.session.domain.SessionSaveResult;
import com.rivaflow.backend.modules.session.domain.SessionStore;
import com.rivaflow.backend.modules.session.domain.SessionValidator;
import com.rivaflow.backend.modules.session.domain.StoredSession;
import com.rivaflow.backend.modules.session.domain.TechniqueEntry;
import com.rivaflow.backend.modules.session.domain.TrackingMode;
import com.rivaflow.backend.modules.session.domain.TrainingSession;
import com.rivaflow.backend.modules.session.infrastructure.persistence.SessionPersistenceMapper;
import com.rivaflow.backend.modules.session.infrastructure.persistence.TrainingSessionRepository;
import com.rivaflow.backend.modules.session.presentation.dto.RollInput;
import com.rivaflow.backend.modules.session.presentation.dto.SessionListResponse;
import com.rivaflow.backend.modules.session.presentation.dto.SessionDtoMapper;
import com.rivaflow.backend.modules.session.presentation.dto.SessionRequest;
import com.rivaflow.backend.modules.session.presentation.dto.SessionResponse;
import com.rivaflow.backend.modules.session.presentation.dto.TechniqueInput;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);
    private static final int DEFAULT_LIST_DAYS = 90;

    private final SessionStore sessionStore;
    private final SessionValidator sessionValidator;
    private final TrainingSessionRepository trainingSessionRepository;
    private final Clock clock;
    private final ZoneId trainingZone;

    public SessionService(
            SessionStore sessionStore,
            SessionValidator sessionValidator,
            TrainingSessionRepository trainingSessionRepository,
            Clock clock,
            ZoneId trainingZone
    ) {
        this.sessionStore = sessionStore;
        this.sessionValidator = sessionValidator;
        this.trainingSessionRepository = trainingSessionRepository;
        this.clock = clock;
        this.trainingZone = trainingZone;
    }

    public SessionSaveResult createSession(UUID ownerId, SessionRequest request) {
        SessionDraft draft = SessionDraft.create(ownerId);
        applyRequest(draft, request);
        SessionSaveResult result = draft.save(sessionStore, sessionValidator);
        if (result instanceof SessionSaveResult.Saved saved) {
            log.debug("Created session {} for owner {}", saved.session().id(), ownerId);
        }
        return result;
    }

    public SessionSaveResult updateSession(UUID ownerId, UUID sessionId, SessionRequest request) {
        StoredSession stored = sessionStore.getSession(ownerId, sessionId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
        if (request.version() != null && !Objects.equals(request.version(), stored.version())) {
            throw new ObjectOptimisticLockingFailureException(TrainingSession.class, sessionId);
        }
        SessionDraft draft = SessionDraft.edit(stored);
        applyRequest(draft, request);
        return draft.save(sessionStore, sessionValidator);
    }

    @Transactional(readOnly = true)
    public SessionResponse getSession(UUID ownerId, UUID sessionId) {
        return sessionStore.getSession(ownerId, sessionId)
                .map(SessionDtoMapper::toResponse)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
    }

    @Transactional(readOnly = true)
    public SessionListResponse listSessions(UUID ownerId, LocalDate from, LocalDate to) {
        LocalDate resolvedTo = to != null ? to : LocalDate.now(clock.withZone(trainingZone));
        LocalDate resolvedFrom = from != null ? from : resolvedTo.minusDays(DEFAULT_LIST_DAYS);
        if (resolvedFrom.isAfter(resolvedTo)) {
            throw ProblemException.badRequest("INVALID_DATE_RANGE", "from must not be after to");
        }
        List<SessionResponse> items = sessionStore.listSessions(ownerId, resolvedFrom, resolvedTo).stream()
                .map(SessionDtoMapper::toResponse)
                .toList();
        return new SessionListResponse(resolvedFrom, resolvedTo, items);
    }

    public void deleteSession(UUID ownerId, UUID sessionId) {
        if (!sessionStore.deleteSession(ownerId, sessionId)) {
            throw ProblemException.notFound("SESSION_NOT_FOUND");
        }
        log.debug("Deleted session {} for owner {}", sessionId, ownerId);
    }

    /**
     * Keeps an auto-applied wearable match: the session stays linked and is no longer flagged.
     */
    public SessionResponse acknowledgeReview(UUID ownerId, UUID sessionId) {
        TrainingSession session = trainingSessionRepository.findByIdAndOwnerIdForUpdate(sessionId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
        session.setNeedsReview(false);
        TrainingSession saved = trainingSessionRepository.saveAndFlush(session);
        return SessionDtoMapper.toResponse(SessionPersistenceMapper.toStored(saved));
    }

    private void applyRequest(SessionDraft draft, SessionRequest request) {
        draft.setSessionDate(request.sessionDate());
        draft.setClassTime(request.classTime());
        draft.setClassType(request.classType());
        draft.setGymName(request.gymName());
        draft.setLocation(request.location());
        draft.setNotes(request.notes());
        draft.setDurationMinutes(request.durationMinutes());
        draft.setIntensity(request.intensity());

        TrackingMode mode = request.mode() != null ? request.mode() : TrackingMode.SIMPLE;
        if (mode == TrackingMode.DETAILED) {
            List<RollInput> rolls = request.rolls() != null ? request.rolls() : List.of();
            draft.replaceRolls(rolls.stream().map(SessionService::toRollEntry).toList());
            draft.setMode(TrackingMode.DETAILED);
        } else {
            draft.setMode(TrackingMode.SIMPLE);
            draft.setSimpleTotals(
                    valueOrZero(request.rollCount()),
                    valueOrZero(request.submissionsFor()),
                    valueOrZero(request.submissionsAgainst())
            );
            draft.setPartners(request.partners());
        }

        List<TechniqueInput> techniques = request.techniques() != null ? request.techniques() : List.of();
        draft.replaceTechniques(techniques.stream()
                .map(input -> TechniqueEntry.restore(input.movementId(), input.movementName(), input.notes(),
                        input.mediaUrls()))
                .toList());

        draft.setFightDynamics(request.fightDynamics());
        if (request.wearable() != null) {
            draft.setWearable(request.wearable());
        }
    }

    private static RollEntry toRollEntry(RollInput input) {
        int duration = input.durationMinutes() != null ? input.durationMinutes() : RollLedger.DEFAULT_ROLL_MINUTES;
        return RollEntry.restore(input.partnerId(), input.partnerName(), duration,
                input.submissionsFor(), input.submissionsAgainst(), input.notes());
    }

    private static int valueOrZero(Integer value) {
        return value != null ? value : 0;
    }
}
