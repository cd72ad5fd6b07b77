package com.rivaflow.backend.modules.session.infrastructure.persistence;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.rivaflow.backend.global.error.ProblemException;
import com.rivaflow.backend.modules.session.domain.SessionPayload;
import com.rivaflow.backend.modules.session.domain.SessionStore;
import com.rivaflow.backend.modules.session.domain.StoredSession;
import com.rivaflow.backend.modules.session.domain.TrainingSession;

import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@Transactional
public class JpaSessionStore implements SessionStore {

    private final TrainingSessionRepository trainingSessionRepository;

    public JpaSessionStore(TrainingSessionRepository trainingSessionRepository) {
        this.trainingSessionRepository = trainingSessionRepository;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredSession> getSession(UUID ownerId, UUID sessionId) {
        return trainingSessionRepository.findByIdAndOwnerId(sessionId, ownerId)
                .map(SessionPersistenceMapper::toStored);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredSession> listSessions(UUID ownerId, LocalDate from, LocalDate to) {
        return trainingSessionRepository.findForOwnerBetween(ownerId, from, to).stream()
                .map(SessionPersistenceMapper::toStored)
                .toList();
    }

    @Override
    public StoredSession saveSession(UUID ownerId, UUID sessionId, Long expectedVersion, SessionPayload payload) {
        TrainingSession session;
        if (sessionId == null) {
            session = new TrainingSession(ownerId);
        } else {
            session = trainingSessionRepository.findByIdAndOwnerId(sessionId, ownerId)
                    .orElseThrow(() -> ProblemException.notFound("SESSION_NOT_FOUND"));
            if (expectedVersion != null && !Objects.equals(expectedVersion, session.getVersion())) {
                throw new ObjectOptimisticLockingFailureException(TrainingSession.class, sessionId);
            }
        }
        SessionPersistenceMapper.applyPayload(session, payload);
        TrainingSession saved = trainingSessionRepository.saveAndFlush(session);
        return SessionPersistenceMapper.toStored(saved);
    }

    @Override
    public boolean deleteSession(UUID ownerId, UUID sessionId) {
        Optional<TrainingSession> session = trainingSessionRepository.findByIdAndOwnerId(sessionId, ownerId);
        session.ifPresent(trainingSessionRepository::delete);
        return session.isPresent();
    }
}
