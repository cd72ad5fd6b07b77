package com.rivaflow.backend.modules.session.domain;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary for sessions. A save writes the session together with all of its
 * rolls and techniques or nothing at all.
 */
public interface SessionStore {

    Optional<StoredSession> getSession(UUID ownerId, UUID sessionId);

    List<StoredSession> listSessions(UUID ownerId, LocalDate from, LocalDate to);

    /**
     * @param sessionId       {@code null} to create a new session
     * @param expectedVersion version the edit started from, {@code null} to skip the check
     */
    StoredSession saveSession(UUID ownerId, UUID sessionId, Long expectedVersion, SessionPayload payload);

    boolean deleteSession(UUID ownerId, UUID sessionId);
}
