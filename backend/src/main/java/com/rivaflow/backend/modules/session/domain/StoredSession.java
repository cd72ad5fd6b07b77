package com.rivaflow.backend.modules.session.domain;

import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * A session as the store holds it: the saved payload plus the fields owned by the store
 * and by wearable reconciliation.
 */
public record StoredSession(
        UUID id,
        UUID ownerId,
        long version,
        SessionSource source,
        boolean needsReview,
        UUID wearableWorkoutId,
        SessionPayload payload,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
