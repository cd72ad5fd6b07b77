package com.rivaflow.backend.modules.wearable.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Per-user state of the wearable link. The OAuth grant itself is held by the integration;
 * this row only records which scopes it reported.
 */
@Entity
@Table(name = "wearable_connection")
public class WearableConnection extends AbstractTimestampedEntity {

    @Id
    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ownerId;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "granted_scopes", nullable = false, columnDefinition = "jsonb")
    private List<String> grantedScopes = new ArrayList<>();

    @Column(name = "auto_create_sessions", nullable = false)
    private boolean autoCreateSessions;

    @Column(name = "connected_at", nullable = false)
    private OffsetDateTime connectedAt;

    @Column(name = "last_synced_at")
    private OffsetDateTime lastSyncedAt;

    protected WearableConnection() {
    }

    public WearableConnection(UUID ownerId, OffsetDateTime connectedAt) {
        this.ownerId = ownerId;
        this.connectedAt = connectedAt;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public List<String> getGrantedScopes() {
        return grantedScopes == null ? List.of() : grantedScopes;
    }

    public void setGrantedScopes(List<String> grantedScopes) {
        this.grantedScopes = grantedScopes == null ? new ArrayList<>() : new ArrayList<>(grantedScopes);
    }

    public boolean isAutoCreateSessions() {
        return autoCreateSessions;
    }

    public void setAutoCreateSessions(boolean autoCreateSessions) {
        this.autoCreateSessions = autoCreateSessions;
    }

    public OffsetDateTime getConnectedAt() {
        return connectedAt;
    }

    public OffsetDateTime getLastSyncedAt() {
        return lastSyncedAt;
    }

    public void setLastSyncedAt(OffsetDateTime lastSyncedAt) {
        this.lastSyncedAt = lastSyncedAt;
    }
}
