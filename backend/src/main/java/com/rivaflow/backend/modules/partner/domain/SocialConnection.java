package com.rivaflow.backend.modules.partner.domain;

import java.util.UUID;

import com.rivaflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * Read-side mirror of the social graph. Suggestions have no friend user id yet.
 */
@Entity
@Table(name = "social_connection")
public class SocialConnection extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ownerId;

    @Column(name = "friend_user_id", columnDefinition = "uuid")
    private UUID friendUserId;

    @Column(name = "display_name", nullable = false, length = 100)
    private String displayName;

    @Column(name = "belt_rank", length = 32)
    private String beltRank;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private SocialConnectionStatus status = SocialConnectionStatus.ACCEPTED;

    protected SocialConnection() {
    }

    public SocialConnection(UUID ownerId, UUID friendUserId, String displayName, SocialConnectionStatus status) {
        this.ownerId = ownerId;
        this.friendUserId = friendUserId;
        this.displayName = displayName;
        this.status = status;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public UUID getFriendUserId() {
        return friendUserId;
    }

    public String getDisplayName() {
        return displayName;
    }

    public String getBeltRank() {
        return beltRank;
    }

    public void setBeltRank(String beltRank) {
        this.beltRank = beltRank;
    }

    public SocialConnectionStatus getStatus() {
        return status;
    }
}
