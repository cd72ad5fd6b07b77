package com.rivaflow.backend.modules.session.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "session_technique")
public class SessionTechnique {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false)
    private TrainingSession session;

    @Column(name = "technique_number", nullable = false)
    private int techniqueNumber;

    @Column(name = "movement_id", nullable = false)
    private Long movementId;

    @Column(name = "movement_name", length = 120)
    private String movementName;

    @Column(name = "notes")
    private String notes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "media_urls", nullable = false, columnDefinition = "jsonb")
    private List<MediaUrl> mediaUrls = new ArrayList<>();

    public UUID getId() {
        return id;
    }

    public TrainingSession getSession() {
        return session;
    }

    void setSession(TrainingSession session) {
        this.session = session;
    }

    public int getTechniqueNumber() {
        return techniqueNumber;
    }

    public void setTechniqueNumber(int techniqueNumber) {
        this.techniqueNumber = techniqueNumber;
    }

    public Long getMovementId() {
        return movementId;
    }

    public void setMovementId(Long movementId) {
        this.movementId = movementId;
    }

    public String getMovementName() {
        return movementName;
    }

    public void setMovementName(String movementName) {
        this.movementName = movementName;
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }

    public List<MediaUrl> getMediaUrls() {
        return mediaUrls == null ? List.of() : mediaUrls;
    }

    public void setMediaUrls(List<MediaUrl> mediaUrls) {
        this.mediaUrls = new ArrayList<>(mediaUrls);
    }
}
