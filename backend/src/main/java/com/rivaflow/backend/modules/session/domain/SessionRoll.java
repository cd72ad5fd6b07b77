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
@Table(name = "session_roll")
public class SessionRoll {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "session_id", nullable = false)
    private TrainingSession session;

    @Column(name = "roll_number", nullable = false)
    private int rollNumber;

    @Column(name = "partner_id", length = 64)
    private String partnerId;

    @Column(name = "partner_name", length = 100)
    private String partnerName;

    @Column(name = "duration_minutes", nullable = false)
    private int durationMinutes;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "submissions_for", nullable = false, columnDefinition = "jsonb")
    private List<Long> submissionsFor = new ArrayList<>();

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "submissions_against", nullable = false, columnDefinition = "jsonb")
    private List<Long> submissionsAgainst = new ArrayList<>();

    @Column(name = "notes")
    private String notes;

    public UUID getId() {
        return id;
    }

    public TrainingSession getSession() {
        return session;
    }

    void setSession(TrainingSession session) {
        this.session = session;
    }

    public int getRollNumber() {
        return rollNumber;
    }

    public void setRollNumber(int rollNumber) {
        this.rollNumber = rollNumber;
    }

    public String getPartnerId() {
        return partnerId;
    }

    public void setPartnerId(String partnerId) {
        this.partnerId = partnerId;
    }

    public String getPartnerName() {
        return partnerName;
    }

    public void setPartnerName(String partnerName) {
        this.partnerName = partnerName;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public void setDurationMinutes(int durationMinutes) {
        this.durationMinutes = durationMinutes;
    }

    public List<Long> getSubmissionsFor() {
        return submissionsFor == null ? List.of() : submissionsFor;
    }

    public void setSubmissionsFor(List<Long> submissionsFor) {
        this.submissionsFor = new ArrayList<>(submissionsFor);
    }

    public List<Long> getSubmissionsAgainst() {
        return submissionsAgainst == null ? List.of() : submissionsAgainst;
    }

    public void setSubmissionsAgainst(List<Long> submissionsAgainst) {
        this.submissionsAgainst = new ArrayList<>(submissionsAgainst);
    }

    public String getNotes() {
        return notes;
    }

    public void setNotes(String notes) {
        this.notes = notes;
    }
}
