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

@Entity
@Table(name = "contact")
public class Contact extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID ownerId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "contact_type", nullable = false, length = 32)
    private ContactType contactType = ContactType.TRAINING_PARTNER;

    @Column(name = "belt_rank", length = 32)
    private String beltRank;

    @Column(name = "certification", length = 200)
    private String certification;

    @Column(name = "linked_user_id", columnDefinition = "uuid")
    private UUID linkedUserId;

    protected Contact() {
    }

    public Contact(UUID ownerId, String name, ContactType contactType) {
        this.ownerId = ownerId;
        this.name = name;
        this.contactType = contactType;
    }

    public UUID getId() {
        return id;
    }

    public UUID getOwnerId() {
        return ownerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public ContactType getContactType() {
        return contactType;
    }

    public void setContactType(ContactType contactType) {
        this.contactType = contactType;
    }

    public String getBeltRank() {
        return beltRank;
    }

    public void setBeltRank(String beltRank) {
        this.beltRank = beltRank;
    }

    public String getCertification() {
        return certification;
    }

    public void setCertification(String certification) {
        this.certification = certification;
    }

    public UUID getLinkedUserId() {
        return linkedUserId;
    }

    public void setLinkedUserId(UUID linkedUserId) {
        this.linkedUserId = linkedUserId;
    }
}
