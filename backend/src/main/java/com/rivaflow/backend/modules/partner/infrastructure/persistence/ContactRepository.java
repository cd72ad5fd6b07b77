package com.rivaflow.backend.modules.partner.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rivaflow.backend.modules.partner.domain.Contact;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ContactRepository extends JpaRepository<Contact, UUID> {

    List<Contact> findByOwnerIdOrderByNameAsc(UUID ownerId);

    Optional<Contact> findByIdAndOwnerId(UUID id, UUID ownerId);
}
