package com.rivaflow.backend.modules.partner.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.modules.partner.domain.SocialConnection;

import org.springframework.data.jpa.repository.JpaRepository;

public interface SocialConnectionRepository extends JpaRepository<SocialConnection, UUID> {

    List<SocialConnection> findByOwnerIdOrderByDisplayNameAsc(UUID ownerId);
}
