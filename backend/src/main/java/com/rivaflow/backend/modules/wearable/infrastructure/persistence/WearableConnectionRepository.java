package com.rivaflow.backend.modules.wearable.infrastructure.persistence;

import java.util.UUID;

import com.rivaflow.backend.modules.wearable.domain.WearableConnection;

import org.springframework.data.jpa.repository.JpaRepository;

public interface WearableConnectionRepository extends JpaRepository<WearableConnection, UUID> {
}
