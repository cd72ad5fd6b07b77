package com.rivaflow.backend.modules.wearable.infrastructure.persistence;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rivaflow.backend.modules.wearable.domain.WearableWorkout;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WearableWorkoutRepository extends JpaRepository<WearableWorkout, UUID> {

    Optional<WearableWorkout> findByIdAndOwnerId(UUID id, UUID ownerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select w from WearableWorkout w
            where w.id = :id and w.ownerId = :ownerId
            """)
    Optional<WearableWorkout> findByIdAndOwnerIdForUpdate(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    Optional<WearableWorkout> findByOwnerIdAndExternalId(UUID ownerId, String externalId);

    @Query("""
            select w from WearableWorkout w
            where w.ownerId = :ownerId
              and w.startTime >= :from and w.startTime <= :to
            order by w.startTime asc
            """)
    List<WearableWorkout> findStartingBetween(@Param("ownerId") UUID ownerId,
                                              @Param("from") Instant from,
                                              @Param("to") Instant to);

    List<WearableWorkout> findByOwnerIdAndLinkedSessionIdIn(UUID ownerId, Collection<UUID> sessionIds);

    @Modifying
    @Query("delete from WearableWorkout w where w.ownerId = :ownerId")
    int deleteAllByOwner(@Param("ownerId") UUID ownerId);
}
