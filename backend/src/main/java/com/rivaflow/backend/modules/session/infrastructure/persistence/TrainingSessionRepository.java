package com.rivaflow.backend.modules.session.infrastructure.persistence;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.rivaflow.backend.modules.session.domain.TrainingSession;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TrainingSessionRepository extends JpaRepository<TrainingSession, UUID> {

    Optional<TrainingSession> findByIdAndOwnerId(UUID id, UUID ownerId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
            select s from TrainingSession s
            where s.id = :id and s.ownerId = :ownerId
            """)
    Optional<TrainingSession> findByIdAndOwnerIdForUpdate(@Param("id") UUID id, @Param("ownerId") UUID ownerId);

    @Query("""
            select s from TrainingSession s
            where s.ownerId = :ownerId
              and s.sessionDate between :from and :to
            order by s.sessionDate desc, s.classTime desc nulls last, s.createdAt desc
            """)
    List<TrainingSession> findForOwnerBetween(@Param("ownerId") UUID ownerId,
                                              @Param("from") LocalDate from,
                                              @Param("to") LocalDate to);

    List<TrainingSession> findByOwnerIdAndIdIn(UUID ownerId, Collection<UUID> ids);

    List<TrainingSession> findByOwnerIdAndWearableWorkoutIdIsNotNull(UUID ownerId);
}
