package com.rivaflow.backend.modules.glossary.infrastructure.persistence;

import java.util.Collection;
import java.util.List;

import com.rivaflow.backend.modules.glossary.domain.Movement;
import com.rivaflow.backend.modules.glossary.domain.MovementCategory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface MovementRepository extends JpaRepository<Movement, Long> {

    List<Movement> findAllByOrderByNameAsc();

    List<Movement> findByCategoryOrderByNameAsc(MovementCategory category);

    @Query("select m.id from Movement m where m.id in :ids")
    List<Long> findExistingIds(@Param("ids") Collection<Long> ids);
}
