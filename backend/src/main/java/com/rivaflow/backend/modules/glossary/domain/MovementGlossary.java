package com.rivaflow.backend.modules.glossary.domain;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.rivaflow.backend.global.common.CancellationToken;

/**
 * Searchable movement names used when tagging submissions and techniques. Searches match
 * name, category, subcategory and aliases case-insensitively; a cancelled search returns
 * an empty list.
 */
public interface MovementGlossary {

    List<Movement> all();

    Optional<Movement> findById(Long movementId);

    Set<Long> existingIds(Collection<Long> movementIds);

    List<Movement> search(String query, CancellationToken cancellation);

    List<Movement> searchSubmissions(String query, CancellationToken cancellation);
}
