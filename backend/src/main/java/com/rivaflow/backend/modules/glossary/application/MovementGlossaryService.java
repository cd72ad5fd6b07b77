package com.rivaflow.backend.modules.glossary.application;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import com.rivaflow.backend.global.common.CancellationToken;
import com.rivaflow.backend.modules.glossary.domain.Movement;
import com.rivaflow.backend.modules.glossary.domain.MovementCategory;
import com.rivaflow.backend.modules.glossary.domain.MovementGlossary;
import com.rivaflow.backend.modules.glossary.infrastructure.persistence.MovementRepository;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional(readOnly = true)
public class MovementGlossaryService implements MovementGlossary {

    private final MovementRepository movementRepository;

    public MovementGlossaryService(MovementRepository movementRepository) {
        this.movementRepository = movementRepository;
    }

    @Override
    public List<Movement> all() {
        return movementRepository.findAllByOrderByNameAsc();
    }

    @Override
    public Optional<Movement> findById(Long movementId) {
        if (movementId == null) {
            return Optional.empty();
        }
        return movementRepository.findById(movementId);
    }

    @Override
    public Set<Long> existingIds(Collection<Long> movementIds) {
        List<Long> ids = movementIds.stream().filter(Objects::nonNull).distinct().toList();
        if (ids.isEmpty()) {
            return Set.of();
        }
        return new HashSet<>(movementRepository.findExistingIds(ids));
    }

    @Override
    public List<Movement> search(String query, CancellationToken cancellation) {
        return filter(movementRepository.findAllByOrderByNameAsc(), query, cancellation);
    }

    @Override
    public List<Movement> searchSubmissions(String query, CancellationToken cancellation) {
        return filter(movementRepository.findByCategoryOrderByNameAsc(MovementCategory.SUBMISSION), query, cancellation);
    }

    /**
     * Name prefix hits first, then other name hits, then category/subcategory/alias hits;
     * alphabetical inside each group.
     */
    static List<Movement> filter(List<Movement> movements, String query, CancellationToken cancellation) {
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        if (!StringUtils.hasText(query)) {
            return token.isCancelled() ? List.of() : movements;
        }
        String needle = query.trim().toLowerCase(Locale.ROOT);
        List<Ranked> matches = new ArrayList<>();
        for (Movement movement : movements) {
            if (token.isCancelled()) {
                return List.of();
            }
            int rank = rank(movement, needle);
            if (rank >= 0) {
                matches.add(new Ranked(movement, rank));
            }
        }
        if (token.isCancelled()) {
            return List.of();
        }
        return matches.stream()
                .sorted(Comparator.comparingInt(Ranked::rank)
                        .thenComparing(ranked -> ranked.movement().getName(), String.CASE_INSENSITIVE_ORDER))
                .map(Ranked::movement)
                .toList();
    }

    private static int rank(Movement movement, String needle) {
        String name = movement.getName().toLowerCase(Locale.ROOT);
        if (name.startsWith(needle)) {
            return 0;
        }
        if (name.contains(needle)) {
            return 1;
        }
        if (movement.getCategory() != null && movement.getCategory().getCode().contains(needle)) {
            return 2;
        }
        if (movement.getSubcategory() != null && movement.getSubcategory().toLowerCase(Locale.ROOT).contains(needle)) {
            return 2;
        }
        boolean aliasHit = movement.getAliases().stream()
                .anyMatch(alias -> alias.toLowerCase(Locale.ROOT).contains(needle));
        return aliasHit ? 2 : -1;
    }

    private record Ranked(Movement movement, int rank) {
    }
}
