package com.rivaflow.backend.modules.glossary.presentation;

import java.util.List;

import com.rivaflow.backend.global.common.CancellationToken;
import com.rivaflow.backend.global.error.ProblemException;
import com.rivaflow.backend.modules.glossary.domain.Movement;
import com.rivaflow.backend.modules.glossary.domain.MovementGlossary;
import com.rivaflow.backend.modules.glossary.presentation.dto.MovementResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/glossary/movements")
public class GlossaryController {

    private final MovementGlossary movementGlossary;

    public GlossaryController(MovementGlossary movementGlossary) {
        this.movementGlossary = movementGlossary;
    }

    @GetMapping
    public ResponseEntity<List<MovementResponse>> searchMovements(
            @RequestParam(name = "q", required = false) String query,
            @RequestParam(name = "submissionsOnly", defaultValue = "false") boolean submissionsOnly
    ) {
        List<Movement> movements = submissionsOnly
                ? movementGlossary.searchSubmissions(query, CancellationToken.none())
                : movementGlossary.search(query, CancellationToken.none());
        return ResponseEntity.ok(movements.stream().map(MovementResponse::from).toList());
    }

    @GetMapping("/{movementId}")
    public ResponseEntity<MovementResponse> getMovement(@PathVariable("movementId") Long movementId) {
        return movementGlossary.findById(movementId)
                .map(MovementResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ProblemException.notFound("MOVEMENT_NOT_FOUND"));
    }
}
