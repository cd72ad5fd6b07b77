package com.rivaflow.backend.modules.session.presentation;

import java.net.URI;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.global.error.ProblemResponse;
import com.rivaflow.backend.global.security.SecurityUtils;
import com.rivaflow.backend.modules.session.application.SessionService;
import com.rivaflow.backend.modules.session.domain.SessionSaveResult;
import com.rivaflow.backend.modules.session.presentation.dto.SessionDtoMapper;
import com.rivaflow.backend.modules.session.presentation.dto.SessionListResponse;
import com.rivaflow.backend.modules.session.presentation.dto.SessionRequest;
import com.rivaflow.backend.modules.session.presentation.dto.SessionResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/sessions")
public class SessionController {

    private final SessionService sessionService;

    public SessionController(SessionService sessionService) {
        this.sessionService = sessionService;
    }

    @GetMapping
    public ResponseEntity<SessionListResponse> listSessions(
            @RequestParam(name = "from", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate from,
            @RequestParam(name = "to", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate to
    ) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(sessionService.listSessions(ownerId, from, to));
    }

    @PostMapping
    public ResponseEntity<?> createSession(@Valid @RequestBody SessionRequest request,
                                           HttpServletRequest httpRequest) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        SessionSaveResult result = sessionService.createSession(ownerId, request);
        if (result instanceof SessionSaveResult.Saved saved) {
            SessionResponse body = SessionDtoMapper.toResponse(saved.session());
            return ResponseEntity.created(URI.create("/sessions/" + body.id())).body(body);
        }
        return rejected((SessionSaveResult.Rejected) result, httpRequest);
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<SessionResponse> getSession(@PathVariable("sessionId") UUID sessionId) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(sessionService.getSession(ownerId, sessionId));
    }

    @PutMapping("/{sessionId}")
    public ResponseEntity<?> updateSession(@PathVariable("sessionId") UUID sessionId,
                                           @Valid @RequestBody SessionRequest request,
                                           HttpServletRequest httpRequest) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        SessionSaveResult result = sessionService.updateSession(ownerId, sessionId, request);
        if (result instanceof SessionSaveResult.Saved saved) {
            return ResponseEntity.ok(SessionDtoMapper.toResponse(saved.session()));
        }
        return rejected((SessionSaveResult.Rejected) result, httpRequest);
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> deleteSession(@PathVariable("sessionId") UUID sessionId) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        sessionService.deleteSession(ownerId, sessionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/review/ack")
    public ResponseEntity<SessionResponse> acknowledgeReview(@PathVariable("sessionId") UUID sessionId) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(sessionService.acknowledgeReview(ownerId, sessionId));
    }

    private ResponseEntity<ProblemResponse> rejected(SessionSaveResult.Rejected rejected, HttpServletRequest request) {
        HttpStatus status = HttpStatus.UNPROCESSABLE_ENTITY;
        List<ProblemResponse.FieldError> errors = rejected.violations().stream()
                .map(violation -> new ProblemResponse.FieldError(violation.field(), violation.message()))
                .toList();
        ProblemResponse body = ProblemResponse.of(status, "validation_error", "Session validation failed",
                request.getRequestURI(), errors);
        return ResponseEntity.status(status).contentType(MediaType.APPLICATION_PROBLEM_JSON).body(body);
    }
}
