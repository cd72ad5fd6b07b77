package com.rivaflow.backend.modules.wearable.presentation;

import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.global.security.SecurityUtils;
import com.rivaflow.backend.modules.session.presentation.dto.SessionResponse;
import com.rivaflow.backend.modules.wearable.application.WearableConnectionService;
import com.rivaflow.backend.modules.wearable.application.WearableMatchService;
import com.rivaflow.backend.modules.wearable.presentation.dto.AutoCreateResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.BulkCandidatesRequest;
import com.rivaflow.backend.modules.wearable.presentation.dto.BulkCandidatesResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.CandidateListResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.ConfirmMatchRequest;
import com.rivaflow.backend.modules.wearable.presentation.dto.ConnectionRequest;
import com.rivaflow.backend.modules.wearable.presentation.dto.ConnectionResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.IngestResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.SyncResponse;
import com.rivaflow.backend.modules.wearable.presentation.dto.WorkoutIngestRequest;
import com.rivaflow.backend.modules.wearable.presentation.dto.ZoneSummaryResponse;

import jakarta.validation.Valid;

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
@RequestMapping("/wearable")
public class WearableController {

    private final WearableMatchService matchService;
    private final WearableConnectionService connectionService;

    public WearableController(WearableMatchService matchService, WearableConnectionService connectionService) {
        this.matchService = matchService;
        this.connectionService = connectionService;
    }

    @GetMapping("/connection")
    public ResponseEntity<ConnectionResponse> getConnection() {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(connectionService.connectionStatus(ownerId));
    }

    @PutMapping("/connection")
    public ResponseEntity<ConnectionResponse> updateConnection(@Valid @RequestBody ConnectionRequest request) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(connectionService.updateConnection(ownerId, request));
    }

    @DeleteMapping("/connection")
    public ResponseEntity<Void> disconnect() {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        connectionService.disconnect(ownerId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/workouts")
    public ResponseEntity<IngestResponse> ingestWorkouts(@Valid @RequestBody WorkoutIngestRequest request) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(connectionService.ingest(ownerId, request.workouts()));
    }

    @GetMapping("/sessions/{sessionId}/candidates")
    public ResponseEntity<CandidateListResponse> candidates(@PathVariable("sessionId") UUID sessionId) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(matchService.candidates(ownerId, sessionId));
    }

    @PostMapping("/sessions/{sessionId}/sync")
    public ResponseEntity<SyncResponse> sync(@PathVariable("sessionId") UUID sessionId) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(matchService.sync(ownerId, sessionId));
    }

    @PostMapping("/sessions/{sessionId}/match")
    public ResponseEntity<SessionResponse> confirmMatch(@PathVariable("sessionId") UUID sessionId,
                                                        @Valid @RequestBody ConfirmMatchRequest request) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(matchService.confirm(ownerId, sessionId, request.workoutId()));
    }

    @DeleteMapping("/sessions/{sessionId}/match")
    public ResponseEntity<SessionResponse> clearMatch(@PathVariable("sessionId") UUID sessionId) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(matchService.clear(ownerId, sessionId));
    }

    @PostMapping("/candidates")
    public ResponseEntity<BulkCandidatesResponse> bulkCandidates(@Valid @RequestBody BulkCandidatesRequest request) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(matchService.candidatesForSessions(ownerId, request.sessionIds()));
    }

    @PostMapping("/auto-create")
    public ResponseEntity<AutoCreateResponse> autoCreate() {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(connectionService.autoCreateSessions(ownerId));
    }

    @GetMapping("/zones")
    public ResponseEntity<ZoneSummaryResponse> zones(@RequestParam("sessionIds") List<UUID> sessionIds) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(matchService.zoneSummary(ownerId, sessionIds));
    }
}
