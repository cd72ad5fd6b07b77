package com.rivaflow.backend.modules.partner.presentation;

import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.global.common.CancellationToken;
import com.rivaflow.backend.global.security.SecurityUtils;
import com.rivaflow.backend.modules.partner.application.PartnerDirectoryService;
import com.rivaflow.backend.modules.partner.presentation.dto.PartnerResponse;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/partners")
public class PartnerController {

    private final PartnerDirectoryService partnerDirectoryService;

    public PartnerController(PartnerDirectoryService partnerDirectoryService) {
        this.partnerDirectoryService = partnerDirectoryService;
    }

    @GetMapping
    public ResponseEntity<List<PartnerResponse>> getDirectory() {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(partnerDirectoryService.directory(ownerId).stream()
                .map(PartnerResponse::from)
                .toList());
    }

    @GetMapping("/search")
    public ResponseEntity<List<PartnerResponse>> search(@RequestParam(name = "q", required = false) String query) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(partnerDirectoryService.search(ownerId, query, CancellationToken.none()).stream()
                .map(PartnerResponse::from)
                .toList());
    }

    @GetMapping("/top")
    public ResponseEntity<List<PartnerResponse>> topPartners(
            @RequestParam(name = "limit", defaultValue = "" + PartnerDirectoryService.DEFAULT_TOP_PARTNERS) int limit
    ) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(partnerDirectoryService.topPartners(ownerId, limit).stream()
                .map(PartnerResponse::from)
                .toList());
    }
}
