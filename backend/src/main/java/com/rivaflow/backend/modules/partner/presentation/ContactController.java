package com.rivaflow.backend.modules.partner.presentation;

import java.net.URI;
import java.util.List;
import java.util.UUID;

import com.rivaflow.backend.global.security.SecurityUtils;
import com.rivaflow.backend.modules.partner.application.PartnerDirectoryService;
import com.rivaflow.backend.modules.partner.presentation.dto.ContactResponse;
import com.rivaflow.backend.modules.partner.presentation.dto.CreateContactRequest;

import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/contacts")
public class ContactController {

    private final PartnerDirectoryService partnerDirectoryService;

    public ContactController(PartnerDirectoryService partnerDirectoryService) {
        this.partnerDirectoryService = partnerDirectoryService;
    }

    @GetMapping
    public ResponseEntity<List<ContactResponse>> listContacts() {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        return ResponseEntity.ok(partnerDirectoryService.listContacts(ownerId));
    }

    @PostMapping
    public ResponseEntity<ContactResponse> createContact(@Valid @RequestBody CreateContactRequest request) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        ContactResponse created = partnerDirectoryService.createContact(ownerId, request);
        return ResponseEntity.created(URI.create("/contacts/" + created.id())).body(created);
    }

    @DeleteMapping("/{contactId}")
    public ResponseEntity<Void> deleteContact(@PathVariable("contactId") UUID contactId) {
        UUID ownerId = SecurityUtils.getCurrentOwnerId();
        partnerDirectoryService.deleteContact(ownerId, contactId);
        return ResponseEntity.noContent().build();
    }
}
