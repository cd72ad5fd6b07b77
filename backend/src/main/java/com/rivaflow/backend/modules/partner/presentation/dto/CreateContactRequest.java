package com.rivaflow.backend.modules.partner.presentation.dto;

import java.util.UUID;

import com.rivaflow.backend.modules.partner.domain.ContactType;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateContactRequest(
        @NotBlank @Size(max = 100) String name,
        ContactType contactType,
        @Size(max = 32) String beltRank,
        @Size(max = 200) String certification,
        UUID linkedUserId
) {
}
