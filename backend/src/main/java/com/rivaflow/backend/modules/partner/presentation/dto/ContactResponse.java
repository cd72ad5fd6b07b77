package com.rivaflow.backend.modules.partner.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rivaflow.backend.modules.partner.domain.Contact;
import com.rivaflow.backend.modules.partner.domain.ContactType;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ContactResponse(
        UUID id,
        String partnerId,
        String name,
        ContactType contactType,
        String beltRank,
        String certification,
        UUID linkedUserId,
        OffsetDateTime createdAt
) {

    public static ContactResponse from(Contact contact, String partnerId) {
        return new ContactResponse(
                contact.getId(),
                partnerId,
                contact.getName(),
                contact.getContactType(),
                contact.getBeltRank(),
                contact.getCertification(),
                contact.getLinkedUserId(),
                contact.getCreatedAt()
        );
    }
}
