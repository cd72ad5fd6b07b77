package com.rivaflow.backend.modules.partner.application;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Stream;

import com.rivaflow.backend.global.common.CancellationToken;
import com.rivaflow.backend.global.error.ProblemException;
import com.rivaflow.backend.modules.partner.domain.Contact;
import com.rivaflow.backend.modules.partner.domain.ContactDirectory;
import com.rivaflow.backend.modules.partner.domain.ContactType;
import com.rivaflow.backend.modules.partner.domain.Partner;
import com.rivaflow.backend.modules.partner.domain.PartnerResolver;
import com.rivaflow.backend.modules.partner.infrastructure.persistence.ContactRepository;
import com.rivaflow.backend.modules.partner.infrastructure.persistence.JpaContactDirectory;
import com.rivaflow.backend.modules.partner.presentation.dto.ContactResponse;
import com.rivaflow.backend.modules.partner.presentation.dto.CreateContactRequest;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class PartnerDirectoryService {

    public static final int DEFAULT_TOP_PARTNERS = 8;

    private final ContactDirectory contactDirectory;
    private final ContactRepository contactRepository;

    public PartnerDirectoryService(ContactDirectory contactDirectory, ContactRepository contactRepository) {
        this.contactDirectory = contactDirectory;
        this.contactRepository = contactRepository;
    }

    @Transactional(readOnly = true)
    public List<Partner> directory(UUID ownerId) {
        return PartnerResolver.merge(
                contactDirectory.manualContacts(ownerId),
                contactDirectory.instructors(ownerId),
                contactDirectory.socialFriends(ownerId)
        );
    }

    @Transactional(readOnly = true)
    public List<Partner> search(UUID ownerId, String query, CancellationToken cancellation) {
        CancellationToken token = cancellation != null ? cancellation : CancellationToken.none();
        List<Partner> partners = directory(ownerId);
        if (!StringUtils.hasText(query)) {
            return token.isCancelled() ? List.of() : partners;
        }
        String needle = PartnerResolver.normalizeName(query);
        List<Partner> matches = new ArrayList<>();
        for (Partner partner : partners) {
            if (token.isCancelled()) {
                return List.of();
            }
            if (PartnerResolver.normalizeName(partner.name()).contains(needle)) {
                matches.add(partner);
            }
        }
        return token.isCancelled() ? List.of() : matches;
    }

    /**
     * Quick picks for the roll editor: everyone the owner trains with, in directory order.
     * Membership comes from the manual and social lists, so a contact that is both instructor
     * and training partner is picked even though it merges under its instructor record.
     */
    @Transactional(readOnly = true)
    public List<Partner> topPartners(UUID ownerId, int limit) {
        int safeLimit = limit > 0 ? limit : DEFAULT_TOP_PARTNERS;
        List<Partner> manual = contactDirectory.manualContacts(ownerId);
        List<Partner> social = contactDirectory.socialFriends(ownerId);
        Set<String> trainingKeys = new HashSet<>();
        Stream.concat(manual.stream(), social.stream()).forEach(partner -> trainingKeys.add(trainingKey(partner)));
        return PartnerResolver.merge(manual, contactDirectory.instructors(ownerId), social).stream()
                .filter(partner -> trainingKeys.contains(trainingKey(partner)))
                .limit(safeLimit)
                .toList();
    }

    @Transactional(readOnly = true)
    public List<ContactResponse> listContacts(UUID ownerId) {
        return contactRepository.findByOwnerIdOrderByNameAsc(ownerId).stream()
                .map(contact -> ContactResponse.from(contact, JpaContactDirectory.contactKey(contact.getId())))
                .toList();
    }

    public ContactResponse createContact(UUID ownerId, CreateContactRequest request) {
        ContactType type = request.contactType() != null ? request.contactType() : ContactType.TRAINING_PARTNER;
        Contact contact = new Contact(ownerId, request.name().trim(), type);
        contact.setBeltRank(StringUtils.hasText(request.beltRank()) ? request.beltRank().trim() : null);
        contact.setCertification(type.isInstructor() && StringUtils.hasText(request.certification())
                ? request.certification().trim()
                : null);
        contact.setLinkedUserId(request.linkedUserId());
        Contact saved = contactRepository.save(contact);
        return ContactResponse.from(saved, JpaContactDirectory.contactKey(saved.getId()));
    }

    public void deleteContact(UUID ownerId, UUID contactId) {
        Contact contact = contactRepository.findByIdAndOwnerId(contactId, ownerId)
                .orElseThrow(() -> ProblemException.notFound("CONTACT_NOT_FOUND"));
        contactRepository.delete(contact);
    }

    private static String trainingKey(Partner partner) {
        return partner.hasId() ? partner.id() : "name:" + PartnerResolver.normalizeName(partner.name());
    }
}
