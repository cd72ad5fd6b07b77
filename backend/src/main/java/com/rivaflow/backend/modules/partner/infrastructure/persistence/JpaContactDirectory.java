package com.rivaflow.backend.modules.partner.infrastructure.persistence;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import com.rivaflow.backend.modules.partner.domain.Contact;
import com.rivaflow.backend.modules.partner.domain.ContactDirectory;
import com.rivaflow.backend.modules.partner.domain.Partner;
import com.rivaflow.backend.modules.partner.domain.PartnerSource;
import com.rivaflow.backend.modules.partner.domain.SocialConnection;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Partner ids: {@code c-<contactId>} for contacts, {@code u-<userId>} for social friends.
 * A friend that a contact already mirrors (via {@code linkedUserId}) takes the contact's id
 * so the two records merge. Suggestions have no id.
 */
@Component
@Transactional(readOnly = true)
public class JpaContactDirectory implements ContactDirectory {

    static final String CONTACT_PREFIX = "c-";
    static final String USER_PREFIX = "u-";

    private final ContactRepository contactRepository;
    private final SocialConnectionRepository socialConnectionRepository;

    public JpaContactDirectory(ContactRepository contactRepository,
                               SocialConnectionRepository socialConnectionRepository) {
        this.contactRepository = contactRepository;
        this.socialConnectionRepository = socialConnectionRepository;
    }

    @Override
    public List<Partner> manualContacts(UUID ownerId) {
        return contactRepository.findByOwnerIdOrderByNameAsc(ownerId).stream()
                .filter(contact -> contact.getContactType().isTrainingPartner())
                .map(contact -> toPartner(contact, PartnerSource.MANUAL))
                .toList();
    }

    @Override
    public List<Partner> instructors(UUID ownerId) {
        return contactRepository.findByOwnerIdOrderByNameAsc(ownerId).stream()
                .filter(contact -> contact.getContactType().isInstructor())
                .map(contact -> toPartner(contact, PartnerSource.INSTRUCTOR))
                .toList();
    }

    @Override
    public List<Partner> socialFriends(UUID ownerId) {
        Map<UUID, Contact> contactsByLinkedUser = contactRepository.findByOwnerIdOrderByNameAsc(ownerId).stream()
                .filter(contact -> contact.getLinkedUserId() != null)
                .collect(Collectors.toMap(Contact::getLinkedUserId, Function.identity(), (first, second) -> first));
        return socialConnectionRepository.findByOwnerIdOrderByDisplayNameAsc(ownerId).stream()
                .map(connection -> toPartner(connection, contactsByLinkedUser))
                .toList();
    }

    public static String contactKey(UUID contactId) {
        return CONTACT_PREFIX + contactId;
    }

    private static Partner toPartner(Contact contact, PartnerSource source) {
        String certification = source == PartnerSource.INSTRUCTOR ? contact.getCertification() : null;
        return new Partner(contactKey(contact.getId()), contact.getName(), source, contact.getBeltRank(), certification);
    }

    private static Partner toPartner(SocialConnection connection, Map<UUID, Contact> contactsByLinkedUser) {
        String id = null;
        if (connection.getFriendUserId() != null) {
            Contact mirrored = contactsByLinkedUser.get(connection.getFriendUserId());
            id = mirrored != null ? contactKey(mirrored.getId()) : USER_PREFIX + connection.getFriendUserId();
        }
        return new Partner(id, connection.getDisplayName(), PartnerSource.SOCIAL, connection.getBeltRank());
    }
}
