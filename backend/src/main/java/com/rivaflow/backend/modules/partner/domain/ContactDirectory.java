package com.rivaflow.backend.modules.partner.domain;

import java.util.List;
import java.util.UUID;

/**
 * Supplies the three raw partner lists of one user, already converted to {@link Partner}s
 * with stable ids.
 */
public interface ContactDirectory {

    List<Partner> manualContacts(UUID ownerId);

    List<Partner> instructors(UUID ownerId);

    List<Partner> socialFriends(UUID ownerId);
}
