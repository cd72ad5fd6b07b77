package com.rivaflow.backend.modules.partner.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A person the user trains with. {@code id} is absent for social suggestions that are not
 * connections yet; such entries are identified by name only.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Partner(
        String id,
        String name,
        PartnerSource source,
        String beltRank,
        String certification
) {

    public Partner(String id, String name, PartnerSource source, String beltRank) {
        this(id, name, source, beltRank, null);
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
