package com.rivaflow.backend.modules.partner.presentation.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.rivaflow.backend.modules.partner.domain.Partner;
import com.rivaflow.backend.modules.partner.domain.PartnerSource;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartnerResponse(
        String id,
        String name,
        PartnerSource source,
        String beltRank,
        String certification
) {

    public static PartnerResponse from(Partner partner) {
        return new PartnerResponse(partner.id(), partner.name(), partner.source(), partner.beltRank(),
                partner.certification());
    }
}
