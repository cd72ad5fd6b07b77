package com.rivaflow.backend.modules.session.domain;

import java.util.List;

public record SimpleRollTracking(
        int rollCount,
        int submissionsFor,
        int submissionsAgainst,
        List<PartnerRef> partners
) implements RollTracking {

    public SimpleRollTracking {
        partners = partners == null ? List.of() : List.copyOf(partners);
    }

    @Override
    public TrackingMode mode() {
        return TrackingMode.SIMPLE;
    }
}
