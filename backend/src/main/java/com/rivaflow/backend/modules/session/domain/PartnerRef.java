package com.rivaflow.backend.modules.session.domain;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Partner listed on a simple-mode session: a directory id when picked from the partner
 * directory, otherwise just the typed name.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PartnerRef(String partnerId, String name) {
}
