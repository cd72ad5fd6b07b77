package com.rivaflow.backend.modules.session.domain;

/**
 * Partial update of a roll. {@code null} components leave the field unchanged; a blank
 * string clears it. Setting a partner id replaces any free-text partner and vice versa.
 */
public record RollPatch(
        String partnerId,
        String partnerName,
        Integer durationMinutes,
        String notes
) {

    public static RollPatch partner(String partnerId, String partnerName) {
        return new RollPatch(partnerId, partnerName, null, null);
    }

    public static RollPatch freeTextPartner(String partnerName) {
        return new RollPatch(null, partnerName, null, null);
    }

    public static RollPatch duration(int durationMinutes) {
        return new RollPatch(null, null, durationMinutes, null);
    }

    public static RollPatch notes(String notes) {
        return new RollPatch(null, null, null, notes);
    }
}
