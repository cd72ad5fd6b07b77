package com.rivaflow.backend.modules.session.domain;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One sparring round being edited inside a {@link RollLedger}. Submission tags are kept as
 * insertion-ordered sets of movement ids so individual tags can be shown and removed.
 */
public class RollEntry {

    private int rollNumber;
    private String partnerId;
    private String partnerName;
    private int durationMinutes;
    private final LinkedHashSet<Long> submissionsFor = new LinkedHashSet<>();
    private final LinkedHashSet<Long> submissionsAgainst = new LinkedHashSet<>();
    private String notes;

    RollEntry(int rollNumber, int durationMinutes) {
        this.rollNumber = rollNumber;
        this.durationMinutes = durationMinutes;
    }

    public static RollEntry restore(String partnerId, String partnerName, int durationMinutes,
                                    Iterable<Long> submissionsFor, Iterable<Long> submissionsAgainst, String notes) {
        RollEntry entry = new RollEntry(0, durationMinutes);
        entry.partnerId = partnerId;
        entry.partnerName = partnerName;
        entry.notes = notes;
        if (submissionsFor != null) {
            submissionsFor.forEach(id -> entry.submissionsFor.add(Objects.requireNonNull(id)));
        }
        if (submissionsAgainst != null) {
            submissionsAgainst.forEach(id -> entry.submissionsAgainst.add(Objects.requireNonNull(id)));
        }
        return entry;
    }

    /**
     * Adds the movement to the chosen side when absent, removes it when present.
     *
     * @return {@code true} when the movement is tagged after the call
     */
    public boolean toggle(Side side, Long movementId) {
        Objects.requireNonNull(movementId, "movementId");
        Set<Long> target = side == Side.FOR ? submissionsFor : submissionsAgainst;
        if (target.remove(movementId)) {
            return false;
        }
        target.add(movementId);
        return true;
    }

    void apply(RollPatch patch) {
        if (patch.partnerId() != null) {
            partnerId = patch.partnerId().isBlank() ? null : patch.partnerId();
            partnerName = patch.partnerName();
        } else if (patch.partnerName() != null) {
            partnerId = null;
            partnerName = patch.partnerName().isBlank() ? null : patch.partnerName();
        }
        if (patch.durationMinutes() != null) {
            durationMinutes = patch.durationMinutes();
        }
        if (patch.notes() != null) {
            notes = patch.notes().isBlank() ? null : patch.notes();
        }
    }

    RollEntry copy() {
        RollEntry copy = restore(partnerId, partnerName, durationMinutes, submissionsFor, submissionsAgainst, notes);
        copy.rollNumber = rollNumber;
        return copy;
    }

    void setRollNumber(int rollNumber) {
        this.rollNumber = rollNumber;
    }

    public int getRollNumber() {
        return rollNumber;
    }

    public String getPartnerId() {
        return partnerId;
    }

    public String getPartnerName() {
        return partnerName;
    }

    public int getDurationMinutes() {
        return durationMinutes;
    }

    public Set<Long> getSubmissionsFor() {
        return Collections.unmodifiableSet(submissionsFor);
    }

    public Set<Long> getSubmissionsAgainst() {
        return Collections.unmodifiableSet(submissionsAgainst);
    }

    public String getNotes() {
        return notes;
    }

    RollPayload toPayload() {
        return new RollPayload(rollNumber, partnerId, partnerName, durationMinutes,
                List.copyOf(submissionsFor), List.copyOf(submissionsAgainst), notes);
    }
}
