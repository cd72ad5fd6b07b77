package com.rivaflow.backend.modules.session.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class TechniqueEntry {

    private int techniqueNumber;
    private Long movementId;
    private String movementName;
    private String notes;
    private final List<MediaUrl> mediaUrls = new ArrayList<>();

    TechniqueEntry(int techniqueNumber) {
        this.techniqueNumber = techniqueNumber;
    }

    public static TechniqueEntry restore(Long movementId, String movementName, String notes, List<MediaUrl> mediaUrls) {
        TechniqueEntry entry = new TechniqueEntry(0);
        entry.movementId = movementId;
        entry.movementName = movementName;
        entry.notes = notes;
        if (mediaUrls != null) {
            entry.mediaUrls.addAll(mediaUrls);
        }
        return entry;
    }

    TechniqueEntry copy() {
        TechniqueEntry copy = restore(movementId, movementName, notes, mediaUrls);
        copy.techniqueNumber = techniqueNumber;
        return copy;
    }

    void setTechniqueNumber(int techniqueNumber) {
        this.techniqueNumber = techniqueNumber;
    }

    void selectMovement(Long movementId, String movementName) {
        this.movementId = movementId;
        this.movementName = movementId == null ? null : movementName;
    }

    void apply(TechniquePatch patch) {
        if (patch.notes() != null) {
            notes = patch.notes().isBlank() ? null : patch.notes();
        }
    }

    List<MediaUrl> mutableMedia() {
        return mediaUrls;
    }

    public int getTechniqueNumber() {
        return techniqueNumber;
    }

    public Long getMovementId() {
        return movementId;
    }

    public String getMovementName() {
        return movementName;
    }

    public String getNotes() {
        return notes;
    }

    public List<MediaUrl> getMediaUrls() {
        return Collections.unmodifiableList(mediaUrls);
    }

    public boolean hasMovement() {
        return movementId != null;
    }

    TechniquePayload toPayload() {
        List<MediaUrl> media = mediaUrls.stream().filter(MediaUrl::hasUrl).toList();
        return new TechniquePayload(techniqueNumber, movementId, movementName, notes, media);
    }
}
