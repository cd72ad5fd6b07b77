package com.rivaflow.backend.modules.session.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered technique entries of one session edit, numbered {@code 1..N}. Entries without a
 * selected movement are drafts: they stay in the ledger but never reach the save payload.
 */
public class TechniqueLedger {

    private static final String LEDGER_NAME = "technique";
    private static final String MEDIA_LEDGER_NAME = "technique media";

    private final List<TechniqueEntry> entries = new ArrayList<>();

    public static TechniqueLedger of(List<TechniqueEntry> techniques) {
        TechniqueLedger ledger = new TechniqueLedger();
        ledger.replaceWith(techniques);
        return ledger;
    }

    public void replaceWith(List<TechniqueEntry> techniques) {
        List<TechniqueEntry> copies = techniques.stream()
                .map(technique -> Objects.requireNonNull(technique).copy())
                .toList();
        entries.clear();
        entries.addAll(copies);
        renumber();
    }

    public TechniqueEntry add() {
        TechniqueEntry entry = new TechniqueEntry(entries.size() + 1);
        entries.add(entry);
        renumber();
        return entry;
    }

    public TechniqueEntry removeAt(int index) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        TechniqueEntry removed = entries.remove(index);
        renumber();
        return removed;
    }

    public TechniqueEntry updateAt(int index, TechniquePatch patch) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        Objects.requireNonNull(patch, "patch");
        TechniqueEntry entry = entries.get(index);
        entry.apply(patch);
        return entry;
    }

    public TechniqueEntry selectMovement(int index, Long movementId, String movementName) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        TechniqueEntry entry = entries.get(index);
        entry.selectMovement(movementId, movementName);
        return entry;
    }

    public MediaUrl addMedia(int index) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        MediaUrl media = MediaUrl.blank();
        entries.get(index).mutableMedia().add(media);
        return media;
    }

    public MediaUrl removeMediaAt(int index, int mediaIndex) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        List<MediaUrl> media = entries.get(index).mutableMedia();
        LedgerIndexOutOfRangeException.check(MEDIA_LEDGER_NAME, mediaIndex, media.size());
        return media.remove(mediaIndex);
    }

    public MediaUrl updateMediaAt(int index, int mediaIndex, MediaPatch patch) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        List<MediaUrl> media = entries.get(index).mutableMedia();
        LedgerIndexOutOfRangeException.check(MEDIA_LEDGER_NAME, mediaIndex, media.size());
        Objects.requireNonNull(patch, "patch");
        MediaUrl updated = media.get(mediaIndex).apply(patch);
        media.set(mediaIndex, updated);
        return updated;
    }

    public TechniqueEntry get(int index) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        return entries.get(index);
    }

    public List<TechniqueEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Entries without a movement and media without a url are dropped. Surviving entries keep
     * the number they carry in the ledger.
     */
    public List<TechniquePayload> toPayload() {
        return entries.stream()
                .filter(TechniqueEntry::hasMovement)
                .map(TechniqueEntry::toPayload)
                .toList();
    }

    public TechniqueLedger copy() {
        return of(entries);
    }

    private void renumber() {
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setTechniqueNumber(i + 1);
        }
    }
}
