package com.rivaflow.backend.modules.session.domain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered sparring rounds of one session edit. Roll numbers are always {@code 1..N};
 * callers address entries by zero-based list index and never number them themselves.
 */
public class RollLedger {

    public static final int DEFAULT_ROLL_MINUTES = 5;
    private static final String LEDGER_NAME = "roll";

    private final List<RollEntry> entries = new ArrayList<>();

    public RollLedger() {
    }

    public static RollLedger of(List<RollEntry> rolls) {
        RollLedger ledger = new RollLedger();
        ledger.replaceWith(rolls);
        return ledger;
    }

    /**
     * Replaces every entry with copies of the given rolls, numbered in list order.
     */
    public void replaceWith(List<RollEntry> rolls) {
        List<RollEntry> copies = rolls.stream().map(roll -> Objects.requireNonNull(roll).copy()).toList();
        entries.clear();
        entries.addAll(copies);
        renumber();
    }

    public RollEntry add() {
        RollEntry entry = new RollEntry(entries.size() + 1, DEFAULT_ROLL_MINUTES);
        entries.add(entry);
        renumber();
        return entry;
    }

    public RollEntry removeAt(int index) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        RollEntry removed = entries.remove(index);
        renumber();
        return removed;
    }

    public RollEntry updateAt(int index, RollPatch patch) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        Objects.requireNonNull(patch, "patch");
        RollEntry entry = entries.get(index);
        entry.apply(patch);
        return entry;
    }

    public boolean toggleSubmission(int index, Side side, Long movementId) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        return entries.get(index).toggle(side, movementId);
    }

    public RollEntry get(int index) {
        LedgerIndexOutOfRangeException.check(LEDGER_NAME, index, entries.size());
        return entries.get(index);
    }

    public List<RollEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int countSubmissions(Side side) {
        return entries.stream()
                .mapToInt(roll -> side == Side.FOR ? roll.getSubmissionsFor().size() : roll.getSubmissionsAgainst().size())
                .sum();
    }

    public List<RollPayload> toPayload() {
        return entries.stream().map(RollEntry::toPayload).toList();
    }

    public RollLedger copy() {
        return of(entries);
    }

    private void renumber() {
        for (int i = 0; i < entries.size(); i++) {
            entries.get(i).setRollNumber(i + 1);
        }
    }
}
