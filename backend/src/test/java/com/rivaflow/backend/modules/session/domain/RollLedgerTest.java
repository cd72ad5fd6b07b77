package com.rivaflow.backend.modules.session.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.stream.IntStream;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RollLedgerTest {

    private static final int ADD = 0;
    private static final int REMOVE = 1;

    @Test
    @DisplayName("added rolls get default duration, no submissions and sequential numbers")
    void addAssignsDefaults() {
        RollLedger ledger = new RollLedger();

        RollEntry first = ledger.add();
        RollEntry second = ledger.add();

        assertThat(first.getRollNumber()).isEqualTo(1);
        assertThat(second.getRollNumber()).isEqualTo(2);
        assertThat(first.getDurationMinutes()).isEqualTo(RollLedger.DEFAULT_ROLL_MINUTES);
        assertThat(first.getSubmissionsFor()).isEmpty();
        assertThat(first.getSubmissionsAgainst()).isEmpty();
    }

    @Test
    @DisplayName("removing a roll renumbers the remaining ones from 1")
    void removeRenumbers() {
        RollLedger ledger = new RollLedger();
        ledger.add();
        ledger.add();
        ledger.add();
        ledger.updateAt(2, RollPatch.freeTextPartner("Marcus"));

        ledger.removeAt(0);

        assertThat(ledger.entries()).extracting(RollEntry::getRollNumber).containsExactly(1, 2);
        assertThat(ledger.get(1).getPartnerName()).isEqualTo("Marcus");
    }

    @Test
    @DisplayName("removing the middle of three rolls keeps the order and numbers them 1 and 2")
    void removeMiddleRoll() {
        RollLedger ledger = new RollLedger();
        ledger.add();
        ledger.add();
        ledger.add();
        ledger.updateAt(0, RollPatch.freeTextPartner("Ana"));
        ledger.updateAt(1, RollPatch.freeTextPartner("Bruno"));
        ledger.updateAt(2, RollPatch.freeTextPartner("Marcus"));

        ledger.removeAt(1);

        assertThat(ledger.entries()).extracting(RollEntry::getRollNumber).containsExactly(1, 2);
        assertThat(ledger.entries()).extracting(RollEntry::getPartnerName).containsExactly("Ana", "Marcus");
    }

    @Test
    @DisplayName("numbers stay 1..n through a mixed run of adds and removals")
    void mixedAddsAndRemovalsStayContiguous() {
        RollLedger ledger = new RollLedger();
        int[][] steps = {
                {ADD}, {ADD}, {ADD}, {REMOVE, 1}, {ADD}, {REMOVE, 0}, {ADD}, {ADD}, {REMOVE, 3}, {REMOVE, 1},
                {REMOVE, 0}, {REMOVE, 0}, {ADD}
        };

        for (int[] step : steps) {
            if (step[0] == ADD) {
                ledger.add();
            } else {
                ledger.removeAt(step[1]);
            }
            assertThat(ledger.entries())
                    .extracting(RollEntry::getRollNumber)
                    .containsExactlyElementsOf(IntStream.rangeClosed(1, ledger.size()).boxed().toList());
        }
        assertThat(ledger.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("out of range index fails and leaves the ledger unchanged")
    void outOfRangeLeavesStateUnchanged() {
        RollLedger ledger = new RollLedger();
        ledger.add();
        ledger.add();
        List<RollPayload> before = ledger.toPayload();

        assertThatThrownBy(() -> ledger.removeAt(5))
                .isInstanceOf(LedgerIndexOutOfRangeException.class)
                .hasMessageContaining("index 5");
        assertThatThrownBy(() -> ledger.updateAt(-1, RollPatch.duration(7)))
                .isInstanceOf(LedgerIndexOutOfRangeException.class);

        assertThat(ledger.toPayload()).isEqualTo(before);
    }

    @Test
    @DisplayName("toggling a submission twice removes it again")
    void toggleIsSymmetric() {
        RollLedger ledger = new RollLedger();
        ledger.add();

        assertThat(ledger.toggleSubmission(0, Side.FOR, 19L)).isTrue();
        assertThat(ledger.get(0).getSubmissionsFor()).containsExactly(19L);

        assertThat(ledger.toggleSubmission(0, Side.FOR, 19L)).isFalse();
        assertThat(ledger.get(0).getSubmissionsFor()).isEmpty();
    }

    @Test
    @DisplayName("choosing a directory partner sets id and name, free text clears the id")
    void partnerPatchSemantics() {
        RollLedger ledger = new RollLedger();
        ledger.add();

        ledger.updateAt(0, RollPatch.partner("c-1", "Ana"));
        assertThat(ledger.get(0).getPartnerId()).isEqualTo("c-1");
        assertThat(ledger.get(0).getPartnerName()).isEqualTo("Ana");

        ledger.updateAt(0, RollPatch.freeTextPartner("Someone new"));
        assertThat(ledger.get(0).getPartnerId()).isNull();
        assertThat(ledger.get(0).getPartnerName()).isEqualTo("Someone new");
    }

    @Test
    @DisplayName("counts submissions per side across all rolls")
    void countsSubmissions() {
        RollLedger ledger = RollLedger.of(List.of(
                RollEntry.restore(null, "A", 5, List.of(19L, 34L), List.of(), null),
                RollEntry.restore(null, "B", 6, List.of(20L), List.of(24L), null)
        ));

        assertThat(ledger.countSubmissions(Side.FOR)).isEqualTo(3);
        assertThat(ledger.countSubmissions(Side.AGAINST)).isEqualTo(1);
        assertThat(ledger.entries()).extracting(RollEntry::getRollNumber).containsExactly(1, 2);
    }

    @Test
    @DisplayName("copies are independent of the original ledger")
    void copyIsIndependent() {
        RollLedger ledger = new RollLedger();
        ledger.add();
        RollLedger copy = ledger.copy();

        copy.toggleSubmission(0, Side.AGAINST, 35L);
        copy.add();

        assertThat(ledger.size()).isEqualTo(1);
        assertThat(ledger.get(0).getSubmissionsAgainst()).isEmpty();
    }
}
