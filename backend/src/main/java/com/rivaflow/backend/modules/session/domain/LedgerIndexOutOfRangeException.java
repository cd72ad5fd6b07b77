package com.rivaflow.backend.modules.session.domain;

/**
 * Raised when a ledger is addressed with an index it does not hold.
 * The ledger is left untouched when this is thrown.
 */
public class LedgerIndexOutOfRangeException extends IndexOutOfBoundsException {

    private final String ledger;
    private final int index;
    private final int size;

    public LedgerIndexOutOfRangeException(String ledger, int index, int size) {
        super(ledger + " index " + index + " out of range for size " + size);
        this.ledger = ledger;
        this.index = index;
        this.size = size;
    }

    static void check(String ledger, int index, int size) {
        if (index < 0 || index >= size) {
            throw new LedgerIndexOutOfRangeException(ledger, index, size);
        }
    }

    public String getLedger() {
        return ledger;
    }

    public int getIndex() {
        return index;
    }

    public int getSize() {
        return size;
    }
}
