package com.bankledger.ledger;

import java.util.Arrays;
import java.util.Optional;

/**
 * Kinds of transactions recorded against an account.
 *
 * Each type has a fixed direction: credits raise the balance, debits lower it.
 * The label is the value persisted in the transaction log.
 */
public enum TransactionType {

    INITIAL_DEPOSIT("Initial Deposit", EntryType.CREDIT),

    DEPOSIT("Deposit", EntryType.CREDIT),

    WITHDRAWAL("Withdrawal", EntryType.DEBIT),

    /**
     * Outgoing side of a transfer; references the receiving account.
     */
    TRANSFER_SENT("Transfer Sent", EntryType.DEBIT),

    /**
     * Incoming side of a transfer; references the sending account.
     */
    TRANSFER_RECEIVED("Transfer Received", EntryType.CREDIT),

    /**
     * Interest credit; carries the rate that produced it.
     */
    INTEREST_APPLIED("Interest Applied", EntryType.CREDIT);

    private final String label;
    private final EntryType entryType;

    TransactionType(String label, EntryType entryType) {
        this.label = label;
        this.entryType = entryType;
    }

    public String getLabel() {
        return label;
    }

    public EntryType getEntryType() {
        return entryType;
    }

    public static Optional<TransactionType> fromLabel(String label) {
        return Arrays.stream(values())
            .filter(type -> type.label.equals(label))
            .findFirst();
    }

    public enum EntryType {
        DEBIT,
        CREDIT
    }
}
