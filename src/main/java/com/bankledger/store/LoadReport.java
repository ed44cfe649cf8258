package com.bankledger.store;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * What a load produced, plus the diagnostics gathered while reading.
 */
@Value
@Builder(toBuilder = true)
public class LoadReport {
    LedgerTables tables;
    int skippedUserLines;
    int skippedAccountLines;

    /**
     * True when a file was missing, empty or unreadable (as opposed to merely holding bad lines).
     */
    boolean fileIssues;

    /**
     * True when users were loaded but none of them is an admin.
     */
    boolean adminMissing;

    /**
     * True when the tables were reset and a first admin was created.
     */
    boolean bootstrapped;

    @Singular
    List<String> warnings;

    public int getSkippedLines() {
        return skippedUserLines + skippedAccountLines;
    }
}
