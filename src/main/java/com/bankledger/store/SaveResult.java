package com.bankledger.store;

import lombok.Value;

import java.util.List;

/**
 * Outcome of writing the data files. Each file is written independently, so a save can
 * partially succeed; {@link #getFailures()} lists every file that could not be written.
 */
@Value
public class SaveResult {
    List<Failure> failures;

    public static SaveResult success() {
        return new SaveResult(List.of());
    }

    public static SaveResult of(List<Failure> failures) {
        return new SaveResult(List.copyOf(failures));
    }

    public boolean isSuccessful() {
        return failures.isEmpty();
    }

    @Value
    public static class Failure {
        String file;
        String reason;
    }
}
