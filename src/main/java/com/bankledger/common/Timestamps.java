package com.bankledger.common;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Timestamp formatting shared by account creation and transaction records.
 * Stored timestamps use second precision in local time: {@code yyyy-MM-dd HH:mm:ss}.
 */
public final class Timestamps {

    public static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private Timestamps() {
    }

    public static String now(Clock clock) {
        return LocalDateTime.now(clock).format(FORMAT);
    }
}
