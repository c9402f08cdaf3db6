package com.storeflow.common.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Timestamps are stored as ISO-8601 strings with the store's local offset, so the first ten
 * characters are always the local calendar date and a prefix match selects one day.
 */
public final class IsoDates {

    private IsoDates() {
    }

    public static String now(Clock clock) {
        return OffsetDateTime.now(clock).truncatedTo(ChronoUnit.MILLIS).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    }

    public static LocalDate today(Clock clock) {
        return LocalDate.now(clock);
    }

    public static boolean isOnDate(String isoDateTime, LocalDate date) {
        return isoDateTime != null && isoDateTime.startsWith(date.toString());
    }
}
