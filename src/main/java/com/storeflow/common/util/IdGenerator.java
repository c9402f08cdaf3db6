package com.storeflow.common.util;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.ThreadLocalRandom;

public final class IdGenerator {

    private static final DateTimeFormatter INVOICE_DATE = DateTimeFormatter.ofPattern("yyyyMMdd");

    private IdGenerator() {
    }

    public static String newId(String prefix) {
        return prefix + "_" + UUID.randomUUID().toString().replace("-", "");
    }

    /** Human facing invoice number, e.g. {@code INV-20261019-4F2A9C}. */
    public static String newInvoiceNumber(Clock clock) {
        String suffix = Integer.toHexString(ThreadLocalRandom.current().nextInt(0x100000, 0x1000000))
                .toUpperCase(Locale.ROOT);
        return "INV-" + LocalDate.now(clock).format(INVOICE_DATE) + "-" + suffix;
    }
}
