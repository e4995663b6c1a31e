package com.xammer.spectre.util;

import java.util.Locale;

public final class ByteSizes {

    private static final String[] UNITS = {"KB", "MB", "GB", "TB", "PB"};

    private ByteSizes() {
    }

    /** Binary units with two decimals, e.g. {@code 1536 -> "1.50 KB"}. */
    public static String format(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        long div = 1024;
        int exp = 0;
        for (long n = bytes / 1024; n >= 1024 && exp < UNITS.length - 1; n /= 1024) {
            div *= 1024;
            exp++;
        }
        return String.format(Locale.ROOT, "%.2f %s", (double) bytes / div, UNITS[exp]);
    }
}
