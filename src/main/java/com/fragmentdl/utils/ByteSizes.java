package com.fragmentdl.utils;

import java.util.Locale;

public final class ByteSizes {

    private static final String[] UNITS = {"B", "KB", "MB", "GB", "TB"};

    private ByteSizes() {
    }

    /**
     * Formats a byte count with binary multiples, e.g. {@code 1536 -> "1.5 KB"}.
     */
    public static String format(double bytes) {
        if (bytes < 1024) {
            return String.format(Locale.ROOT, "%d B", (long) Math.max(0, bytes));
        }
        int unit = (int) Math.min(UNITS.length - 1, Math.floor(Math.log(bytes) / Math.log(1024)));
        double scaled = bytes / Math.pow(1024, unit);
        return String.format(Locale.ROOT, "%.2f %s", scaled, UNITS[unit]);
    }
}
