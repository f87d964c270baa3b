package com.reelpilot.session.util;

import java.math.BigDecimal;

/**
 * Parses abbreviated counters as rendered by the app ("1.2K", "3M", "1,234", "12 345").
 */
public final class CountParser {

    private CountParser() {}

    public static Long parse(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.trim().replace(",", "").replace(" ", "").replace("\u00A0", "");
        if (text.isEmpty()) {
            return null;
        }
        long multiplier = 1;
        char suffix = Character.toUpperCase(text.charAt(text.length() - 1));
        if (suffix == 'K') {
            multiplier = 1_000L;
        } else if (suffix == 'M') {
            multiplier = 1_000_000L;
        } else if (suffix == 'B') {
            multiplier = 1_000_000_000L;
        }
        if (multiplier > 1) {
            text = text.substring(0, text.length() - 1);
        }
        try {
            return new BigDecimal(text)
                .multiply(BigDecimal.valueOf(multiplier))
                .longValue();
        } catch (NumberFormatException e) {
            return null;
        }
    }

    public static long parseOrZero(String raw) {
        Long value = parse(raw);
        return value == null ? 0L : value;
    }
}
