package com.reelpilot.session.util;

import java.util.Locale;
import java.util.regex.Pattern;

public final class UsernameRules {
    public static final int MIN_LENGTH = 2;
    public static final int MAX_LENGTH = 24;
    private static final Pattern ALLOWED = Pattern.compile("[a-z0-9._]+");

    private UsernameRules() {}

    /**
     * Lowercases, trims and strips a leading '@'. Returns null for blank input.
     */
    public static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String value = raw.trim();
        if (value.startsWith("@")) {
            value = value.substring(1).trim();
        }
        if (value.isEmpty()) {
            return null;
        }
        return value.toLowerCase(Locale.ROOT);
    }

    public static boolean isValid(String normalized) {
        if (normalized == null) {
            return false;
        }
        if (normalized.length() < MIN_LENGTH || normalized.length() > MAX_LENGTH) {
            return false;
        }
        if (!ALLOWED.matcher(normalized).matches()) {
            return false;
        }
        if (normalized.startsWith(".") || normalized.endsWith(".")) {
            return false;
        }
        return !normalized.contains("..");
    }
}
