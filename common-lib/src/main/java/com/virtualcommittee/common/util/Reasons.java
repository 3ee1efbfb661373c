package com.virtualcommittee.common.util;

import java.util.Locale;

/**
 * Formats tagged reasoning lines: {@code ✓} pass, {@code ~} borderline, {@code ✗} fail.
 * Numbers are always rendered with {@link Locale#ROOT}.
 */
public final class Reasons {

    public static final String PASS       = "✓";
    public static final String BORDERLINE = "~";
    public static final String FAIL       = "✗";

    private Reasons() {}

    public static String pass(String template, Object... args) {
        return tag(PASS, template, args);
    }

    public static String borderline(String template, Object... args) {
        return tag(BORDERLINE, template, args);
    }

    public static String fail(String template, Object... args) {
        return tag(FAIL, template, args);
    }

    private static String tag(String marker, String template, Object... args) {
        return marker + " " + String.format(Locale.ROOT, template, args);
    }
}
