package com.share_link_repair.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dotted-numeric version comparison. Each segment is compared as a number and the
 * shorter version is padded with zero segments, so {@code 16.0} equals {@code 16.0.0}.
 */
public final class VersionUtil {

    private static final Pattern LEADING_DIGITS = Pattern.compile("^\\s*(\\d+)");

    private VersionUtil() {
    }

    public static int compare(String left, String right) {
        long[] a = parse(left);
        long[] b = parse(right);
        int length = Math.max(a.length, b.length);
        for (int i = 0; i < length; i++) {
            long x = i < a.length ? a[i] : 0L;
            long y = i < b.length ? b[i] : 0L;
            if (x != y) {
                return Long.compare(x, y);
            }
        }
        return 0;
    }

    public static boolean isLessThan(String version, String other) {
        return compare(version, other) < 0;
    }

    public static boolean isLessThanOrEqual(String version, String other) {
        return compare(version, other) <= 0;
    }

    static long[] parse(String version) {
        if (version == null || version.isBlank()) {
            return new long[0];
        }
        String[] segments = version.trim().split("\\.");
        long[] parsed = new long[segments.length];
        for (int i = 0; i < segments.length; i++) {
            // "0beta" -> 0, "rc" -> 0
            Matcher matcher = LEADING_DIGITS.matcher(segments[i]);
            parsed[i] = matcher.find() ? Long.parseLong(matcher.group(1)) : 0L;
        }
        return parsed;
    }
}
