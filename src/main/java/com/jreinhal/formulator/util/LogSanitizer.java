package com.jreinhal.formulator.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    // Control characters enable log forging
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");

    private LogSanitizer() {
    }

    /**
     * Length and hash of a problem statement; the text itself never reaches the log.
     */
    public static String problemSummary(String problem) {
        if (problem == null) {
            return "[len=0,id=none]";
        }
        int len = problem.length();
        String id = Integer.toHexString(problem.hashCode());
        return "[len=" + len + ",id=" + id + "]";
    }

    /**
     * Strip control characters from model output before it enters log output.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        return CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
    }

    /**
     * First {@code max} characters of {@code value}; null becomes empty.
     */
    public static String truncate(String value, int max) {
        if (value == null) {
            return "";
        }
        return value.length() > max ? value.substring(0, max) : value;
    }
}
