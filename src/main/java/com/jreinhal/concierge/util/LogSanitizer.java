package com.jreinhal.concierge.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\p{Cntrl}&&[^\t]]");
    private static final int MAX_LENGTH = 256;

    private LogSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("_");
        if (cleaned.length() > MAX_LENGTH) {
            return cleaned.substring(0, MAX_LENGTH) + "...";
        }
        return cleaned;
    }
}
