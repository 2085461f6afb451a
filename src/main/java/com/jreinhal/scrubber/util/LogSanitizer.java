package com.jreinhal.scrubber.util;

import java.util.regex.Pattern;

public final class LogSanitizer {
    private static final Pattern CONTROL_CHARS = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F]");
    private static final int MAX_LOGGED_LENGTH = 120;

    private LogSanitizer() {
    }

    /**
     * Describes content without revealing it: length plus a short digest prefix.
     */
    public static String contentSummary(String content) {
        if (content == null) {
            return "[len=0,sha=none]";
        }
        return "[len=" + content.length() + ",sha=" + Digests.sha256Hex(content).substring(0, 8) + "]";
    }

    /**
     * Strip control characters from caller-supplied values (actor, justification, ids) before logging.
     */
    public static String sanitize(String value) {
        if (value == null) {
            return "";
        }
        String cleaned = CONTROL_CHARS.matcher(value).replaceAll("")
                .replace("\r", "")
                .replace("\n", " ");
        return cleaned.length() > MAX_LOGGED_LENGTH ? cleaned.substring(0, MAX_LOGGED_LENGTH) + "..." : cleaned;
    }
}
