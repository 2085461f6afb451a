package com.jreinhal.scrubber.policy;

/**
 * Format-preserving mask: same length, separators kept, letters and digits replaced.
 */
public final class MaskFormatter {
    public static final char MASK_CHAR = '*';

    private MaskFormatter() {
    }

    public static String mask(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder masked = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            masked.append(Character.isLetterOrDigit(c) ? MASK_CHAR : c);
        }
        return masked.toString();
    }
}
