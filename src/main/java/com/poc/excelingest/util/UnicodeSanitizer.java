package com.poc.excelingest.util;

/**
 * Cleans cell text before it is stored: unpaired surrogates and non-characters become U+FFFD,
 * control characters other than tab, line feed and carriage return are dropped.
 */
public final class UnicodeSanitizer {

    public static final char REPLACEMENT = '\uFFFD';

    private UnicodeSanitizer() {
    }

    public static String sanitize(String value) {
        if (value == null || value.isEmpty()) {
            return value;
        }
        StringBuilder out = null;
        int length = value.length();
        for (int i = 0; i < length; i++) {
            char c = value.charAt(i);
            String replacement = null;
            boolean keep = true;

            if (Character.isHighSurrogate(c)) {
                if (i + 1 < length && Character.isLowSurrogate(value.charAt(i + 1))) {
                    if (out != null) {
                        out.append(c).append(value.charAt(i + 1));
                    }
                    i++;
                    continue;
                }
                replacement = String.valueOf(REPLACEMENT);
            } else if (Character.isLowSurrogate(c) || c == '\uFFFE' || c == '\uFFFF') {
                replacement = String.valueOf(REPLACEMENT);
            } else if (Character.isISOControl(c) && c != '\t' && c != '\n' && c != '\r') {
                keep = false;
            }

            if (replacement == null && keep) {
                if (out != null) {
                    out.append(c);
                }
                continue;
            }
            if (out == null) {
                out = new StringBuilder(length);
                out.append(value, 0, i);
            }
            if (replacement != null) {
                out.append(replacement);
            }
        }
        return out == null ? value : out.toString();
    }
}
