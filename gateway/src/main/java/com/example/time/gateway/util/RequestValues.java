package com.example.time.gateway.util;

/**
 * Checks and escapes client-supplied values before they reach headers or log lines.
 */
public final class RequestValues {

    private RequestValues() {
    }

    /**
     * True when {@code value} is non-empty and made only of visible ASCII characters,
     * so it can be written back as an HTTP header value unchanged.
     */
    public static boolean isHeaderSafe(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c < 0x21 || c > 0x7E) {
                return false;
            }
        }
        return true;
    }

    /**
     * Escapes control characters so a value cannot break or forge log lines.
     */
    public static String forLog(String value) {
        if (value == null) {
            return null;
        }
        StringBuilder escaped = null;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isISOControl(c)) {
                if (escaped == null) {
                    escaped = new StringBuilder(value.length() + 8).append(value, 0, i);
                }
                switch (c) {
                    case '\n':
                        escaped.append("\\n");
                        break;
                    case '\r':
                        escaped.append("\\r");
                        break;
                    case '\t':
                        escaped.append("\\t");
                        break;
                    default:
                        escaped.append(String.format("\\u%04x", (int) c));
                }
            } else if (escaped != null) {
                escaped.append(c);
            }
        }
        return escaped != null ? escaped.toString() : value;
    }
}
