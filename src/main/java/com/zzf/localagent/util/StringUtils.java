package com.zzf.localagent.util;

public final class StringUtils {
    private StringUtils() {}

    public static String truncate(String s, int maxChars) {
        if (s == null) {
            return "";
        }
        return s.length() <= maxChars ? s : s.substring(0, maxChars);
    }

    public static boolean isBlank(String s) {
        return s == null || s.trim().isEmpty();
    }

    /**
     * Message of a throwable for persisting as error text; falls back to the class name
     * when the message is empty.
     */
    public static String errorText(Throwable t) {
        if (t == null) {
            return "";
        }
        String msg = t.getMessage();
        if (isBlank(msg)) {
            return t.getClass().getSimpleName();
        }
        return msg;
    }
}
