package com.tidefeed.core.util;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Display-only text cleanup for feed fields. This is not an HTML sanitizer.
 */
public final class TextUtils {
    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>", Pattern.DOTALL);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextUtils() {
    }

    public static String stripTags(String markup) {
        if (markup == null || markup.isEmpty()) {
            return "";
        }
        String text = TAG_PATTERN.matcher(markup).replaceAll(" ");
        text = text.replace("&nbsp;", " ")
                .replace("&lt;", "<")
                .replace("&gt;", ">")
                .replace("&quot;", "\"")
                .replace("&#39;", "'")
                .replace("&amp;", "&");
        return collapseWhitespace(text);
    }

    public static String collapseWhitespace(String text) {
        if (text == null) {
            return "";
        }
        return WHITESPACE.matcher(text).replaceAll(" ").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (text == null || text.length() <= maxLength) {
            return text == null ? "" : text;
        }
        return text.substring(0, Math.max(0, maxLength - 3)).trim() + "...";
    }

    public static boolean isHttpUrl(String value) {
        if (value == null) {
            return false;
        }
        String lowered = value.trim().toLowerCase(Locale.ROOT);
        return lowered.startsWith("http://") || lowered.startsWith("https://");
    }
}
