package com.rice.recommender.util;

import java.util.Locale;

/**
 * Small text helpers shared by query normalization, lexicon building and display.
 */
public final class TextUtils {
    private TextUtils() {}

    /**
     * Lowercases and reduces text to letters and digits separated by single spaces.
     *
     * <p>Every other character (punctuation, hyphens, apostrophes, symbols) becomes a
     * separator, so {@code "Main-Dish!"} and {@code "main dish"} produce the same string.
     * Returns an empty string for {@code null}.
     */
    public static String simplify(String input) {
        if (input == null) return "";
        String s = input.replace('\u00A0', ' ').toLowerCase(Locale.ROOT);
        s = s.replaceAll("[^\\p{L}\\p{N}]+", " ");
        return s.trim();
    }

    /**
     * Returns a cleaned version of a recipe title for display.
     *
     * <p>Rules applied in order:
     * <ol>
     *   <li>Convert non-breaking spaces to regular spaces</li>
     *   <li>Collapse repeated whitespace</li>
     *   <li>Trim leading/trailing whitespace</li>
     *   <li>Strip leading/trailing separator garbage (dashes, pipes, colons, bullets)</li>
     * </ol>
     *
     * <p>If the result becomes empty, returns a trimmed original as a fallback.
     */
    public static String sanitizeTitle(String input) {
        if (input == null) return null;
        String s = input.replace('\u00A0', ' ');
        s = s.replaceAll("\\s+", " ").trim();

        // Two passes catch mixed sequences like "— |".
        for (int i = 0; i < 2; i++) {
            s = s.replaceAll("^(?:[\\s]*[\\-–—|:;·•]+[\\s]*)+", "");
            s = s.replaceAll("(?:[\\s]*[\\-–—|:;·•]+[\\s]*)+$", "");
        }

        s = s.trim();
        return s.isEmpty() ? input.trim() : s;
    }

    /**
     * Capitalizes the first letter of every word and lowercases the rest,
     * e.g. {@code "easy CHICKEN stir-fry"} becomes {@code "Easy Chicken Stir-Fry"}.
     */
    public static String titleCase(String input) {
        if (input == null || input.isEmpty()) return input;
        StringBuilder sb = new StringBuilder(input.length());
        boolean startOfWord = true;
        for (int i = 0; i < input.length(); i++) {
            char c = input.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(startOfWord ? Character.toUpperCase(c) : Character.toLowerCase(c));
                startOfWord = false;
            } else {
                sb.append(c);
                startOfWord = !Character.isDigit(c) && c != '\'';
            }
        }
        return sb.toString();
    }

    /** First {@code max} characters followed by "..." when longer. */
    public static String abbreviate(String input, int max) {
        if (input == null) return "";
        if (input.length() <= max) return input;
        return input.substring(0, Math.max(0, max)) + "...";
    }
}
