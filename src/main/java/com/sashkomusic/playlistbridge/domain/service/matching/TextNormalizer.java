package com.sashkomusic.playlistbridge.domain.service.matching;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Case, diacritic and punctuation insensitive comparison of song metadata.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern BRACKETED = Pattern.compile("\\s*(\\([^)]*\\)|\\[[^\\]]*\\])");
    private static final Pattern ARTIST_JOINERS = Pattern.compile(
            "\\b(feat|ft|featuring|with|vs|versus|and)\\b", Pattern.UNICODE_CHARACTER_CLASS);

    private static final String VERSION_WORDS =
            "(remaster|remastered|deluxe|extended|live|acoustic|demo|remix|edit|radio|single|album|bonus|version|ver|mix|feat|ft|featuring)";
    private static final Pattern TITLE_PAREN_SUFFIX = Pattern.compile(
            "\\s*\\((\\d{4}\\s+)?" + VERSION_WORDS + "\\b[^)]*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_BRACKET_SUFFIX = Pattern.compile(
            "\\s*\\[(\\d{4}\\s+)?" + VERSION_WORDS + "\\b[^\\]]*\\]", Pattern.CASE_INSENSITIVE);
    private static final Pattern TITLE_DASH_SUFFIX = Pattern.compile(
            "\\s+-\\s+(\\d{4}\\s+)?" + VERSION_WORDS + "\\b.*$", Pattern.CASE_INSENSITIVE);

    private TextNormalizer() {
    }

    public static String normalize(String value) {
        if (value == null) {
            return "";
        }
        String result = Normalizer.normalize(value.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        result = COMBINING_MARKS.matcher(result).replaceAll("");
        result = NON_WORD.matcher(result).replaceAll(" ");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Drops bracketed notes and collaboration joiners, so "Artist feat. Guest" compares
     * close to "Artist &amp; Guest".
     */
    public static String normalizeArtist(String artist) {
        if (artist == null) {
            return "";
        }
        String result = normalize(BRACKETED.matcher(artist).replaceAll(""));
        result = ARTIST_JOINERS.matcher(result).replaceAll(" ");
        return WHITESPACE.matcher(result).replaceAll(" ").trim();
    }

    /**
     * Drops release-variant suffixes such as "(Remastered 2011)", "[Live]" or "- Radio Edit".
     */
    public static String normalizeTitle(String title) {
        if (title == null) {
            return "";
        }
        String result = TITLE_PAREN_SUFFIX.matcher(title).replaceAll("");
        result = TITLE_BRACKET_SUFFIX.matcher(result).replaceAll("");
        result = TITLE_DASH_SUFFIX.matcher(result).replaceAll("");
        String normalized = normalize(result);
        return normalized.isEmpty() ? normalize(title) : normalized;
    }

    /**
     * Levenshtein similarity in [0, 1] of two already normalized strings.
     */
    public static double similarity(String a, String b) {
        if (a.equals(b)) {
            return 1.0;
        }
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        int distance = levenshtein(a, b);
        return 1.0 - (double) distance / Math.max(a.length(), b.length());
    }

    static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
