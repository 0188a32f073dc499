package com.dorkroom.catalog.resolve;

import com.dorkroom.catalog.core.model.ColorType;
import com.dorkroom.catalog.core.model.Dilution;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lenient parsers for free-text submission fields. None of them throw on bad input;
 * each documents the value it falls back to.
 */
public final class FreeTextParser {

    /**
     * Placeholder the submission form writes for an unanswered optional field.
     */
    public static final String NO_RESPONSE = "_No response_";

    private static final Set<String> NO_RESPONSE_VARIANTS = Set.of(
            NO_RESPONSE, "No response", "_no response_", "no response", "_No Response_", "No Response");

    // plain decimal or exponent notation; no type suffixes, hex or named values
    private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern BLANK_LINE_RUN = Pattern.compile("\\n\\s*\\n\\s*\\n+");
    private static final Pattern SPACE_RUN = Pattern.compile("[ \\t]+");

    private FreeTextParser() {
    }

    /**
     * Parses a push/pull value such as "+2", "-1" or "1.5". A leading plus is ignored,
     * fractions are truncated toward zero, and blank, unparseable or out-of-range text gives 0.
     */
    public static int parsePushPull(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        String cleaned = text.trim().replace("+", "").trim();
        return parseTruncated(cleaned).orElse(0);
    }

    /**
     * Maps a form selection to a color type. Anything unrecognised is black and white.
     */
    public static ColorType parseColorType(String text) {
        if (text == null) {
            return ColorType.BW;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (text.contains("Black & White") || lower.contains("bw")) {
            return ColorType.BW;
        }
        if (text.contains("Color Negative") || lower.contains("color")) {
            return ColorType.COLOR;
        }
        if (lower.contains("slide") || lower.contains("transparency")) {
            return ColorType.SLIDE;
        }
        return ColorType.BW;
    }

    /**
     * Parses one {@code Name:Ratio} dilution per line, numbering them from 1.
     * Lines without a colon are skipped; only the first colon splits.
     */
    public static List<Dilution> parseDilutions(String text) {
        List<Dilution> dilutions = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return dilutions;
        }
        int nextId = 1;
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            int colon = trimmed.indexOf(':');
            if (colon < 0) {
                continue;
            }
            dilutions.add(new Dilution(nextId++,
                    trimmed.substring(0, colon).trim(),
                    trimmed.substring(colon + 1).trim()));
        }
        return dilutions;
    }

    /**
     * Parses an optional whole number. Decimals are truncated; blank, invalid or out-of-range
     * text is empty.
     */
    public static Optional<Integer> parseOptionalInt(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        return parseTruncated(text.trim());
    }

    /**
     * Keeps the lines that are http or https URLs.
     */
    public static List<String> parseUrls(String text) {
        List<String> urls = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return urls;
        }
        for (String line : text.split("\n")) {
            String trimmed = line.trim();
            if (trimmed.startsWith("http://") || trimmed.startsWith("https://")) {
                urls.add(trimmed);
            }
        }
        return urls;
    }

    /**
     * Splits text into trimmed, non-empty lines. The {@link #NO_RESPONSE} placeholder counts as empty.
     */
    public static List<String> parseLines(String text) {
        List<String> lines = new ArrayList<>();
        String cleaned = clean(text);
        if (cleaned.isEmpty()) {
            return lines;
        }
        for (String line : cleaned.split("\n")) {
            String trimmed = line.trim();
            if (!trimmed.isEmpty()) {
                lines.add(trimmed);
            }
        }
        return lines;
    }

    /**
     * Trims the text and maps null or a "No response" placeholder (any of the form's spellings)
     * to the empty string. Runs of spaces and tabs collapse to one space and more than one
     * blank line collapses to a single blank line.
     */
    public static String clean(String text) {
        if (text == null) {
            return "";
        }
        String trimmed = text.trim();
        if (NO_RESPONSE_VARIANTS.contains(trimmed)) {
            return "";
        }
        String normalized = BLANK_LINE_RUN.matcher(trimmed).replaceAll("\n\n");
        normalized = SPACE_RUN.matcher(normalized).replaceAll(" ");
        return normalized.trim();
    }

    private static Optional<Integer> parseTruncated(String text) {
        if (!DECIMAL.matcher(text).matches()) {
            return Optional.empty();
        }
        double truncated = (long) Double.parseDouble(text);
        if (truncated < Integer.MIN_VALUE || truncated > Integer.MAX_VALUE) {
            return Optional.empty();
        }
        return Optional.of((int) truncated);
    }
}
