package com.dorkroom.catalog.core.model;

import java.util.Locale;

/**
 * What a developer is intended for.
 */
public enum FilmOrPaper {
    FILM("film"),
    PAPER("paper"),
    BOTH("both");

    private final String value;

    FilmOrPaper(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Parses a wire value case-insensitively.
     *
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static FilmOrPaper fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (FilmOrPaper target : values()) {
                if (target.value.equals(normalized)) {
                    return target;
                }
            }
        }
        throw new IllegalArgumentException("Unknown filmOrPaper value: '" + value + "'");
    }
}
