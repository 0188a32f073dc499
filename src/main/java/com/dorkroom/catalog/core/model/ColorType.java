package com.dorkroom.catalog.core.model;

import java.util.Locale;

/**
 * Film emulsion type as stored in the catalog data files.
 */
public enum ColorType {
    BW("bw"),
    COLOR("color"),
    SLIDE("slide");

    private final String value;

    ColorType(String value) {
        this.value = value;
    }

    /**
     * Returns the wire value ({@code bw}, {@code color} or {@code slide}).
     */
    public String getValue() {
        return value;
    }

    /**
     * Parses a wire value case-insensitively.
     *
     * @throws IllegalArgumentException if the value is not a known color type
     */
    public static ColorType fromValue(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (ColorType type : values()) {
                if (type.value.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown color type: '" + value + "'");
    }
}
