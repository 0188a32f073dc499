package com.dorkroom.catalog.similarity;

import java.util.Locale;

/**
 * The lower-cased text a record is matched on.
 *
 * @param primary   the record's most identifying fields (e.g. brand and name)
 * @param secondary lower-priority fields (description, notes, referenced record names)
 */
public record SearchText(String primary, String secondary) {

    public SearchText {
        primary = primary == null ? "" : primary.toLowerCase(Locale.ROOT).trim();
        secondary = secondary == null ? "" : secondary.toLowerCase(Locale.ROOT).trim();
    }

    /**
     * Primary and secondary text joined by a single space.
     */
    public String combined() {
        if (secondary.isEmpty()) {
            return primary;
        }
        return primary.isEmpty() ? secondary : primary + " " + secondary;
    }
}
