package com.dorkroom.catalog.core.model;

import java.util.Objects;

/**
 * A working-solution concentration of a developer, e.g. {@code 1+31}.
 * The id is only unique within the owning {@link Developer}.
 *
 * @param id       identifier within the owning developer
 * @param name     display label, e.g. "Stock" or "H"
 * @param dilution ratio text, e.g. "1+1"
 */
public record Dilution(int id, String name, String dilution) {

    public Dilution {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(dilution, "dilution is required");
    }

    /**
     * Returns true if the label equals this dilution's name or ratio text, ignoring case.
     */
    public boolean matchesLabel(String label) {
        if (label == null) {
            return false;
        }
        return name.equalsIgnoreCase(label) || dilution.equalsIgnoreCase(label);
    }
}
