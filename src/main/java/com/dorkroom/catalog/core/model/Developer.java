package com.dorkroom.catalog.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A film or paper developer and the dilutions it owns.
 * (manufacturer, name) identifies it within a catalog.
 */
public final class Developer {
    private final String id;
    private final String name;
    private final String manufacturer;
    private final String type;
    private final FilmOrPaper filmOrPaper;
    private final List<Dilution> dilutions;
    private final Integer workingLifeHours;
    private final Integer stockLifeMonths;
    private final String notes;
    private final String mixingInstructions;
    private final String safetyNotes;
    private final List<String> datasheetUrls;
    private final boolean discontinued;

    private Developer(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.manufacturer = builder.manufacturer;
        this.type = builder.type;
        this.filmOrPaper = builder.filmOrPaper;
        this.dilutions = List.copyOf(builder.dilutions);
        this.workingLifeHours = builder.workingLifeHours;
        this.stockLifeMonths = builder.stockLifeMonths;
        this.notes = builder.notes;
        this.mixingInstructions = builder.mixingInstructions;
        this.safetyNotes = builder.safetyNotes;
        this.datasheetUrls = List.copyOf(builder.datasheetUrls);
        this.discontinued = builder.discontinued;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getManufacturer() {
        return manufacturer;
    }

    public String getType() {
        return type;
    }

    public FilmOrPaper getFilmOrPaper() {
        return filmOrPaper;
    }

    public List<Dilution> getDilutions() {
        return dilutions;
    }

    /**
     * Looks up one of this developer's dilutions by id.
     */
    public Optional<Dilution> getDilution(int dilutionId) {
        for (Dilution dilution : dilutions) {
            if (dilution.id() == dilutionId) {
                return Optional.of(dilution);
            }
        }
        return Optional.empty();
    }

    /**
     * Returns the first dilution whose name or ratio text equals the label, ignoring case.
     */
    public Optional<Dilution> findDilutionByLabel(String label) {
        for (Dilution dilution : dilutions) {
            if (dilution.matchesLabel(label)) {
                return Optional.of(dilution);
            }
        }
        return Optional.empty();
    }

    public Optional<Integer> getWorkingLifeHours() {
        return Optional.ofNullable(workingLifeHours);
    }

    public Optional<Integer> getStockLifeMonths() {
        return Optional.ofNullable(stockLifeMonths);
    }

    public Optional<String> getNotes() {
        return Optional.ofNullable(notes);
    }

    public Optional<String> getMixingInstructions() {
        return Optional.ofNullable(mixingInstructions);
    }

    public Optional<String> getSafetyNotes() {
        return Optional.ofNullable(safetyNotes);
    }

    public List<String> getDatasheetUrls() {
        return datasheetUrls;
    }

    public boolean isDiscontinued() {
        return discontinued;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Developer developer = (Developer) o;
        return Objects.equals(id, developer.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Developer{" +
                "id='" + id + '\'' +
                ", manufacturer='" + manufacturer + '\'' +
                ", name='" + name + '\'' +
                ", filmOrPaper=" + filmOrPaper +
                ", dilutions=" + dilutions.size() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String name;
        private String manufacturer;
        private String type;
        private FilmOrPaper filmOrPaper;
        private List<Dilution> dilutions = List.of();
        private Integer workingLifeHours;
        private Integer stockLifeMonths;
        private String notes;
        private String mixingInstructions;
        private String safetyNotes;
        private List<String> datasheetUrls = List.of();
        private boolean discontinued;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder manufacturer(String manufacturer) {
            this.manufacturer = manufacturer;
            return this;
        }

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder filmOrPaper(FilmOrPaper filmOrPaper) {
            this.filmOrPaper = filmOrPaper;
            return this;
        }

        public Builder dilutions(List<Dilution> dilutions) {
            this.dilutions = dilutions != null ? dilutions : List.of();
            return this;
        }

        public Builder workingLifeHours(Integer workingLifeHours) {
            this.workingLifeHours = workingLifeHours;
            return this;
        }

        public Builder stockLifeMonths(Integer stockLifeMonths) {
            this.stockLifeMonths = stockLifeMonths;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Builder mixingInstructions(String mixingInstructions) {
            this.mixingInstructions = mixingInstructions;
            return this;
        }

        public Builder safetyNotes(String safetyNotes) {
            this.safetyNotes = safetyNotes;
            return this;
        }

        public Builder datasheetUrls(List<String> datasheetUrls) {
            this.datasheetUrls = datasheetUrls != null ? datasheetUrls : List.of();
            return this;
        }

        public Builder discontinued(boolean discontinued) {
            this.discontinued = discontinued;
            return this;
        }

        public Developer build() {
            RecordValidation.requireNonBlank(id, "id");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(manufacturer, "manufacturer is required");
            Objects.requireNonNull(type, "type is required");
            Objects.requireNonNull(filmOrPaper, "filmOrPaper is required");

            Set<Integer> dilutionIds = new HashSet<>();
            for (Dilution dilution : dilutions) {
                if (!dilutionIds.add(dilution.id())) {
                    throw new IllegalArgumentException(
                            "Duplicate dilution id " + dilution.id() + " in developer " + id);
                }
            }
            return new Developer(this);
        }
    }
}
