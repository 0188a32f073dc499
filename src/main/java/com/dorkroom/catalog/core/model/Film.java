package com.dorkroom.catalog.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A film stock. Immutable once built; (brand, name) identifies it within a catalog.
 */
public final class Film {
    private final String id;
    private final String brand;
    private final String name;
    private final double isoSpeed;
    private final ColorType colorType;
    private final String description;
    private final boolean discontinued;
    private final List<String> manufacturerNotes;
    private final String grainStructure;
    private final String reciprocityFailure;
    private final String staticImageUrl;
    private final String dateAdded;

    private Film(Builder builder) {
        this.id = builder.id;
        this.brand = builder.brand;
        this.name = builder.name;
        this.isoSpeed = builder.isoSpeed;
        this.colorType = builder.colorType;
        this.description = builder.description;
        this.discontinued = builder.discontinued;
        this.manufacturerNotes = List.copyOf(builder.manufacturerNotes);
        this.grainStructure = builder.grainStructure;
        this.reciprocityFailure = builder.reciprocityFailure;
        this.staticImageUrl = builder.staticImageUrl;
        this.dateAdded = builder.dateAdded;
    }

    public String getId() {
        return id;
    }

    public String getBrand() {
        return brand;
    }

    public String getName() {
        return name;
    }

    /**
     * Returns "brand name", the form users type and the catalog displays.
     */
    public String getDisplayName() {
        return brand + " " + name;
    }

    public double getIsoSpeed() {
        return isoSpeed;
    }

    public ColorType getColorType() {
        return colorType;
    }

    public Optional<String> getDescription() {
        return Optional.ofNullable(description);
    }

    public boolean isDiscontinued() {
        return discontinued;
    }

    public List<String> getManufacturerNotes() {
        return manufacturerNotes;
    }

    public Optional<String> getGrainStructure() {
        return Optional.ofNullable(grainStructure);
    }

    public Optional<String> getReciprocityFailure() {
        return Optional.ofNullable(reciprocityFailure);
    }

    public Optional<String> getStaticImageUrl() {
        return Optional.ofNullable(staticImageUrl);
    }

    public Optional<String> getDateAdded() {
        return Optional.ofNullable(dateAdded);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Film film = (Film) o;
        return Objects.equals(id, film.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Film{" +
                "id='" + id + '\'' +
                ", brand='" + brand + '\'' +
                ", name='" + name + '\'' +
                ", isoSpeed=" + isoSpeed +
                ", colorType=" + colorType +
                ", discontinued=" + discontinued +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String brand;
        private String name;
        private double isoSpeed;
        private ColorType colorType;
        private String description;
        private boolean discontinued;
        private List<String> manufacturerNotes = List.of();
        private String grainStructure;
        private String reciprocityFailure;
        private String staticImageUrl;
        private String dateAdded;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder brand(String brand) {
            this.brand = brand;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder isoSpeed(double isoSpeed) {
            this.isoSpeed = isoSpeed;
            return this;
        }

        public Builder colorType(ColorType colorType) {
            this.colorType = colorType;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder discontinued(boolean discontinued) {
            this.discontinued = discontinued;
            return this;
        }

        public Builder manufacturerNotes(List<String> manufacturerNotes) {
            this.manufacturerNotes = manufacturerNotes != null ? manufacturerNotes : List.of();
            return this;
        }

        public Builder grainStructure(String grainStructure) {
            this.grainStructure = grainStructure;
            return this;
        }

        public Builder reciprocityFailure(String reciprocityFailure) {
            this.reciprocityFailure = reciprocityFailure;
            return this;
        }

        public Builder staticImageUrl(String staticImageUrl) {
            this.staticImageUrl = staticImageUrl;
            return this;
        }

        public Builder dateAdded(String dateAdded) {
            this.dateAdded = dateAdded;
            return this;
        }

        public Film build() {
            RecordValidation.requireNonBlank(id, "id");
            Objects.requireNonNull(brand, "brand is required");
            Objects.requireNonNull(name, "name is required");
            Objects.requireNonNull(colorType, "colorType is required");
            if (!(isoSpeed > 0)) {
                throw new IllegalArgumentException("isoSpeed must be positive, got " + isoSpeed);
            }
            return new Film(this);
        }
    }
}
