package com.dorkroom.catalog.core.model;

import java.util.Objects;
import java.util.Optional;

/**
 * A film + developer development recipe. References its film and developer by id;
 * the dilution is either one of the developer's own dilutions or free custom text.
 */
public final class Combination {
    private final String id;
    private final String name;
    private final String filmStockId;
    private final String developerId;
    private final Integer dilutionId;
    private final String customDilution;
    private final double temperatureF;
    private final double timeMinutes;
    private final double shootingIso;
    private final int pushPull;
    private final String agitationSchedule;
    private final String notes;

    private Combination(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.filmStockId = builder.filmStockId;
        this.developerId = builder.developerId;
        this.dilutionId = builder.dilutionId;
        this.customDilution = builder.customDilution;
        this.temperatureF = builder.temperatureF;
        this.timeMinutes = builder.timeMinutes;
        this.shootingIso = builder.shootingIso;
        this.pushPull = builder.pushPull;
        this.agitationSchedule = builder.agitationSchedule;
        this.notes = builder.notes;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getFilmStockId() {
        return filmStockId;
    }

    public String getDeveloperId() {
        return developerId;
    }

    public Optional<Integer> getDilutionId() {
        return Optional.ofNullable(dilutionId);
    }

    public Optional<String> getCustomDilution() {
        return Optional.ofNullable(customDilution);
    }

    public double getTemperatureF() {
        return temperatureF;
    }

    public double getTimeMinutes() {
        return timeMinutes;
    }

    public double getShootingIso() {
        return shootingIso;
    }

    public int getPushPull() {
        return pushPull;
    }

    public Optional<String> getAgitationSchedule() {
        return Optional.ofNullable(agitationSchedule);
    }

    public Optional<String> getNotes() {
        return Optional.ofNullable(notes);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Combination that = (Combination) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Combination{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", filmStockId='" + filmStockId + '\'' +
                ", developerId='" + developerId + '\'' +
                ", dilutionId=" + dilutionId +
                ", shootingIso=" + shootingIso +
                ", pushPull=" + pushPull +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Starts a builder pre-populated with the given combination's values.
     */
    public static Builder builder(Combination combination) {
        return new Builder()
                .id(combination.id)
                .name(combination.name)
                .filmStockId(combination.filmStockId)
                .developerId(combination.developerId)
                .dilutionId(combination.dilutionId)
                .customDilution(combination.customDilution)
                .temperatureF(combination.temperatureF)
                .timeMinutes(combination.timeMinutes)
                .shootingIso(combination.shootingIso)
                .pushPull(combination.pushPull)
                .agitationSchedule(combination.agitationSchedule)
                .notes(combination.notes);
    }

    public static class Builder {
        private String id;
        private String name;
        private String filmStockId;
        private String developerId;
        private Integer dilutionId;
        private String customDilution;
        private double temperatureF;
        private double timeMinutes;
        private double shootingIso;
        private int pushPull;
        private String agitationSchedule;
        private String notes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder filmStockId(String filmStockId) {
            this.filmStockId = filmStockId;
            return this;
        }

        public Builder developerId(String developerId) {
            this.developerId = developerId;
            return this;
        }

        public Builder dilutionId(Integer dilutionId) {
            this.dilutionId = dilutionId;
            return this;
        }

        public Builder customDilution(String customDilution) {
            this.customDilution = customDilution;
            return this;
        }

        public Builder temperatureF(double temperatureF) {
            this.temperatureF = temperatureF;
            return this;
        }

        public Builder timeMinutes(double timeMinutes) {
            this.timeMinutes = timeMinutes;
            return this;
        }

        public Builder shootingIso(double shootingIso) {
            this.shootingIso = shootingIso;
            return this;
        }

        public Builder pushPull(int pushPull) {
            this.pushPull = pushPull;
            return this;
        }

        public Builder agitationSchedule(String agitationSchedule) {
            this.agitationSchedule = agitationSchedule;
            return this;
        }

        public Builder notes(String notes) {
            this.notes = notes;
            return this;
        }

        public Combination build() {
            RecordValidation.requireNonBlank(id, "id");
            Objects.requireNonNull(name, "name is required");
            RecordValidation.requireNonBlank(filmStockId, "filmStockId");
            RecordValidation.requireNonBlank(developerId, "developerId");
            if (dilutionId != null && customDilution != null && !customDilution.isBlank()) {
                throw new IllegalArgumentException(
                        "dilutionId and customDilution are mutually exclusive (combination " + id + ")");
            }
            return new Combination(this);
        }
    }
}
