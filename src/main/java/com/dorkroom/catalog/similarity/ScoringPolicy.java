package com.dorkroom.catalog.similarity;

import java.util.Objects;

/**
 * Everything that decides how a record is scored against a fuzzy query:
 * the signal combination, weights, bonuses and the retention threshold.
 *
 * <p>Presets cover the catalog's standard searches:</p>
 * <ul>
 *   <li>{@link #filmsAndDevelopers()}: five signals, bonuses on the primary text, keep above 40</li>
 *   <li>{@link #combinations()}: five signals, bonuses on primary + secondary text, keep above 35</li>
 *   <li>{@link #twoSignal(double)}: the reduced configuration, no bonuses, keep at or above the threshold</li>
 * </ul>
 */
public final class ScoringPolicy {

    private static final double FILM_DEVELOPER_THRESHOLD = 40.0;
    private static final double COMBINATION_THRESHOLD = 35.0;
    private static final double DEFAULT_TWO_SIGNAL_THRESHOLD = 60.0;
    private static final double DEFAULT_EXACT_WORD_BONUS = 10.0;
    private static final double DEFAULT_PREFIX_BONUS = 15.0;
    private static final double DEFAULT_WORD_PREFIX_BONUS = 10.0;
    private static final double DEFAULT_STRONG_SUBSTRING_CUTOFF = 80.0;
    private static final double DEFAULT_SUBSTRING_DISCOUNT = 0.9;

    private final ScoringMode mode;
    private final SignalWeights weights;
    private final double threshold;
    private final boolean thresholdInclusive;
    private final double exactWordBonus;
    private final double prefixBonus;
    private final double wordPrefixBonus;
    private final BonusScope bonusScope;
    private final double strongSubstringCutoff;
    private final double substringDiscount;

    private ScoringPolicy(Builder builder) {
        this.mode = builder.mode;
        this.weights = builder.weights;
        this.threshold = builder.threshold;
        this.thresholdInclusive = builder.thresholdInclusive;
        this.exactWordBonus = builder.exactWordBonus;
        this.prefixBonus = builder.prefixBonus;
        this.wordPrefixBonus = builder.wordPrefixBonus;
        this.bonusScope = builder.bonusScope;
        this.strongSubstringCutoff = builder.strongSubstringCutoff;
        this.substringDiscount = builder.substringDiscount;
    }

    public ScoringMode getMode() {
        return mode;
    }

    public SignalWeights getWeights() {
        return weights;
    }

    public double getThreshold() {
        return threshold;
    }

    public boolean isThresholdInclusive() {
        return thresholdInclusive;
    }

    public double getExactWordBonus() {
        return exactWordBonus;
    }

    public double getPrefixBonus() {
        return prefixBonus;
    }

    public double getWordPrefixBonus() {
        return wordPrefixBonus;
    }

    public BonusScope getBonusScope() {
        return bonusScope;
    }

    public double getStrongSubstringCutoff() {
        return strongSubstringCutoff;
    }

    public double getSubstringDiscount() {
        return substringDiscount;
    }

    /**
     * Returns true if a record with this score is kept.
     */
    public boolean accepts(double score) {
        return thresholdInclusive ? score >= threshold : score > threshold;
    }

    /**
     * Five-signal policy used for film and developer searches.
     */
    public static ScoringPolicy filmsAndDevelopers() {
        return builder().build();
    }

    /**
     * Five-signal policy used for combination searches. Bonuses also look at the
     * film and developer names pulled into the secondary text.
     */
    public static ScoringPolicy combinations() {
        return builder()
                .threshold(COMBINATION_THRESHOLD)
                .bonusScope(BonusScope.COMBINED)
                .build();
    }

    /**
     * Two-signal policy with the default threshold of 60.
     */
    public static ScoringPolicy twoSignal() {
        return twoSignal(DEFAULT_TWO_SIGNAL_THRESHOLD);
    }

    /**
     * Two-signal policy with a custom threshold (inclusive).
     */
    public static ScoringPolicy twoSignal(double threshold) {
        return builder()
                .mode(ScoringMode.TWO_SIGNAL)
                .threshold(threshold)
                .thresholdInclusive(true)
                .exactWordBonus(0)
                .prefixBonus(0)
                .wordPrefixBonus(0)
                .bonusScope(BonusScope.COMBINED)
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ScoringMode mode = ScoringMode.FIVE_SIGNAL;
        private SignalWeights weights = SignalWeights.defaultWeights();
        private double threshold = FILM_DEVELOPER_THRESHOLD;
        private boolean thresholdInclusive = false;
        private double exactWordBonus = DEFAULT_EXACT_WORD_BONUS;
        private double prefixBonus = DEFAULT_PREFIX_BONUS;
        private double wordPrefixBonus = DEFAULT_WORD_PREFIX_BONUS;
        private BonusScope bonusScope = BonusScope.PRIMARY;
        private double strongSubstringCutoff = DEFAULT_STRONG_SUBSTRING_CUTOFF;
        private double substringDiscount = DEFAULT_SUBSTRING_DISCOUNT;

        public Builder mode(ScoringMode mode) {
            this.mode = Objects.requireNonNull(mode, "mode");
            return this;
        }

        public Builder weights(SignalWeights weights) {
            this.weights = Objects.requireNonNull(weights, "weights");
            return this;
        }

        public Builder threshold(double threshold) {
            if (threshold < 0) {
                throw new IllegalArgumentException("threshold must be non-negative");
            }
            this.threshold = threshold;
            return this;
        }

        public Builder thresholdInclusive(boolean thresholdInclusive) {
            this.thresholdInclusive = thresholdInclusive;
            return this;
        }

        public Builder exactWordBonus(double exactWordBonus) {
            this.exactWordBonus = requireNonNegative(exactWordBonus, "exactWordBonus");
            return this;
        }

        public Builder prefixBonus(double prefixBonus) {
            this.prefixBonus = requireNonNegative(prefixBonus, "prefixBonus");
            return this;
        }

        public Builder wordPrefixBonus(double wordPrefixBonus) {
            this.wordPrefixBonus = requireNonNegative(wordPrefixBonus, "wordPrefixBonus");
            return this;
        }

        public Builder bonusScope(BonusScope bonusScope) {
            this.bonusScope = Objects.requireNonNull(bonusScope, "bonusScope");
            return this;
        }

        public Builder strongSubstringCutoff(double strongSubstringCutoff) {
            this.strongSubstringCutoff = requireNonNegative(strongSubstringCutoff, "strongSubstringCutoff");
            return this;
        }

        public Builder substringDiscount(double substringDiscount) {
            if (substringDiscount < 0.0 || substringDiscount > 1.0) {
                throw new IllegalArgumentException("substringDiscount must be between 0.0 and 1.0");
            }
            this.substringDiscount = substringDiscount;
            return this;
        }

        public ScoringPolicy build() {
            return new ScoringPolicy(this);
        }

        private static double requireNonNegative(double value, String name) {
            if (value < 0) {
                throw new IllegalArgumentException(name + " must be non-negative");
            }
            return value;
        }
    }

    @Override
    public String toString() {
        return "ScoringPolicy{" +
                "mode=" + mode +
                ", weights=" + weights +
                ", threshold=" + threshold +
                ", thresholdInclusive=" + thresholdInclusive +
                ", exactWordBonus=" + exactWordBonus +
                ", prefixBonus=" + prefixBonus +
                ", wordPrefixBonus=" + wordPrefixBonus +
                ", bonusScope=" + bonusScope +
                '}';
    }
}
