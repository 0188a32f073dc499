package com.dorkroom.catalog.similarity;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Scores a query against a record's {@link SearchText} under a {@link ScoringPolicy}.
 *
 * <p>Five-signal formula:
 * {@code w1*orderInsensitive + w2*substring + w3*raw + w4*set} over the primary text, plus
 * {@code w5*substring} over the secondary text. Two-signal formula: the order-insensitive
 * ratio of the combined text, replaced by {@code substring * discount} when the substring
 * ratio is above the cutoff and that is higher. Bonuses are added on top in both modes.</p>
 */
public class CompositeSimilarityScorer {
    private static final Logger log = LoggerFactory.getLogger(CompositeSimilarityScorer.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final StringSimilarity similarity;

    public CompositeSimilarityScorer() {
        this(new RatioStringSimilarity());
    }

    public CompositeSimilarityScorer(StringSimilarity similarity) {
        this.similarity = Objects.requireNonNull(similarity, "similarity");
    }

    /**
     * Returns false when the underlying similarity capability cannot score.
     */
    public boolean isAvailable() {
        return similarity.isAvailable();
    }

    /**
     * Computes the final score of one record.
     */
    public double score(String query, SearchText text, ScoringPolicy policy) {
        return computeWithBreakdown(query, text, policy).totalScore();
    }

    /**
     * Computes the score with each signal and the bonus reported separately.
     */
    public ScoreBreakdown computeWithBreakdown(String query, SearchText text, ScoringPolicy policy) {
        String q = query == null ? "" : query.toLowerCase(Locale.ROOT).trim();

        ScoreBreakdown breakdown = policy.getMode() == ScoringMode.TWO_SIGNAL
                ? twoSignal(q, text, policy)
                : fiveSignal(q, text, policy);

        log.debug("Fuzzy score for '{}' vs '{}': {}", q, text.primary(), breakdown);
        return breakdown;
    }

    private ScoreBreakdown fiveSignal(String q, SearchText text, ScoringPolicy policy) {
        String primary = text.primary();
        double orderInsensitive = similarity.orderInsensitiveRatio(q, primary);
        double substring = similarity.substringRatio(q, primary);
        double raw = similarity.rawRatio(q, primary);
        double set = similarity.setRatio(q, primary);
        double secondarySubstring = text.secondary().isEmpty()
                ? 0.0
                : similarity.substringRatio(q, text.secondary());

        SignalWeights w = policy.getWeights();
        double weighted = w.orderInsensitiveWeight() * orderInsensitive
                + w.substringWeight() * substring
                + w.rawWeight() * raw
                + w.setWeight() * set
                + w.secondarySubstringWeight() * secondarySubstring;

        double bonus = bonus(q, bonusText(text, policy), policy);
        return new ScoreBreakdown(orderInsensitive, substring, raw, set, secondarySubstring,
                weighted, bonus);
    }

    private ScoreBreakdown twoSignal(String q, SearchText text, ScoringPolicy policy) {
        String combined = text.combined();
        double orderInsensitive = similarity.orderInsensitiveRatio(q, combined);
        double substring = similarity.substringRatio(q, combined);

        double base = orderInsensitive;
        if (substring > policy.getStrongSubstringCutoff()) {
            base = Math.max(orderInsensitive, substring * policy.getSubstringDiscount());
        }

        double bonus = bonus(q, bonusText(text, policy), policy);
        return new ScoreBreakdown(orderInsensitive, substring, 0.0, 0.0, 0.0, base, bonus);
    }

    private static String bonusText(SearchText text, ScoringPolicy policy) {
        return policy.getBonusScope() == BonusScope.COMBINED ? text.combined() : text.primary();
    }

    /**
     * Exact-word bonus for every query word found as a whole word in the text, plus a
     * prefix bonus when the text (or else one of its words) starts with the query.
     */
    private static double bonus(String q, String text, ScoringPolicy policy) {
        double bonus = 0.0;
        String[] textWords = split(text);

        if (policy.getExactWordBonus() > 0) {
            Set<String> wordSet = new HashSet<>();
            for (String word : textWords) {
                wordSet.add(word);
            }
            int exactWordMatches = 0;
            for (String queryWord : split(q)) {
                if (wordSet.contains(queryWord)) {
                    exactWordMatches++;
                }
            }
            bonus += exactWordMatches * policy.getExactWordBonus();
        }

        if (text.startsWith(q)) {
            bonus += policy.getPrefixBonus();
        } else {
            for (String word : textWords) {
                if (word.startsWith(q)) {
                    bonus += policy.getWordPrefixBonus();
                    break;
                }
            }
        }
        return bonus;
    }

    private static String[] split(String s) {
        String trimmed = s.trim();
        return trimmed.isEmpty() ? new String[0] : WHITESPACE.split(trimmed);
    }

    /**
     * Per-signal scores behind one composite score. Signals a mode does not use are 0.
     */
    public record ScoreBreakdown(
            double orderInsensitiveScore,
            double substringScore,
            double rawScore,
            double setScore,
            double secondarySubstringScore,
            double weightedScore,
            double bonus
    ) {
        public double totalScore() {
            return weightedScore + bonus;
        }

        @Override
        public String toString() {
            return String.format(
                    "ScoreBreakdown{orderInsensitive=%.1f, substring=%.1f, raw=%.1f, set=%.1f, secondary=%.1f, weighted=%.2f, bonus=%.1f, total=%.2f}",
                    orderInsensitiveScore, substringScore, rawScore, setScore, secondarySubstringScore,
                    weightedScore, bonus, totalScore());
        }
    }
}
