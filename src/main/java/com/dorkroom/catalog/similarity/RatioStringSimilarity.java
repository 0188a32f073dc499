package com.dorkroom.catalog.similarity;

/**
 * Pure-Java {@link StringSimilarity} built from the four ratio algorithms.
 * Stateless and safe to share between threads.
 */
public class RatioStringSimilarity implements StringSimilarity {

    private final TokenSortSimilarity tokenSort;
    private final PartialRatioSimilarity partial;
    private final IndelSimilarity indel;
    private final TokenSetSimilarity tokenSet;

    public RatioStringSimilarity() {
        this.indel = new IndelSimilarity();
        this.tokenSort = new TokenSortSimilarity(indel);
        this.partial = new PartialRatioSimilarity(indel);
        this.tokenSet = new TokenSetSimilarity(indel);
    }

    @Override
    public double orderInsensitiveRatio(String s1, String s2) {
        return tokenSort.compute(s1, s2);
    }

    @Override
    public double substringRatio(String s1, String s2) {
        return partial.compute(s1, s2);
    }

    @Override
    public double rawRatio(String s1, String s2) {
        return indel.compute(s1, s2);
    }

    @Override
    public double setRatio(String s1, String s2) {
        return tokenSet.compute(s1, s2);
    }
}
