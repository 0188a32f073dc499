package com.dorkroom.catalog.similarity;

/**
 * Stand-in used when no similarity capability is configured.
 * Reports itself unavailable; every ratio is 0.
 */
public class UnavailableStringSimilarity implements StringSimilarity {

    @Override
    public double orderInsensitiveRatio(String s1, String s2) {
        return 0.0;
    }

    @Override
    public double substringRatio(String s1, String s2) {
        return 0.0;
    }

    @Override
    public double rawRatio(String s1, String s2) {
        return 0.0;
    }

    @Override
    public double setRatio(String s1, String s2) {
        return 0.0;
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
