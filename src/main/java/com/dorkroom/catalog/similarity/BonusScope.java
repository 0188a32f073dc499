package com.dorkroom.catalog.similarity;

/**
 * Which text the exact-word and prefix bonuses are checked against.
 */
public enum BonusScope {
    PRIMARY,
    COMBINED
}
