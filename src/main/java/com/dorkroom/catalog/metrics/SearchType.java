package com.dorkroom.catalog.metrics;

/**
 * Tag value distinguishing exact substring searches from fuzzy ranked ones.
 */
public enum SearchType {
    EXACT,
    FUZZY
}
