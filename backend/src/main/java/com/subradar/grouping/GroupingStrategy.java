package com.subradar.grouping;

/**
 * How a record picks among existing groups that all score above the similarity threshold.
 */
public enum GroupingStrategy {
    /** First group in creation order wins. */
    FIRST_MATCH,
    /** Highest-scoring group wins; ties go to the earlier group. */
    BEST_MATCH
}
