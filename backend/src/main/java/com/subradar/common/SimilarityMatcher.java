package com.subradar.common;

/**
 * Scores how alike two normalized merchant keys are.
 */
public interface SimilarityMatcher {

    /**
     * @return score in [0, 100]; symmetric, and 100 for equal inputs
     */
    int similarity(String a, String b);

    /**
     * True when the score is strictly above the threshold.
     */
    default boolean matches(String a, String b, int threshold) {
        return similarity(a, b) > threshold;
    }
}
