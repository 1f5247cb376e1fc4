package com.subradar.common;

import org.springframework.stereotype.Component;

/**
 * Edit-distance ratio over insertions and deletions only:
 * {@code 100 * (1 - indel(a, b) / (len(a) + len(b)))}, rounded. "netflix" vs "netflixcom" scores 82.
 */
@Component
public class IndelRatioMatcher implements SimilarityMatcher {

    @Override
    public int similarity(String a, String b) {
        String left = a != null ? a : "";
        String right = b != null ? b : "";
        int total = left.length() + right.length();
        if (total == 0) {
            return 100;
        }
        if (left.equals(right)) {
            return 100;
        }
        int lcs = longestCommonSubsequence(left, right);
        // indel distance = total - 2 * lcs
        return (int) Math.round(200.0 * lcs / total);
    }

    static int longestCommonSubsequence(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) {
            return 0;
        }
        int[] prev = new int[b.length() + 1];
        int[] curr = new int[b.length() + 1];
        for (int i = 1; i <= a.length(); i++) {
            char ca = a.charAt(i - 1);
            for (int j = 1; j <= b.length(); j++) {
                if (ca == b.charAt(j - 1)) {
                    curr[j] = prev[j - 1] + 1;
                } else {
                    curr[j] = Math.max(prev[j], curr[j - 1]);
                }
            }
            int[] tmp = prev;
            prev = curr;
            curr = tmp;
        }
        return prev[b.length()];
    }
}
