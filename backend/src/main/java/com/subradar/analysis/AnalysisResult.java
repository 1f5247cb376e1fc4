package com.subradar.analysis;

import com.subradar.common.MerchantNormalizer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered recurring groups plus the sum of their monthly costs.
 */
public record AnalysisResult(List<AnnotatedGroup> groups, BigDecimal totalMonthlySavings) {

    private static final AnalysisResult EMPTY = new AnalysisResult(List.of(), BigDecimal.ZERO);

    public AnalysisResult {
        groups = groups != null ? List.copyOf(groups) : List.of();
        totalMonthlySavings = totalMonthlySavings != null ? totalMonthlySavings : BigDecimal.ZERO;
    }

    public static AnalysisResult of(List<AnnotatedGroup> groups) {
        BigDecimal total = BigDecimal.ZERO;
        for (AnnotatedGroup g : groups) {
            total = total.add(g.monthlyCost());
        }
        return new AnalysisResult(groups, total);
    }

    public static AnalysisResult empty() {
        return EMPTY;
    }

    /**
     * Drops groups whose key equals a normalized identifier (raw merchant text or group key) and
     * recomputes the total. Does not regroup.
     */
    public AnalysisResult excluding(Collection<String> identifiers) {
        if (identifiers == null || identifiers.isEmpty()) {
            return this;
        }
        Set<String> keys = new HashSet<>();
        for (String id : identifiers) {
            if (id != null) {
                keys.add(MerchantNormalizer.normalize(id));
            }
        }
        List<AnnotatedGroup> retained = new ArrayList<>();
        for (AnnotatedGroup g : groups) {
            if (!keys.contains(g.groupKey())) {
                retained.add(g);
            }
        }
        return of(retained);
    }
}
