package com.subradar.analysis;

import com.subradar.domain.Frequency;
import com.subradar.domain.RecurringGroup;
import com.subradar.domain.TransactionRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FrequencyCostEstimatorTest {

    private final FrequencyCostEstimator estimator = new FrequencyCostEstimator();

    @Test
    @DisplayName("classifies 7, 14, 31 and 60 day gaps")
    void classifiesByMedianGap() {
        assertThat(FrequencyCostEstimator.classify(everyNDays(7, 4))).isEqualTo(Frequency.WEEKLY);
        assertThat(FrequencyCostEstimator.classify(everyNDays(14, 4))).isEqualTo(Frequency.BIWEEKLY);
        assertThat(FrequencyCostEstimator.classify(everyNDays(31, 4))).isEqualTo(Frequency.MONTHLY);
        assertThat(FrequencyCostEstimator.classify(everyNDays(60, 4))).isEqualTo(Frequency.IRREGULAR);
    }

    @Test
    @DisplayName("fewer than two dates is UNKNOWN; two dates still classify")
    void smallGroups() {
        assertThat(FrequencyCostEstimator.classify(List.of(LocalDate.parse("2024-01-05")))).isEqualTo(Frequency.UNKNOWN);
        assertThat(FrequencyCostEstimator.classify(List.of())).isEqualTo(Frequency.UNKNOWN);
        assertThat(FrequencyCostEstimator.classify(List.of(
                LocalDate.parse("2024-01-05"), LocalDate.parse("2024-02-05")))).isEqualTo(Frequency.MONTHLY);
    }

    @Test
    @DisplayName("median of an even gap count is the mean of the middle gaps; dates need not be sorted")
    void evenGapCountUnsorted() {
        List<LocalDate> dates = List.of(
                LocalDate.parse("2024-04-30"),
                LocalDate.parse("2024-01-01"),
                LocalDate.parse("2024-03-30"),
                LocalDate.parse("2024-01-29"),
                LocalDate.parse("2024-02-29"));
        // gaps 28, 31, 30, 31 -> median 30.5
        assertThat(FrequencyCostEstimator.medianGapDays(dates)).isEqualTo(30.5);
        assertThat(FrequencyCostEstimator.classify(dates)).isEqualTo(Frequency.MONTHLY);
    }

    @Test
    @DisplayName("monthly cost is the exact arithmetic mean of member amounts")
    void monthlyCostIsMean() {
        RecurringGroup g = new RecurringGroup("gym", TransactionRecord.of("2024-01-01", "Gym", "10.00"));
        g.add(TransactionRecord.of("2024-02-01", "Gym", "20.00"));
        g.add(TransactionRecord.of("2024-03-01", "Gym", "30.01"));

        FrequencyCostEstimator.Estimate estimate = estimator.estimate(g);

        BigDecimal expected = new BigDecimal("60.01").divide(BigDecimal.valueOf(3), MathContext.DECIMAL128);
        assertThat(estimate.monthlyCost()).isEqualByComparingTo(expected);
        assertThat(estimate.frequency()).isEqualTo(Frequency.MONTHLY);
    }

    @Test
    @DisplayName("estimate freezes the group; later adds are rejected")
    void estimateFreezesGroup() {
        RecurringGroup g = new RecurringGroup("netflix", TransactionRecord.of("2024-01-05", "Netflix", "15.49"));
        g.add(TransactionRecord.of("2024-02-05", "NETFLIX.COM", "15.49"));

        estimator.estimate(g);

        assertThat(g.isFrozen()).isTrue();
        assertThat(g.getFrequency()).isEqualTo(Frequency.MONTHLY);
        assertThat(g.getMonthlyCost()).isEqualByComparingTo("15.49");
        assertThatThrownBy(() -> g.add(TransactionRecord.of("2024-03-05", "Netflix", "15.49")))
                .isInstanceOf(IllegalStateException.class);
    }

    private static List<LocalDate> everyNDays(int n, int count) {
        List<LocalDate> dates = new ArrayList<>();
        LocalDate d = LocalDate.parse("2024-01-01");
        for (int i = 0; i < count; i++) {
            dates.add(d);
            d = d.plusDays(n);
        }
        return dates;
    }
}
