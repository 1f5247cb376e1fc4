package com.subradar.analysis;

import com.subradar.domain.Frequency;
import com.subradar.domain.RecurringGroup;
import com.subradar.domain.TransactionRecord;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Derives frequency and monthly cost for a group, then freezes it.
 * Monthly cost is the plain mean of member amounts, not normalized to the detected interval.
 */
@Component
public class FrequencyCostEstimator {

    public record Estimate(Frequency frequency, BigDecimal monthlyCost) {
    }

    public Estimate estimate(RecurringGroup group) {
        List<LocalDate> dates = new ArrayList<>(group.size());
        for (TransactionRecord member : group.getMembers()) {
            dates.add(member.date());
        }
        Frequency frequency = classify(dates);
        group.freeze(frequency);
        return new Estimate(frequency, group.getMonthlyCost());
    }

    /**
     * Median day gap between sorted dates: 6-8 WEEKLY, 12-16 BIWEEKLY, 27-32 MONTHLY, else IRREGULAR.
     * Fewer than two dates is UNKNOWN.
     */
    public static Frequency classify(List<LocalDate> dates) {
        if (dates == null || dates.size() < 2) {
            return Frequency.UNKNOWN;
        }
        double median = medianGapDays(dates);
        if (median >= 6 && median <= 8) {
            return Frequency.WEEKLY;
        }
        if (median >= 12 && median <= 16) {
            return Frequency.BIWEEKLY;
        }
        if (median >= 27 && median <= 32) {
            return Frequency.MONTHLY;
        }
        return Frequency.IRREGULAR;
    }

    static double medianGapDays(List<LocalDate> dates) {
        List<LocalDate> sorted = new ArrayList<>(dates);
        sorted.sort(null);
        long[] gaps = new long[sorted.size() - 1];
        for (int i = 1; i < sorted.size(); i++) {
            gaps[i - 1] = ChronoUnit.DAYS.between(sorted.get(i - 1), sorted.get(i));
        }
        Arrays.sort(gaps);
        int mid = gaps.length / 2;
        if (gaps.length % 2 == 1) {
            return gaps[mid];
        }
        return (gaps[mid - 1] + gaps[mid]) / 2.0;
    }
}
