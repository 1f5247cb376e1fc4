package com.subradar.analysis;

import com.subradar.domain.Frequency;
import com.subradar.domain.LinkSource;
import com.subradar.domain.RecurringGroup;
import com.subradar.domain.TransactionRecord;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Immutable view of an estimated and link-annotated recurring group.
 */
public record AnnotatedGroup(
        String groupKey,
        String displayMerchant,
        BigDecimal monthlyCost,
        Frequency frequency,
        String cancellationLink,
        LinkSource linkSource,
        int memberCount,
        LocalDate firstChargeDate,
        LocalDate lastChargeDate
) {

    public static AnnotatedGroup from(RecurringGroup group) {
        LocalDate first = null;
        LocalDate last = null;
        for (TransactionRecord member : group.getMembers()) {
            LocalDate d = member.date();
            if (first == null || d.isBefore(first)) {
                first = d;
            }
            if (last == null || d.isAfter(last)) {
                last = d;
            }
        }
        return new AnnotatedGroup(group.getKey(), group.getDisplayMerchant(), group.getMonthlyCost(),
                group.getFrequency(), group.getCancellationLink(), group.getLinkSource(),
                group.size(), first, last);
    }
}
