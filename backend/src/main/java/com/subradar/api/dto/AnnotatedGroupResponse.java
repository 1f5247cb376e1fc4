package com.subradar.api.dto;

import com.subradar.analysis.AnnotatedGroup;

import java.math.BigDecimal;
import java.time.LocalDate;

public record AnnotatedGroupResponse(
        String groupKey,
        String merchant,
        BigDecimal monthlyCost,
        String frequency,
        String cancellationLink,
        String linkSource,
        int transactionCount,
        LocalDate firstChargeDate,
        LocalDate lastChargeDate
) {

    public static AnnotatedGroupResponse from(AnnotatedGroup g) {
        return new AnnotatedGroupResponse(
                g.groupKey(),
                g.displayMerchant(),
                g.monthlyCost(),
                g.frequency() != null ? g.frequency().name() : null,
                g.cancellationLink(),
                g.linkSource() != null ? g.linkSource().name() : null,
                g.memberCount(),
                g.firstChargeDate(),
                g.lastChargeDate());
    }
}
