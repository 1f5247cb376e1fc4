package com.subradar.grouping;

import com.subradar.domain.RecurringGroup;
import com.subradar.domain.TransactionRecord;
import com.subradar.grouping.config.GroupingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Strict mode: keeps a group only if it contains a run of consistently priced charges at regular
 * intervals, and narrows a kept group to that run. Disabled unless subradar.grouping.strict.enabled=true,
 * in which case groups are returned as-is.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecurringPatternFilter {

    private final GroupingProperties groupingProperties;

    public List<RecurringGroup> apply(List<RecurringGroup> groups) {
        GroupingProperties.StrictProperties strict = groupingProperties.getStrict();
        if (groups == null || strict == null || !strict.isEnabled()) {
            return groups != null ? groups : List.of();
        }
        int minMembers = Math.max(RecurrenceGrouper.MIN_GROUP_SIZE, groupingProperties.getMinMembers());
        List<RecurringGroup> kept = new ArrayList<>();
        for (RecurringGroup g : groups) {
            Optional<List<TransactionRecord>> run = consistentRun(g.getMembers(), strict, minMembers);
            if (run.isPresent()) {
                if (run.get().size() < g.size()) {
                    log.debug("Strict filter narrowed group '{}' from {} to {} members",
                            g.getKey(), g.size(), run.get().size());
                    g.narrowTo(run.get());
                }
                kept.add(g);
            } else {
                log.debug("Strict filter dropped group '{}'", g.getKey());
            }
        }
        return kept;
    }

    /**
     * First amount cluster (in member order) with at least {@code minMembers} members and at least
     * {@code minMembers - 1} date gaps within max-days-between. Gaps above the bound are ignored rather
     * than disqualifying, so a paused subscription still counts.
     */
    static Optional<List<TransactionRecord>> consistentRun(List<TransactionRecord> members,
                                                          GroupingProperties.StrictProperties strict,
                                                          int minMembers) {
        BigDecimal variance = BigDecimal.valueOf(strict.getAmountVarianceThreshold());
        List<List<TransactionRecord>> clusters = new ArrayList<>();
        for (TransactionRecord member : members) {
            BigDecimal amount = member.amount().abs();
            if (amount.signum() == 0) {
                continue;
            }
            List<TransactionRecord> target = null;
            for (List<TransactionRecord> cluster : clusters) {
                BigDecimal seed = cluster.get(0).amount().abs();
                BigDecimal relative = amount.subtract(seed).abs().divide(seed, MathContext.DECIMAL64);
                if (relative.compareTo(variance) <= 0) {
                    target = cluster;
                    break;
                }
            }
            if (target == null) {
                target = new ArrayList<>();
                clusters.add(target);
            }
            target.add(member);
        }
        for (List<TransactionRecord> cluster : clusters) {
            if (cluster.size() >= minMembers
                    && gapsWithin(cluster, strict.getMaxDaysBetween()) >= minMembers - 1) {
                return Optional.of(cluster);
            }
        }
        return Optional.empty();
    }

    private static int gapsWithin(List<TransactionRecord> cluster, int maxDaysBetween) {
        List<TransactionRecord> sorted = new ArrayList<>(cluster);
        sorted.sort(Comparator.comparing(TransactionRecord::date));
        int within = 0;
        for (int i = 1; i < sorted.size(); i++) {
            long gap = ChronoUnit.DAYS.between(sorted.get(i - 1).date(), sorted.get(i).date());
            if (gap <= maxDaysBetween) {
                within++;
            }
        }
        return within;
    }
}
