package com.subradar.grouping;

import com.subradar.common.MerchantNormalizer;
import com.subradar.common.SimilarityMatcher;
import com.subradar.domain.RecurringGroup;
import com.subradar.domain.TransactionRecord;
import com.subradar.grouping.config.GroupingProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Single greedy pass over transactions in input order. Each record joins an existing group whose key
 * scores strictly above the similarity threshold, or opens a new one. A record whose normalized key was
 * already placed joins that group without scoring. Existing groups are never merged or rebalanced, so
 * the result depends on input order.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecurrenceGrouper {

    static final int MIN_GROUP_SIZE = 2;

    private final SimilarityMatcher similarityMatcher;
    private final GroupingProperties groupingProperties;

    /**
     * Groups with at least {@code min-members} records, in creation order.
     */
    public List<RecurringGroup> group(List<TransactionRecord> records) {
        int minMembers = Math.max(MIN_GROUP_SIZE, groupingProperties.getMinMembers());
        List<RecurringGroup> all = groupAll(records);
        List<RecurringGroup> kept = new ArrayList<>();
        for (RecurringGroup g : all) {
            if (g.size() >= minMembers) {
                kept.add(g);
            }
        }
        log.debug("Grouped into {} groups, {} kept with >= {} members", all.size(), kept.size(), minMembers);
        return kept;
    }

    /**
     * Every group including singletons, in creation order. Null records are skipped.
     */
    public List<RecurringGroup> groupAll(List<TransactionRecord> records) {
        List<RecurringGroup> groups = new ArrayList<>();
        Map<String, RecurringGroup> placed = new HashMap<>();
        if (records == null || records.isEmpty()) {
            return groups;
        }
        int threshold = clampThreshold(groupingProperties.getSimilarityThreshold());
        GroupingStrategy strategy = groupingProperties.getStrategy() != null
                ? groupingProperties.getStrategy()
                : GroupingStrategy.FIRST_MATCH;
        for (TransactionRecord record : records) {
            if (record == null) {
                continue;
            }
            String key = MerchantNormalizer.normalize(record.merchant());
            RecurringGroup target = placed.get(key);
            if (target == null) {
                target = strategy == GroupingStrategy.BEST_MATCH
                        ? bestMatch(groups, key, threshold)
                        : firstMatch(groups, key, threshold);
            }
            if (target != null) {
                log.debug("'{}' joins group '{}'", key, target.getKey());
                target.add(record);
            } else {
                log.debug("'{}' opens a new group", key);
                target = new RecurringGroup(key, record);
                groups.add(target);
            }
            placed.putIfAbsent(key, target);
        }
        return groups;
    }

    private RecurringGroup firstMatch(List<RecurringGroup> groups, String key, int threshold) {
        for (RecurringGroup g : groups) {
            if (similarityMatcher.matches(key, g.getKey(), threshold)) {
                return g;
            }
        }
        return null;
    }

    private RecurringGroup bestMatch(List<RecurringGroup> groups, String key, int threshold) {
        RecurringGroup best = null;
        int bestScore = threshold;
        for (RecurringGroup g : groups) {
            int score = similarityMatcher.similarity(key, g.getKey());
            // strict comparison keeps the earlier group on ties
            if (score > bestScore) {
                best = g;
                bestScore = score;
            }
        }
        return best;
    }

    static int clampThreshold(int threshold) {
        return Math.max(0, Math.min(100, threshold));
    }
}
