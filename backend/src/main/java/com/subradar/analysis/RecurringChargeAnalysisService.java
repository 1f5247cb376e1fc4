package com.subradar.analysis;

import com.subradar.analysis.config.AnalysisProperties;
import com.subradar.config.AsyncConfig;
import com.subradar.domain.RecurringGroup;
import com.subradar.domain.TransactionRecord;
import com.subradar.grouping.RecurrenceGrouper;
import com.subradar.grouping.RecurringPatternFilter;
import com.subradar.linking.CancellationLinkResolver;
import com.subradar.linking.LinkResolutionResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * One analysis run: group → (strict filter) → estimate → resolve links in parallel under a deadline.
 * Output keeps group discovery order.
 */
@Service
@Slf4j
public class RecurringChargeAnalysisService {

    private final RecurrenceGrouper recurrenceGrouper;
    private final RecurringPatternFilter recurringPatternFilter;
    private final FrequencyCostEstimator frequencyCostEstimator;
    private final CancellationLinkResolver cancellationLinkResolver;
    private final AnalysisProperties analysisProperties;
    private final Executor linkResolutionExecutor;

    public RecurringChargeAnalysisService(RecurrenceGrouper recurrenceGrouper,
                                          RecurringPatternFilter recurringPatternFilter,
                                          FrequencyCostEstimator frequencyCostEstimator,
                                          CancellationLinkResolver cancellationLinkResolver,
                                          AnalysisProperties analysisProperties,
                                          @Qualifier(AsyncConfig.LINK_RESOLUTION_EXECUTOR) Executor linkResolutionExecutor) {
        this.recurrenceGrouper = recurrenceGrouper;
        this.recurringPatternFilter = recurringPatternFilter;
        this.frequencyCostEstimator = frequencyCostEstimator;
        this.cancellationLinkResolver = cancellationLinkResolver;
        this.analysisProperties = analysisProperties;
        this.linkResolutionExecutor = linkResolutionExecutor;
    }

    public AnalysisResult analyze(List<TransactionRecord> records) {
        if (records == null || records.isEmpty()) {
            return AnalysisResult.empty();
        }
        List<RecurringGroup> groups = recurringPatternFilter.apply(recurrenceGrouper.group(records));
        for (RecurringGroup group : groups) {
            frequencyCostEstimator.estimate(group);
        }
        resolveLinks(groups);
        List<AnnotatedGroup> annotated = new ArrayList<>(groups.size());
        for (RecurringGroup group : groups) {
            annotated.add(AnnotatedGroup.from(group));
        }
        AnalysisResult result = AnalysisResult.of(annotated);
        log.info("Analyzed {} transactions: {} recurring groups, total monthly {}",
                records.size(), annotated.size(), result.totalMonthlySavings());
        return result;
    }

    /**
     * Same as {@link #analyze(List)} with groups matching any identifier (raw merchant or group key) removed.
     */
    public AnalysisResult analyze(List<TransactionRecord> records, Collection<String> exclusions) {
        return analyze(records).excluding(exclusions);
    }

    private void resolveLinks(List<RecurringGroup> groups) {
        if (groups.isEmpty()) {
            return;
        }
        List<CompletableFuture<LinkResolutionResult>> futures = new ArrayList<>(groups.size());
        for (RecurringGroup group : groups) {
            futures.add(submitResolution(group));
        }
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(Math.max(0L, analysisProperties.getResolutionDeadlineMs()));
        for (int i = 0; i < groups.size(); i++) {
            RecurringGroup group = groups.get(i);
            LinkResolutionResult link = awaitLink(futures.get(i), group, deadline);
            group.attachLink(link.url(), link.source());
        }
    }

    /** A saturated pool rejects the lookup; the group then gets the search fallback without blocking the run. */
    private CompletableFuture<LinkResolutionResult> submitResolution(RecurringGroup group) {
        try {
            return CompletableFuture.supplyAsync(
                    () -> cancellationLinkResolver.resolve(group.getDisplayMerchant()),
                    linkResolutionExecutor);
        } catch (RejectedExecutionException e) {
            log.warn("Link resolution pool saturated, using search fallback for '{}'", group.getDisplayMerchant());
            return CompletableFuture.completedFuture(cancellationLinkResolver.fallback(group.getDisplayMerchant()));
        }
    }

    private LinkResolutionResult awaitLink(CompletableFuture<LinkResolutionResult> future,
                                           RecurringGroup group, long deadlineNanos) {
        try {
            long remaining = Math.max(0L, deadlineNanos - System.nanoTime());
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Link resolution deadline passed for '{}', using search fallback", group.getDisplayMerchant());
        } catch (ExecutionException e) {
            log.warn("Link resolution failed for '{}': {}", group.getDisplayMerchant(),
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while resolving link for '{}'", group.getDisplayMerchant());
        }
        return cancellationLinkResolver.fallback(group.getDisplayMerchant());
    }
}
