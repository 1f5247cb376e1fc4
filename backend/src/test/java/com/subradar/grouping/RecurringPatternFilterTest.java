package com.subradar.grouping;

import com.subradar.domain.RecurringGroup;
import com.subradar.domain.TransactionRecord;
import com.subradar.grouping.config.GroupingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RecurringPatternFilterTest {

    private GroupingProperties props;
    private RecurringPatternFilter filter;

    @BeforeEach
    void setUp() {
        props = new GroupingProperties();
        props.getStrict().setEnabled(true);
        filter = new RecurringPatternFilter(props);
    }

    @Test
    @DisplayName("returns groups unchanged when strict mode is disabled")
    void disabledPassesThrough() {
        props.getStrict().setEnabled(false);
        List<RecurringGroup> groups = List.of(group("2024-01-01:5.00", "2024-06-01:120.00"));
        assertThat(filter.apply(groups)).isSameAs(groups);
    }

    @Test
    @DisplayName("keeps monthly charges within 10% of each other")
    void keepsConsistentMonthly() {
        RecurringGroup g = group("2024-01-15:9.99", "2024-02-15:9.99", "2024-03-15:10.49");
        assertThat(filter.apply(List.of(g))).containsExactly(g);
        assertThat(g.size()).isEqualTo(3);
    }

    @Test
    @DisplayName("drops a group with widely varying amounts")
    void dropsVaryingAmounts() {
        RecurringGroup g = group("2024-01-15:5.00", "2024-02-15:50.00", "2024-03-15:120.00");
        assertThat(filter.apply(List.of(g))).isEmpty();
    }

    @Test
    @DisplayName("drops consistent amounts that are too far apart")
    void dropsWideGaps() {
        RecurringGroup g = group("2024-01-15:9.99", "2024-04-15:9.99", "2024-07-15:9.99");
        assertThat(filter.apply(List.of(g))).isEmpty();
    }

    @Test
    @DisplayName("a pause longer than max-days-between does not drop a subscription")
    void pausedSubscriptionKept() {
        RecurringGroup g = group("2024-01-05:15.49", "2024-02-05:15.49", "2024-05-05:15.49", "2024-06-05:15.49");
        assertThat(filter.apply(List.of(g))).containsExactly(g);
        assertThat(g.size()).isEqualTo(4);
    }

    @Test
    @DisplayName("kept group is narrowed to its consistent run, so outliers leave the monthly cost")
    void keptGroupNarrowedToRun() {
        RecurringGroup g = group("2024-01-05:15.49", "2024-01-20:199.00", "2024-02-05:15.49");

        assertThat(filter.apply(List.of(g))).containsExactly(g);
        assertThat(g.getMembers()).extracting(TransactionRecord::date)
                .containsExactly(LocalDate.parse("2024-01-05"), LocalDate.parse("2024-02-05"));
        assertThat(g.getMonthlyCost()).isEqualByComparingTo("15.49");
        assertThat(g.getDisplayMerchant()).isEqualTo("Acme Streaming");
    }

    @Test
    @DisplayName("zero amounts never seed or join a cluster")
    void zeroAmountsIgnored() {
        RecurringGroup g = group("2024-01-15:0.00", "2024-02-15:0.00", "2024-03-15:9.99");
        assertThat(filter.apply(List.of(g))).isEmpty();
    }

    @Test
    @DisplayName("refunds count by absolute amount; one consistent run is enough")
    void consistentRunAmongOutliers() {
        RecurringGroup g = group("2024-01-03:-14.99", "2024-02-03:14.99", "2024-02-20:199.00", "2024-03-03:14.99");
        assertThat(filter.apply(List.of(g))).containsExactly(g);
        assertThat(g.size()).isEqualTo(3);
    }

    private static RecurringGroup group(String... dateAmounts) {
        RecurringGroup g = null;
        for (String da : dateAmounts) {
            String[] parts = da.split(":");
            TransactionRecord r = TransactionRecord.of(parts[0], "Acme Streaming", parts[1]);
            if (g == null) {
                g = new RecurringGroup("acmestreaming", r);
            } else {
                g.add(r);
            }
        }
        return g;
    }
}
