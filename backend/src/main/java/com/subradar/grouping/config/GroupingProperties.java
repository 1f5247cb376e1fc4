package com.subradar.grouping.config;

import com.subradar.grouping.GroupingStrategy;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Grouping configuration. Documented in application.yml under subradar.grouping.
 */
@ConfigurationProperties(prefix = "subradar.grouping")
@Getter
@Setter
public class GroupingProperties {

    /**
     * Records join a group only when the similarity score is strictly above this value (0..100).
     */
    private int similarityThreshold = 80;

    /**
     * Groups smaller than this are dropped from {@code group}. Values below 2 are treated as 2.
     */
    private int minMembers = 2;

    private GroupingStrategy strategy = GroupingStrategy.FIRST_MATCH;

    /**
     * Strict recurring-pattern filter applied after grouping.
     */
    private StrictProperties strict = new StrictProperties();

    @Getter
    @Setter
    public static class StrictProperties {
        /** When false, every group that passes min-members is kept. */
        private boolean enabled = false;
        /** Max relative difference to a cluster's first amount (0.10 = 10%). */
        private double amountVarianceThreshold = 0.10;
        /** Max days between consecutive charges inside a consistent run. */
        private int maxDaysBetween = 35;
    }
}
