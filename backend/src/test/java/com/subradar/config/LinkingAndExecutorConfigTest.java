package com.subradar.config;

import com.subradar.analysis.config.AnalysisConfig;
import com.subradar.analysis.config.AnalysisProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.subradar.common.IndelRatioMatcher;
import com.subradar.domain.LinkCacheEntry;
import com.subradar.grouping.config.GroupingConfig;
import com.subradar.grouping.config.GroupingProperties;
import com.subradar.linking.cache.LinkCacheStore;
import com.subradar.linking.config.LinkingConfig;
import com.subradar.linking.config.LinkingProperties;
import com.subradar.linking.table.KnownMerchantTable;
import io.github.resilience4j.ratelimiter.RateLimiter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Duration;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = {
        AsyncConfig.class,
        GroupingConfig.class,
        AnalysisConfig.class,
        LinkingConfig.class,
        IndelRatioMatcher.class,
        JacksonAutoConfiguration.class
})
class LinkingAndExecutorConfigTest {

    @Autowired
    @Qualifier(AsyncConfig.LINK_RESOLUTION_EXECUTOR)
    Executor linkResolutionExecutor;

    @Autowired
    RateLimiter linkDiscoveryRateLimiter;

    @Autowired
    KnownMerchantTable knownMerchantTable;

    @Autowired
    LinkCacheStore linkCacheStore;

    @Autowired
    Cache<String, LinkCacheEntry> linkCache;

    @Autowired
    GroupingProperties groupingProperties;

    @Autowired
    LinkingProperties linkingProperties;

    @Autowired
    AnalysisProperties analysisProperties;

    @Test
    @DisplayName("link resolution executor is a bounded pool")
    void executorCreated() {
        assertThat(linkResolutionExecutor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor e = (ThreadPoolTaskExecutor) linkResolutionExecutor;
        assertThat(e.getCorePoolSize()).isEqualTo(4);
        assertThat(e.getMaxPoolSize()).isEqualTo(8);
        assertThat(e.getThreadNamePrefix()).isEqualTo("link-resolution-");
        assertThat(e.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
    }

    @Test
    @DisplayName("discovery limiter spaces 30 requests per minute with a 500 ms acquire timeout")
    void rateLimiterConfigured() {
        assertThat(linkDiscoveryRateLimiter.getRateLimiterConfig().getLimitForPeriod()).isEqualTo(1);
        assertThat(linkDiscoveryRateLimiter.getRateLimiterConfig().getLimitRefreshPeriod()).isEqualTo(Duration.ofSeconds(2));
        assertThat(linkDiscoveryRateLimiter.getRateLimiterConfig().getTimeoutDuration()).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    @DisplayName("properties bind defaults and test overrides")
    void propertiesBound() {
        assertThat(groupingProperties.getSimilarityThreshold()).isEqualTo(80);
        assertThat(groupingProperties.getMinMembers()).isEqualTo(2);
        assertThat(groupingProperties.getStrict().isEnabled()).isFalse();
        assertThat(linkingProperties.getCacheFile()).isEqualTo("target/test-data/link-cache.json");
        assertThat(linkingProperties.isSaveOnWrite()).isFalse();
        assertThat(linkingProperties.getDiscovery().isEnabled()).isFalse();
        assertThat(analysisProperties.getResolutionDeadlineMs()).isEqualTo(2000);
    }

    @Test
    @DisplayName("known-merchant table and link cache are created")
    void linkingBeansCreated() {
        assertThat(knownMerchantTable.size()).isGreaterThanOrEqualTo(100);
        assertThat(linkCacheStore).isNotNull();
        assertThat(linkCache.policy().eviction()).isEmpty();
        assertThat(linkCache.policy().expireAfterWrite()).isEmpty();
    }
}
