package com.subradar.linking.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.subradar.common.SimilarityMatcher;
import com.subradar.domain.LinkCacheEntry;
import com.subradar.linking.cache.LinkCacheStore;
import com.subradar.linking.table.KnownMerchantTable;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;

/**
 * Linking module configuration: properties, discovery rate limiter, link cache and known-merchant table.
 */
@Configuration
@EnableConfigurationProperties(LinkingProperties.class)
public class LinkingConfig {

    /** One permit per refresh period, so requests-per-minute also spaces calls evenly. */
    @Bean(name = "linkDiscoveryRateLimiter")
    public RateLimiter linkDiscoveryRateLimiter(LinkingProperties linkingProperties) {
        LinkingProperties.DiscoveryProperties discovery = linkingProperties.getDiscovery();
        int rpm = Math.max(1, discovery.getRequestsPerMinute());
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitRefreshPeriod(Duration.ofMillis(60_000L / rpm))
                .limitForPeriod(1)
                .timeoutDuration(Duration.ofMillis(Math.max(0L, discovery.getLimiterTimeoutMs())))
                .build();
        return RateLimiter.of("link-discovery", config);
    }

    /** Unbounded: entries leave only through invalidation or the optional TTL. */
    @Bean
    public Cache<String, LinkCacheEntry> linkCache() {
        return Caffeine.newBuilder().build();
    }

    @Bean(initMethod = "load", destroyMethod = "flush")
    public LinkCacheStore linkCacheStore(Cache<String, LinkCacheEntry> linkCache,
                                         LinkingProperties linkingProperties,
                                         ObjectMapper objectMapper) {
        return new LinkCacheStore(linkCache,
                Path.of(linkingProperties.getCacheFile()),
                objectMapper,
                Duration.ofHours(Math.max(0, linkingProperties.getCacheTtlHours())),
                linkingProperties.isSaveOnWrite(),
                Clock.systemUTC());
    }

    @Bean
    public KnownMerchantTable knownMerchantTable(LinkingProperties linkingProperties,
                                                 ResourceLoader resourceLoader,
                                                 ObjectMapper objectMapper,
                                                 SimilarityMatcher similarityMatcher) {
        String overlay = linkingProperties.getKnownMerchantsFile();
        return KnownMerchantTable.load(
                resourceLoader.getResource(linkingProperties.getKnownMerchantsLocation()),
                overlay != null && !overlay.isBlank() ? Path.of(overlay) : null,
                objectMapper,
                similarityMatcher,
                linkingProperties.getKnownMerchantThreshold());
    }
}
