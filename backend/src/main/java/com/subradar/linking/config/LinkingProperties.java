package com.subradar.linking.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Cancellation link resolution configuration. Documented in application.yml under subradar.linking.
 */
@ConfigurationProperties(prefix = "subradar.linking")
@Getter
@Setter
public class LinkingProperties {

    public static final String DEFAULT_FALLBACK_SEARCH_URL = "https://www.google.com/search?q=how+to+cancel+{merchant}";

    /**
     * Known-merchant matches need a similarity score strictly above this value (0..100).
     */
    private int knownMerchantThreshold = 80;

    /**
     * Bundled curated table, loaded first.
     */
    private String knownMerchantsLocation = "classpath:known-merchants.json";

    /**
     * Writable overlay table ({name: url}). Entries added at runtime with save=true are written here.
     */
    private String knownMerchantsFile = "data/known_merchants.json";

    /**
     * Persisted link cache ({key: {url, resolvedAt}}).
     */
    private String cacheFile = "data/link-cache.json";

    /**
     * Cached links older than this are ignored. 0 = never expire.
     */
    private int cacheTtlHours = 0;

    /**
     * Write the cache file after every put/invalidate, in addition to shutdown.
     */
    private boolean saveOnWrite = true;

    /**
     * Generic search URL; {merchant} is replaced by the URL-encoded merchant name.
     */
    private String fallbackSearchUrl = DEFAULT_FALLBACK_SEARCH_URL;

    private DiscoveryProperties discovery = new DiscoveryProperties();

    @Getter
    @Setter
    public static class DiscoveryProperties {
        /** Off by default: no outbound web lookups unless enabled. */
        private boolean enabled = false;
        /** HTML search endpoint queried with q=cancel+{merchant}. */
        private String searchBaseUrl = "https://html.duckduckgo.com/html/";
        /** Process-wide budget for discovery requests. */
        private int requestsPerMinute = 30;
        /** Max wait for a limiter permit before skipping discovery. */
        private long limiterTimeoutMs = 500;
        private long requestTimeoutMs = 5_000;
        private String userAgent = "Mozilla/5.0 (compatible; SubRadar/0.1)";
    }
}
