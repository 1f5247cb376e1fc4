package com.subradar.linking;

import com.subradar.common.MerchantNormalizer;
import com.subradar.domain.LinkSource;
import com.subradar.linking.cache.LinkCacheStore;
import com.subradar.linking.resolver.CachedLinkResolver;
import com.subradar.linking.resolver.KnownMerchantLinkResolver;
import com.subradar.linking.resolver.SearchFallbackLinkBuilder;
import com.subradar.linking.resolver.WebSearchLinkResolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Chain: KnownMerchant → Cache → WebSearch (cached on success) → search fallback.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CancellationLinkResolverChain implements CancellationLinkResolver {

    private final KnownMerchantLinkResolver knownMerchantLinkResolver;
    private final CachedLinkResolver cachedLinkResolver;
    private final WebSearchLinkResolver webSearchLinkResolver;
    private final SearchFallbackLinkBuilder searchFallbackLinkBuilder;
    private final LinkCacheStore linkCacheStore;

    @Override
    public LinkResolutionResult resolve(String merchant) {
        try {
            Optional<String> url = knownMerchantLinkResolver.resolve(merchant);
            if (url.isPresent()) {
                return LinkResolutionResult.of(url.get(), LinkSource.KNOWN_MERCHANT);
            }
            url = cachedLinkResolver.resolve(merchant);
            if (url.isPresent()) {
                return LinkResolutionResult.of(url.get(), LinkSource.CACHE);
            }
            url = webSearchLinkResolver.resolve(merchant);
            if (url.isPresent()) {
                String key = MerchantNormalizer.normalize(merchant);
                if (!key.isEmpty()) {
                    linkCacheStore.put(key, url.get());
                }
                return LinkResolutionResult.of(url.get(), LinkSource.DISCOVERED);
            }
        } catch (RuntimeException e) {
            log.warn("Link resolution failed for '{}', using search fallback: {}", merchant, e.getMessage());
        }
        return fallback(merchant);
    }

    @Override
    public LinkResolutionResult fallback(String merchant) {
        return LinkResolutionResult.of(searchFallbackLinkBuilder.build(merchant), LinkSource.SEARCH_FALLBACK);
    }
}
