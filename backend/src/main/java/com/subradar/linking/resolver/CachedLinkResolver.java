package com.subradar.linking.resolver;

import com.subradar.common.MerchantNormalizer;
import com.subradar.domain.LinkCacheEntry;
import com.subradar.linking.cache.LinkCacheStore;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@RequiredArgsConstructor
public class CachedLinkResolver implements MerchantLinkResolver {

    private final LinkCacheStore linkCacheStore;

    @Override
    public Optional<String> resolve(String merchant) {
        String key = MerchantNormalizer.normalize(merchant);
        if (key.isEmpty()) {
            return Optional.empty();
        }
        return linkCacheStore.get(key).map(LinkCacheEntry::url);
    }
}
