package com.subradar.linking.resolver;

import com.subradar.common.MerchantNormalizer;
import com.subradar.linking.table.KnownMerchantTable;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * First in chain: curated table lookup on both the plain and the canonical merchant key.
 */
@Component
@RequiredArgsConstructor
public class KnownMerchantLinkResolver implements MerchantLinkResolver {

    private final KnownMerchantTable knownMerchantTable;

    @Override
    public Optional<String> resolve(String merchant) {
        if (merchant == null || merchant.isBlank()) {
            return Optional.empty();
        }
        return knownMerchantTable.bestMatch(
                        MerchantNormalizer.normalize(merchant),
                        MerchantNormalizer.canonicalize(merchant))
                .map(KnownMerchantTable.Entry::url);
    }
}
