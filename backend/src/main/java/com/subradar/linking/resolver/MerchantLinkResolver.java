package com.subradar.linking.resolver;

import java.util.Optional;

/**
 * One stage of the cancellation link chain. Empty means "try the next stage".
 */
public interface MerchantLinkResolver {

    Optional<String> resolve(String merchant);
}
