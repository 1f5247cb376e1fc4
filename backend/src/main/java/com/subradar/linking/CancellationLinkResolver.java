package com.subradar.linking;

/**
 * Finds a cancellation URL for a display merchant. Always returns a usable link and never throws.
 */
public interface CancellationLinkResolver {

    LinkResolutionResult resolve(String merchant);

    /**
     * Generic search link, used when resolution cannot finish in time.
     */
    LinkResolutionResult fallback(String merchant);
}
