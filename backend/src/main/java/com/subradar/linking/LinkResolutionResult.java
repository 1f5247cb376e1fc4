package com.subradar.linking;

import com.subradar.domain.LinkSource;

/**
 * Cancellation URL plus the chain stage that produced it. The URL is never blank.
 */
public record LinkResolutionResult(String url, LinkSource source) {

    public LinkResolutionResult {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("url must not be blank");
        }
        if (source == null) {
            throw new IllegalArgumentException("source must not be null");
        }
    }

    public static LinkResolutionResult of(String url, LinkSource source) {
        return new LinkResolutionResult(url, source);
    }
}
