package com.subradar.domain;

import java.time.Instant;

/**
 * Persisted cancellation link for a normalized merchant key.
 */
public record LinkCacheEntry(String url, Instant resolvedAt) {
}
