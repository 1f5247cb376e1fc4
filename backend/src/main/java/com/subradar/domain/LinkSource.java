package com.subradar.domain;

/**
 * Stage of the link resolution chain that produced a cancellation URL.
 */
public enum LinkSource {
    KNOWN_MERCHANT,
    CACHE,
    DISCOVERED,
    SEARCH_FALLBACK
}
