package com.subradar.domain;

/**
 * Recurrence interval inferred from the day gaps inside a recurring group.
 */
public enum Frequency {
    MONTHLY,
    BIWEEKLY,
    WEEKLY,
    IRREGULAR,
    UNKNOWN
}
