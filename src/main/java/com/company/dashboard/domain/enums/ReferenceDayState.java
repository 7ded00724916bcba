package com.company.dashboard.domain.enums;

/**
 * Outcome of the "today" lookup against the cumulative status source.
 */
public enum ReferenceDayState {
    HAS_TODAY_DATA,
    FALLBACK_TO_LATEST
}
