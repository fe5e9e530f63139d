package com.marketplace.shared.enums;

/**
 * Lifecycle of a single dispatch offer. SENT is the only non-terminal value.
 */
public enum SuggestionStatus {
    SENT,
    ACCEPTED,
    REJECTED,
    EXPIRED
}
