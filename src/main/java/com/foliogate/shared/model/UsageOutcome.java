package com.foliogate.shared.model;

/**
 * Outcome of one gateway invocation attempt as recorded in the usage ledger.
 */
public enum UsageOutcome {
    SUCCESS,
    FAILURE,
    RATE_LIMITED
}
