package com.foliogate.shared.model;

/**
 * Why a gated operation failed.
 * PROVIDER: the external collaborator reported an error.
 * TIMEOUT: the operation did not finish in time or the caller gave up.
 * INTERNAL: anything else raised while executing the operation.
 */
public enum FailureKind {
    PROVIDER,
    TIMEOUT,
    INTERNAL
}
