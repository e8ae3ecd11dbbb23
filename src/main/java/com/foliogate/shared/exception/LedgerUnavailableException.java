package com.foliogate.shared.exception;

/**
 * The usage ledger could not be written.
 */
public class LedgerUnavailableException extends RuntimeException {

    public LedgerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
