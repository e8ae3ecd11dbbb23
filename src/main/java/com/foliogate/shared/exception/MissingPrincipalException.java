package com.foliogate.shared.exception;

/**
 * A non-public endpoint was called without a forwarded principal.
 */
public class MissingPrincipalException extends RuntimeException {

    public MissingPrincipalException() {
        super("Authentication required");
    }
}
