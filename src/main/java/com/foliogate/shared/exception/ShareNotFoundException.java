package com.foliogate.shared.exception;

/**
 * A share token did not resolve. Raised identically for unknown, revoked and
 * expired tokens; the message is fixed so callers cannot tell them apart.
 */
public class ShareNotFoundException extends RuntimeException {

    public static final String MESSAGE = "Not found";

    public ShareNotFoundException() {
        super(MESSAGE, null, false, false);
    }
}
