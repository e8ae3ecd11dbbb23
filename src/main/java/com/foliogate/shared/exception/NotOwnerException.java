package com.foliogate.shared.exception;

/**
 * The requesting principal does not own the resource and is not staff.
 */
public class NotOwnerException extends RuntimeException {

    public NotOwnerException(String message) {
        super(message);
    }
}
