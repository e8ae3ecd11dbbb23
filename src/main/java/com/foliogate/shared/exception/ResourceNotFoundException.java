package com.foliogate.shared.exception;

/**
 * The resource a share operation refers to does not exist (or its type has no collaborator).
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }
}
