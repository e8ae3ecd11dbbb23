package com.foliogate.processing;

/**
 * Expensive work run behind the {@link OperationGateway}.
 * Provider errors should be raised as {@link com.foliogate.shared.exception.OperationFailedException}
 * so their partial cost reaches the ledger; anything else is recorded as an internal failure.
 */
@FunctionalInterface
public interface GatedOperation<T> {

    OperationResult<T> execute() throws Exception;
}
