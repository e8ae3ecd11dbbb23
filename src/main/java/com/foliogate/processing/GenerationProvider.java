package com.foliogate.processing;

/**
 * Text generation backend called from inside the gateway.
 */
public interface GenerationProvider {

    /**
     * @throws com.foliogate.shared.exception.OperationFailedException with kind PROVIDER
     *         and whatever cost was incurred, when the backend fails
     */
    OperationResult<String> generate(GenerationPrompt prompt);

    String modelName();
}
