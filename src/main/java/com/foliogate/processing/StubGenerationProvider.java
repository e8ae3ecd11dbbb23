package com.foliogate.processing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

/**
 * Deterministic generation backend for local development and tests, used when
 * vertexai.enabled=false. Costs nothing and never calls out.
 */
@Service
@ConditionalOnProperty(name = "vertexai.enabled", havingValue = "false", matchIfMissing = true)
public class StubGenerationProvider implements GenerationProvider {

    private static final Logger logger = LoggerFactory.getLogger(StubGenerationProvider.class);
    static final String MODEL = "stub";
    private static final int ECHO_LIMIT = 200;

    public StubGenerationProvider() {
        logger.info("Vertex AI disabled, using stub generation provider");
    }

    @Override
    public OperationResult<String> generate(GenerationPrompt prompt) {
        String text = prompt.userText().trim();
        String echo = text.length() > ECHO_LIMIT ? text.substring(0, ECHO_LIMIT) : text;
        String output = "[stub " + prompt.feature().getValue() + ", " + prompt.tone() + "] " + echo;
        logger.debug("Generated stub response for feature={}", prompt.feature().getValue());
        return new OperationResult<>(output, new CostReport(MODEL, 0, 0, null));
    }

    @Override
    public String modelName() {
        return MODEL;
    }
}
