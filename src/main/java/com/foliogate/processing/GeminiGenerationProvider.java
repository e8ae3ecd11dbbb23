package com.foliogate.processing;

import com.foliogate.observability.DatadogMetricsServiceInterface;
import com.foliogate.observability.TracingServiceInterface;
import com.foliogate.shared.exception.OperationFailedException;
import com.foliogate.shared.model.FailureKind;
import com.google.genai.Client;
import com.google.genai.types.GenerateContentResponse;
import com.google.genai.types.HttpOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Map;

/**
 * Generation backend calling Google Vertex AI Gemini with ADC (Application Default Credentials).
 * Only active when vertexai.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "vertexai.enabled", havingValue = "true")
public class GeminiGenerationProvider implements GenerationProvider {

    private static final Logger logger = LoggerFactory.getLogger(GeminiGenerationProvider.class);
    private static final String DEFAULT_MODEL = "gemini-2.0-flash-exp";

    // Gemini pricing (approximate)
    // Input: $0.0005 per 1K tokens, Output: $0.0015 per 1K tokens
    private static final BigDecimal INPUT_COST_PER_1K_TOKENS = new BigDecimal("0.0005");
    private static final BigDecimal OUTPUT_COST_PER_1K_TOKENS = new BigDecimal("0.0015");
    private static final BigDecimal ONE_THOUSAND = BigDecimal.valueOf(1000);

    private final String projectId;
    private final String location;
    private final String model;
    private final Client client;
    private final DatadogMetricsServiceInterface metricsService;
    private final TracingServiceInterface tracingService;

    public GeminiGenerationProvider(
            @Value("${vertexai.project-id:${GOOGLE_CLOUD_PROJECT:local-project}}") String projectId,
            @Value("${vertexai.location:us-central1}") String location,
            @Value("${vertexai.model:gemini-2.0-flash-exp}") String model,
            DatadogMetricsServiceInterface metricsService,
            TracingServiceInterface tracingService) {
        this.projectId = projectId;
        this.location = location;
        this.model = model != null && !model.isEmpty() ? model : DEFAULT_MODEL;
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.client = initializeClient();
        logger.info("GeminiGenerationProvider initialized: projectId={}, location={}, model={}",
                this.projectId, this.location, this.model);
    }

    private Client initializeClient() {
        try {
            return Client.builder()
                    .project(this.projectId)
                    .location(this.location)
                    .vertexAI(true)
                    .httpOptions(HttpOptions.builder().apiVersion("v1").build())
                    .build();
        } catch (Exception e) {
            logger.error("Failed to initialize Google Gen AI SDK client: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to initialize Google Gen AI SDK client", e);
        }
    }

    @Override
    public OperationResult<String> generate(GenerationPrompt prompt) {
        String text = prompt.render();
        String feature = prompt.feature().getValue();
        // The SDK response is not relied on for usage numbers; 1 token ≈ 4 chars.
        int estimatedInputTokens = text.length() / 4;
        long startTime = System.currentTimeMillis();

        String responseText;
        try {
            GenerateContentResponse response = tracingService.trace("llm.generate",
                    Map.of("model", model, "feature", feature), () -> requestContent(text));
            responseText = response.text();
        } catch (RuntimeException e) {
            long durationMs = System.currentTimeMillis() - startTime;
            metricsService.recordLlmLatency(durationMs, model, feature);
            logger.error("Gemini API call failed: feature={}, error={}", feature, e.getMessage(), e);
            // Input was sent; charge it.
            throw new OperationFailedException(FailureKind.PROVIDER, "Gemini API call failed: " + e.getMessage(), e,
                    cost(estimatedInputTokens, 0));
        }

        if (responseText == null || responseText.isBlank()) {
            throw new OperationFailedException(FailureKind.PROVIDER, "Gemini API returned empty or null response",
                    null, cost(estimatedInputTokens, 0));
        }

        long durationMs = System.currentTimeMillis() - startTime;
        int estimatedOutputTokens = responseText.length() / 4;
        CostReport cost = cost(estimatedInputTokens, estimatedOutputTokens);

        metricsService.recordLlmLatency(durationMs, model, feature);
        metricsService.recordLlmTokens(estimatedInputTokens, estimatedOutputTokens, model, feature);
        metricsService.recordLlmCostEstimate(cost.costEstimate().doubleValue(), model, feature);
        logger.debug("Gemini API call metrics: duration={}ms, estimatedCost=${}, inputTokens≈{}, outputTokens≈{}",
                durationMs, cost.costEstimate(), estimatedInputTokens, estimatedOutputTokens);

        return new OperationResult<>(responseText.trim(), cost);
    }

    private GenerateContentResponse requestContent(String text) {
        try {
            return client.models.generateContent(model, text, null);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new IllegalStateException(e.getMessage(), e);
        }
    }

    private CostReport cost(int tokensIn, int tokensOut) {
        BigDecimal estimate = INPUT_COST_PER_1K_TOKENS.multiply(BigDecimal.valueOf(tokensIn))
                .add(OUTPUT_COST_PER_1K_TOKENS.multiply(BigDecimal.valueOf(tokensOut)))
                .divide(ONE_THOUSAND, 6, RoundingMode.HALF_UP);
        return new CostReport(model, tokensIn, tokensOut, estimate);
    }

    @Override
    public String modelName() {
        return model;
    }
}
