package com.foliogate.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.util.concurrent.TimeUnit;

/**
 * Service for emitting custom Datadog metrics.
 * Only active when datadog.enabled=true. Service and env tags come from the registry's common tags.
 *
 * Metrics:
 * - foliogate.gateway.invocations: Counter of gated invocations by class, feature and outcome
 * - foliogate.gateway.duration: Timer for gated invocation duration
 * - foliogate.ratelimit.denied: Counter of rate limit denials by class
 * - foliogate.ratelimit.store_failure: Counter of window store failures by class
 * - foliogate.ledger.failure: Counter of usage ledger write failures
 * - foliogate.llm.latency_ms: Timer for LLM call latency
 * - foliogate.llm.tokens: Counter for LLM token usage
 * - foliogate.llm.cost_estimate_usd: Counter for estimated LLM costs
 * - foliogate.share.issued / foliogate.share.resolve: share link activity
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class DatadogMetricsService implements DatadogMetricsServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(DatadogMetricsService.class);

    private final MeterRegistry meterRegistry;

    private Counter ledgerFailureCounter;
    private Counter llmCostEstimateCounter;

    @Autowired
    public DatadogMetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initializeMetrics() {
        ledgerFailureCounter = Counter.builder("foliogate.ledger.failure")
                .description("Usage ledger write failures")
                .register(meterRegistry);

        llmCostEstimateCounter = Counter.builder("foliogate.llm.cost_estimate_usd")
                .description("Estimated LLM API cost in USD")
                .register(meterRegistry);

        logger.info("Datadog metrics service initialized");
    }

    /**
     * Record one gated invocation.
     * @param operationClass Primary operation class (e.g., "ai_generation")
     * @param feature Feature name (e.g., "summary")
     * @param outcome SUCCESS, FAILURE or RATE_LIMITED
     * @param durationMs Wall time from rate check to ledger write
     */
    @Override
    public void recordGatewayInvocation(String operationClass, String feature, String outcome, long durationMs) {
        Counter.builder("foliogate.gateway.invocations")
                .tag("operation_class", tagValue(operationClass))
                .tag("feature", tagValue(feature))
                .tag("outcome", tagValue(outcome))
                .register(meterRegistry)
                .increment();
        Timer.builder("foliogate.gateway.duration")
                .tag("operation_class", tagValue(operationClass))
                .tag("outcome", tagValue(outcome))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded gateway invocation: class={}, feature={}, outcome={}, {}ms",
                operationClass, feature, outcome, durationMs);
    }

    @Override
    public void recordRateLimitDenied(String operationClass) {
        Counter.builder("foliogate.ratelimit.denied")
                .tag("operation_class", tagValue(operationClass))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordRateLimitStoreFailure(String operationClass) {
        Counter.builder("foliogate.ratelimit.store_failure")
                .tag("operation_class", tagValue(operationClass))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordLedgerFailure(String ledgerMode) {
        ledgerFailureCounter.increment();
        Counter.builder("foliogate.ledger.failure")
                .tag("ledger_mode", tagValue(ledgerMode))
                .register(meterRegistry)
                .increment();
    }

    /**
     * Record LLM API latency.
     * @param durationMs Latency in milliseconds
     * @param model Model name
     * @param feature Generation feature
     */
    @Override
    public void recordLlmLatency(long durationMs, String model, String feature) {
        Timer.builder("foliogate.llm.latency_ms")
                .description("LLM API call latency in milliseconds")
                .tag("model", tagValue(model))
                .tag("feature", tagValue(feature))
                .register(meterRegistry)
                .record(durationMs, TimeUnit.MILLISECONDS);
        logger.debug("Recorded LLM latency: {}ms for model={}, feature={}", durationMs, model, feature);
    }

    @Override
    public void recordLlmTokens(int inputTokens, int outputTokens, String model, String feature) {
        Counter.builder("foliogate.llm.tokens")
                .tag("model", tagValue(model))
                .tag("feature", tagValue(feature))
                .tag("token_type", "input")
                .register(meterRegistry)
                .increment(inputTokens);

        Counter.builder("foliogate.llm.tokens")
                .tag("model", tagValue(model))
                .tag("feature", tagValue(feature))
                .tag("token_type", "output")
                .register(meterRegistry)
                .increment(outputTokens);

        logger.debug("Recorded LLM tokens: input={}, output={} for model={}, feature={}",
                inputTokens, outputTokens, model, feature);
    }

    @Override
    public void recordLlmCostEstimate(double costUsd, String model, String feature) {
        llmCostEstimateCounter.increment(costUsd);
        Counter.builder("foliogate.llm.cost_estimate_usd")
                .tag("model", tagValue(model))
                .tag("feature", tagValue(feature))
                .register(meterRegistry)
                .increment(costUsd);
        logger.debug("Recorded LLM cost estimate: ${} for model={}, feature={}", costUsd, model, feature);
    }

    @Override
    public void recordShareLinkIssued(String resourceType) {
        Counter.builder("foliogate.share.issued")
                .tag("resource_type", tagValue(resourceType))
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordShareResolve(boolean found) {
        Counter.builder("foliogate.share.resolve")
                .tag("result", found ? "found" : "not_found")
                .register(meterRegistry)
                .increment();
    }

    private static String tagValue(String value) {
        return value != null ? value : "unknown";
    }
}
