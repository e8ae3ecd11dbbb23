package com.foliogate.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Service for creating custom OpenTelemetry spans that integrate with Datadog.
 * Uses GlobalOpenTelemetry which is automatically configured by dd-java-agent.
 * Only active when datadog.enabled=true.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "true", matchIfMissing = false)
public class TracingService implements TracingServiceInterface {

    private static final Logger logger = LoggerFactory.getLogger(TracingService.class);
    private final Tracer tracer;

    public TracingService() {
        // Get tracer from GlobalOpenTelemetry (configured by dd-java-agent)
        this.tracer = GlobalOpenTelemetry.getTracer("com.foliogate", "1.0.0");
        logger.info("TracingService initialized with OpenTelemetry tracer");
    }

    /**
     * Execute a function within a custom span.
     * @param spanName Name of the span
     * @param attributes String attributes set on the span before it starts
     * @param operation Operation to execute
     * @return Result of the operation
     */
    @Override
    public <T> T trace(String spanName, Map<String, String> attributes, Supplier<T> operation) {
        SpanBuilder builder = tracer.spanBuilder(spanName);
        attributes.forEach((key, value) -> {
            if (value != null) {
                builder.setAttribute(key, value);
            }
        });
        Span span = builder.startSpan();
        try (Scope scope = span.makeCurrent()) {
            return operation.get();
        } catch (RuntimeException e) {
            span.recordException(e);
            span.setStatus(StatusCode.ERROR);
            span.setAttribute("error.message", e.getMessage() != null ? e.getMessage() : "");
            throw e;
        } finally {
            span.end();
        }
    }
}
