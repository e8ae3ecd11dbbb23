package com.foliogate.observability;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Stub implementation when Datadog is disabled.
 * Prevents NullPointerException when TracingService is not available.
 */
@Service
@ConditionalOnProperty(name = "datadog.enabled", havingValue = "false", matchIfMissing = true)
public class TracingServiceStub implements TracingServiceInterface {

    @Override
    public <T> T trace(String spanName, Map<String, String> attributes, Supplier<T> operation) {
        return operation.get();
    }
}
