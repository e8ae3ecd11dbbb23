package com.foliogate.observability;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Interface for tracing service to support both enabled and disabled modes.
 */
public interface TracingServiceInterface {
    <T> T trace(String spanName, Map<String, String> attributes, Supplier<T> operation);
}
