package com.foliogate.security;

import com.foliogate.shared.model.RateLimitWindowId;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Single-node window store. {@link ConcurrentHashMap#compute} runs the
 * read-modify-write for a key under that key's bin lock, so keys are
 * independently atomic without a global lock. State is lost on restart.
 */
@Component
@ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "memory")
public class InMemoryRateLimitWindowStore implements RateLimitWindowStore {

    private final ConcurrentMap<RateLimitWindowId, WindowState> windows = new ConcurrentHashMap<>();

    @Override
    public WindowConsumption tryConsume(String principalId, String operationClass,
                                        int ceiling, Duration windowLength, Instant now) {
        AtomicReference<WindowConsumption> result = new AtomicReference<>();
        windows.compute(new RateLimitWindowId(principalId, operationClass), (key, current) -> {
            if (current == null || current.hasElapsed(windowLength, now)) {
                result.set(new WindowConsumption(true, now, 1));
                return new WindowState(now, 1, now);
            }
            if (current.count() < ceiling) {
                int next = current.count() + 1;
                result.set(new WindowConsumption(true, current.windowStart(), next));
                return new WindowState(current.windowStart(), next, now);
            }
            result.set(new WindowConsumption(false, current.windowStart(), current.count()));
            return current;
        });
        return result.get();
    }

    @Override
    public void release(String principalId, String operationClass, Instant windowStart, Instant now) {
        windows.computeIfPresent(new RateLimitWindowId(principalId, operationClass), (key, current) -> {
            if (!current.windowStart().equals(windowStart) || current.count() == 0) {
                return current;
            }
            return new WindowState(current.windowStart(), current.count() - 1, now);
        });
    }

    @Override
    public int currentCount(String principalId, String operationClass, Duration windowLength, Instant now) {
        WindowState state = windows.get(new RateLimitWindowId(principalId, operationClass));
        if (state == null || state.hasElapsed(windowLength, now)) {
            return 0;
        }
        return state.count();
    }

    @Override
    public int purgeIdleSince(Instant cutoff) {
        int before = windows.size();
        windows.entrySet().removeIf(entry -> entry.getValue().updatedAt().isBefore(cutoff));
        return before - windows.size();
    }

    private record WindowState(Instant windowStart, int count, Instant updatedAt) {

        boolean hasElapsed(Duration windowLength, Instant now) {
            return !now.isBefore(windowStart.plus(windowLength));
        }
    }
}
