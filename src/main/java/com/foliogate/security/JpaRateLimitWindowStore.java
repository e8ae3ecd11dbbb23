package com.foliogate.security;

import com.foliogate.shared.model.RateLimitWindow;
import com.foliogate.shared.model.RateLimitWindowId;
import com.foliogate.shared.repository.RateLimitWindowRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * DB-backed window store. Each call runs in its own transaction and holds a
 * row lock (SELECT ... FOR UPDATE) on the (principal, class) row for the
 * read-modify-write, so two concurrent requests can never both see room
 * under the ceiling.
 *
 * The very first attempt for a key inserts the row; if another transaction
 * inserts it first the primary key rejects ours. As a {@code @Repository} the
 * failure is translated to a DataIntegrityViolationException, which
 * {@link RateLimitService} retries against the now-existing row.
 */
@Repository
@ConditionalOnProperty(name = "app.rate-limit.store", havingValue = "jpa", matchIfMissing = true)
public class JpaRateLimitWindowStore implements RateLimitWindowStore {

    private static final Logger logger = LoggerFactory.getLogger(JpaRateLimitWindowStore.class);

    private final RateLimitWindowRepository rateLimitWindowRepository;

    @PersistenceContext
    private EntityManager entityManager;

    public JpaRateLimitWindowStore(RateLimitWindowRepository rateLimitWindowRepository) {
        this.rateLimitWindowRepository = rateLimitWindowRepository;
    }

    @Override
    @Transactional
    public WindowConsumption tryConsume(String principalId, String operationClass,
                                        int ceiling, Duration windowLength, Instant now) {
        Optional<RateLimitWindow> existing = rateLimitWindowRepository.findForUpdate(principalId, operationClass);

        if (existing.isEmpty()) {
            // persist, not merge: a row inserted concurrently must fail the primary key, not be overwritten.
            RateLimitWindow window = new RateLimitWindow(principalId, operationClass, now);
            entityManager.persist(window);
            entityManager.flush();
            logger.debug("Opened first window: principal={}, class={}", principalId, operationClass);
            return new WindowConsumption(true, now, 1);
        }

        RateLimitWindow window = existing.get();
        if (window.hasElapsed(windowLength, now)) {
            window.restart(now);
            return new WindowConsumption(true, window.getWindowStart(), window.getCount());
        }

        if (window.getCount() < ceiling) {
            window.increment(now);
            return new WindowConsumption(true, window.getWindowStart(), window.getCount());
        }

        return new WindowConsumption(false, window.getWindowStart(), window.getCount());
    }

    @Override
    @Transactional
    public void release(String principalId, String operationClass, Instant windowStart, Instant now) {
        rateLimitWindowRepository.findForUpdate(principalId, operationClass)
                .filter(window -> window.getWindowStart().equals(windowStart))
                .ifPresent(window -> window.decrement(now));
    }

    @Override
    @Transactional(readOnly = true)
    public int currentCount(String principalId, String operationClass, Duration windowLength, Instant now) {
        return rateLimitWindowRepository.findById(new RateLimitWindowId(principalId, operationClass))
                .filter(window -> !window.hasElapsed(windowLength, now))
                .map(RateLimitWindow::getCount)
                .orElse(0);
    }

    @Override
    @Transactional
    public int purgeIdleSince(Instant cutoff) {
        return rateLimitWindowRepository.deleteIdleSince(cutoff);
    }
}
