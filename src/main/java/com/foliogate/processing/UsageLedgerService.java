package com.foliogate.processing;

import com.foliogate.observability.DatadogMetricsServiceInterface;
import com.foliogate.shared.dto.UsageRecordFilter;
import com.foliogate.shared.dto.UsageSummaryResponse;
import com.foliogate.shared.exception.LedgerUnavailableException;
import com.foliogate.shared.model.UsageOutcome;
import com.foliogate.shared.model.UsageRecord;
import com.foliogate.shared.repository.UsageRecordRepository;
import com.foliogate.shared.repository.UsageRecordSpecifications;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Tuple;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Append-only usage ledger. One row per gateway invocation attempt; rows are never updated.
 */
@Service
public class UsageLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(UsageLedgerService.class);

    private final UsageRecordRepository usageRecordRepository;
    private final Executor ledgerExecutor;
    private final DatadogMetricsServiceInterface metricsService;
    private final Clock clock;
    private final int asyncRetryAttempts;
    private final Duration asyncRetryBackoff;

    @PersistenceContext
    private EntityManager entityManager;

    public UsageLedgerService(
            UsageRecordRepository usageRecordRepository,
            @Qualifier("ledgerExecutor") Executor ledgerExecutor,
            DatadogMetricsServiceInterface metricsService,
            Clock clock,
            @Value("${app.ledger.async-retry-attempts:3}") int asyncRetryAttempts,
            @Value("${app.ledger.async-retry-backoff:200ms}") Duration asyncRetryBackoff) {
        this.usageRecordRepository = usageRecordRepository;
        this.ledgerExecutor = ledgerExecutor;
        this.metricsService = metricsService;
        this.clock = clock;
        this.asyncRetryAttempts = Math.max(1, asyncRetryAttempts);
        this.asyncRetryBackoff = asyncRetryBackoff;
    }

    /**
     * Appends a record and waits for the store to accept it.
     *
     * @throws LedgerUnavailableException if the record could not be persisted
     */
    public UsageRecord record(UsageEntry entry) {
        UsageRecord record = toRecord(entry);
        try {
            UsageRecord saved = usageRecordRepository.saveAndFlush(record);
            logger.debug("Usage recorded: id={}, principal={}, class={}, feature={}, outcome={}",
                    saved.getId(), entry.principalId(), entry.operationClass(), entry.feature(), entry.outcome());
            return saved;
        } catch (RuntimeException e) {
            throw new LedgerUnavailableException("Usage ledger unavailable: " + e.getMessage(), e);
        }
    }

    /**
     * Appends a record on the ledger executor, retrying with linear backoff.
     * A record that still cannot be written after the last attempt is logged at ERROR
     * and counted; the returned future completes exceptionally in that case.
     */
    public CompletableFuture<UsageRecord> recordAsync(UsageEntry entry) {
        try {
            return CompletableFuture.supplyAsync(() -> recordWithRetry(entry), ledgerExecutor);
        } catch (RejectedExecutionException e) {
            logger.error("Usage record dropped, ledger executor rejected it: principal={}, class={}, feature={}, outcome={}",
                    entry.principalId(), entry.operationClass(), entry.feature(), entry.outcome(), e);
            metricsService.recordLedgerFailure("ASYNC");
            return CompletableFuture.failedFuture(new LedgerUnavailableException("Ledger executor rejected record", e));
        }
    }

    private UsageRecord recordWithRetry(UsageEntry entry) {
        LedgerUnavailableException last = null;
        for (int attempt = 1; attempt <= asyncRetryAttempts; attempt++) {
            try {
                return record(entry);
            } catch (LedgerUnavailableException e) {
                last = e;
                logger.warn("Async usage record attempt {}/{} failed: {}", attempt, asyncRetryAttempts, e.getMessage());
                if (attempt < asyncRetryAttempts && !sleepBackoff(attempt)) {
                    break;
                }
            }
        }
        logger.error("Usage record lost after {} attempts: principal={}, class={}, feature={}, outcome={}",
                asyncRetryAttempts, entry.principalId(), entry.operationClass(), entry.feature(), entry.outcome(), last);
        metricsService.recordLedgerFailure("ASYNC");
        throw last;
    }

    private boolean sleepBackoff(int attempt) {
        try {
            Thread.sleep(asyncRetryBackoff.toMillis() * attempt);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Transactional(readOnly = true)
    public Page<UsageRecord> search(UsageRecordFilter filter, Pageable pageable) {
        return usageRecordRepository.findAll(UsageRecordSpecifications.matching(filter), pageable);
    }

    /**
     * Totals over the records matching the filter.
     */
    @Transactional(readOnly = true)
    public UsageSummaryResponse summarize(UsageRecordFilter filter) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Tuple> query = cb.createTupleQuery();
        Root<UsageRecord> root = query.from(UsageRecord.class);

        query.multiselect(
                cb.count(root).alias("attempts"),
                countOutcome(cb, root, UsageOutcome.SUCCESS).alias("successes"),
                countOutcome(cb, root, UsageOutcome.FAILURE).alias("failures"),
                countOutcome(cb, root, UsageOutcome.RATE_LIMITED).alias("rateLimited"),
                cb.sumAsLong(root.<Integer>get("tokensIn")).alias("tokensIn"),
                cb.sumAsLong(root.<Integer>get("tokensOut")).alias("tokensOut"),
                cb.sum(root.<BigDecimal>get("costEstimate")).alias("totalCost"));
        query.where(UsageRecordSpecifications.matching(filter).toPredicate(root, query, cb));

        Tuple totals = entityManager.createQuery(query).getSingleResult();
        BigDecimal totalCost = totals.get("totalCost", BigDecimal.class);
        return new UsageSummaryResponse(
                orZero(totals.get("attempts", Long.class)),
                orZero(totals.get("successes", Long.class)),
                orZero(totals.get("failures", Long.class)),
                orZero(totals.get("rateLimited", Long.class)),
                orZero(totals.get("tokensIn", Long.class)),
                orZero(totals.get("tokensOut", Long.class)),
                totalCost != null ? totalCost : BigDecimal.ZERO);
    }

    private static Expression<Long> countOutcome(CriteriaBuilder cb, Root<UsageRecord> root, UsageOutcome outcome) {
        return cb.sum(cb.<Long>selectCase()
                .when(cb.equal(root.get("outcome"), outcome), 1L)
                .otherwise(0L));
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private UsageRecord toRecord(UsageEntry entry) {
        CostReport cost = entry.cost();
        return new UsageRecord(
                UUID.randomUUID(),
                entry.principalId(),
                entry.operationClass(),
                entry.feature(),
                clock.instant(),
                entry.outcome(),
                entry.failureKind(),
                cost.model(),
                cost.tokensIn(),
                cost.tokensOut(),
                cost.costEstimate(),
                entry.errorMessage(),
                entry.metadata());
    }
}
