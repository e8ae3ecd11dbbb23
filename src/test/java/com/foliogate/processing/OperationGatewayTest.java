package com.foliogate.processing;

import com.foliogate.MutableClock;
import com.foliogate.config.GovernanceProperties;
import com.foliogate.config.GovernanceProperties.FailurePolicy;
import com.foliogate.config.GovernanceProperties.LedgerMode;
import com.foliogate.config.GovernanceProperties.OperationClassPolicy;
import com.foliogate.observability.DatadogMetricsServiceStub;
import com.foliogate.observability.TracingServiceStub;
import com.foliogate.security.InMemoryRateLimitWindowStore;
import com.foliogate.security.RateLimitService;
import com.foliogate.shared.exception.LedgerUnavailableException;
import com.foliogate.shared.exception.OperationFailedException;
import com.foliogate.shared.exception.RateLimitExceededException;
import com.foliogate.shared.model.FailureKind;
import com.foliogate.shared.model.UsageOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class OperationGatewayTest {

    private static final String GENERATION = "ai_generation";
    private static final String REWRITE = "ai_rewrite";
    private static final String USER = "user";

    private GovernanceProperties governanceProperties;
    private UsageLedgerService usageLedgerService;
    private ThreadPoolTaskExecutor executor;
    private OperationGateway gateway;

    @BeforeEach
    void setUp() {
        governanceProperties = new GovernanceProperties();
        governanceProperties.setGeneralClass(USER);
        governanceProperties.getClasses().put(GENERATION, new OperationClassPolicy(
                10, Duration.ofHours(1), FailurePolicy.FAIL_CLOSED, LedgerMode.BLOCKING, true));
        governanceProperties.getClasses().put(REWRITE, new OperationClassPolicy(
                30, Duration.ofHours(1), FailurePolicy.FAIL_CLOSED, LedgerMode.ASYNC, true));
        governanceProperties.getClasses().put(USER, new OperationClassPolicy(
                100, Duration.ofHours(1), FailurePolicy.FAIL_OPEN, LedgerMode.ASYNC, false));

        usageLedgerService = mock(UsageLedgerService.class);

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setThreadNamePrefix("test-op-");
        executor.initialize();

        gateway = gatewayWithTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    private OperationGateway gatewayWithTimeout(Duration timeout) {
        MutableClock clock = new MutableClock(Instant.parse("2025-03-01T10:00:00Z"));
        RateLimitService rateLimitService = new RateLimitService(new InMemoryRateLimitWindowStore(),
                governanceProperties, new DatadogMetricsServiceStub(), clock, Duration.ofSeconds(60));
        return new OperationGateway(rateLimitService, usageLedgerService, governanceProperties, executor,
                new DatadogMetricsServiceStub(), new TracingServiceStub(), timeout);
    }

    private static GatewayInvocation invocation(String operationClass) {
        return new GatewayInvocation("u1", operationClass, "summary", Map.of("promptLength", 42));
    }

    private UsageEntry singleBlockingEntry() {
        ArgumentCaptor<UsageEntry> captor = ArgumentCaptor.forClass(UsageEntry.class);
        verify(usageLedgerService, times(1)).record(captor.capture());
        verify(usageLedgerService, never()).recordAsync(any());
        return captor.getValue();
    }

    @Test
    void successIsRecordedOnceWithCost() {
        CostReport cost = new CostReport("gemini", 120, 80, new BigDecimal("0.000180"));

        OperationResult<String> result = gateway.invoke(invocation(GENERATION),
                () -> new OperationResult<>("summary text", cost));

        assertThat(result.output()).isEqualTo("summary text");
        UsageEntry entry = singleBlockingEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.SUCCESS);
        assertThat(entry.principalId()).isEqualTo("u1");
        assertThat(entry.operationClass()).isEqualTo(GENERATION);
        assertThat(entry.cost()).isEqualTo(cost);
        assertThat(entry.metadata()).containsEntry("promptLength", 42);
    }

    @Test
    void deniedInvocationIsRecordedAndNeverRuns() {
        AtomicInteger runs = new AtomicInteger();
        for (int i = 0; i < 10; i++) {
            gateway.invoke(invocation(GENERATION), () -> {
                runs.incrementAndGet();
                return new OperationResult<>("ok", CostReport.none());
            });
        }

        assertThatThrownBy(() -> gateway.invoke(invocation(GENERATION), () -> {
            runs.incrementAndGet();
            return new OperationResult<>("ok", CostReport.none());
        }))
                .isInstanceOfSatisfying(RateLimitExceededException.class, e -> {
                    assertThat(e.getOperationClass()).isEqualTo(GENERATION);
                    assertThat(e.getRetryAfterSeconds()).isPositive();
                });

        assertThat(runs.get()).isEqualTo(10);
        ArgumentCaptor<UsageEntry> captor = ArgumentCaptor.forClass(UsageEntry.class);
        verify(usageLedgerService, times(11)).record(captor.capture());
        assertThat(captor.getAllValues())
                .filteredOn(e -> e.outcome() == UsageOutcome.RATE_LIMITED)
                .hasSize(1);
    }

    @Test
    void providerFailureIsRecordedWithPartialCostAndRethrown() {
        CostReport partial = new CostReport("gemini", 50, 0, new BigDecimal("0.000025"));

        assertThatThrownBy(() -> gateway.invoke(invocation(GENERATION), () -> {
            throw new OperationFailedException(FailureKind.PROVIDER, "upstream 503", null, partial);
        }))
                .isInstanceOfSatisfying(OperationFailedException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.PROVIDER));

        UsageEntry entry = singleBlockingEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.FAILURE);
        assertThat(entry.failureKind()).isEqualTo(FailureKind.PROVIDER);
        assertThat(entry.cost().tokensIn()).isEqualTo(50);
        assertThat(entry.errorMessage()).isEqualTo("upstream 503");
    }

    @Test
    void unexpectedExceptionBecomesInternalFailure() {
        assertThatThrownBy(() -> gateway.invoke(invocation(GENERATION), () -> {
            throw new IllegalStateException("boom");
        }))
                .isInstanceOfSatisfying(OperationFailedException.class, e -> {
                    assertThat(e.getKind()).isEqualTo(FailureKind.INTERNAL);
                    assertThat(e.getCause()).isInstanceOf(IllegalStateException.class);
                });

        assertThat(singleBlockingEntry().failureKind()).isEqualTo(FailureKind.INTERNAL);
    }

    @Test
    void operationWithoutResultIsRecordedAsInternalFailure() {
        GatedOperation<String> returnsNothing = () -> null;

        assertThatThrownBy(() -> gateway.invoke(invocation(GENERATION), returnsNothing))
                .isInstanceOfSatisfying(OperationFailedException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.INTERNAL));

        UsageEntry entry = singleBlockingEntry();
        assertThat(entry.outcome()).isEqualTo(UsageOutcome.FAILURE);
        assertThat(entry.failureKind()).isEqualTo(FailureKind.INTERNAL);
        assertThat(entry.errorMessage()).isEqualTo("Operation returned no result");
    }

    @Test
    void slowOperationTimesOutAndIsRecorded() {
        OperationGateway impatient = gatewayWithTimeout(Duration.ofMillis(100));

        assertThatThrownBy(() -> impatient.invoke(invocation(GENERATION), () -> {
            Thread.sleep(5_000);
            return new OperationResult<>("late", CostReport.none());
        }))
                .isInstanceOfSatisfying(OperationFailedException.class,
                        e -> assertThat(e.getKind()).isEqualTo(FailureKind.TIMEOUT));

        assertThat(singleBlockingEntry().failureKind()).isEqualTo(FailureKind.TIMEOUT);
    }

    @Test
    void blockingLedgerFailureWithholdsSuccessfulResult() {
        when(usageLedgerService.record(any()))
                .thenThrow(new LedgerUnavailableException("db down", null));

        assertThatThrownBy(() -> gateway.invoke(invocation(GENERATION),
                () -> new OperationResult<>("ok", CostReport.none())))
                .isInstanceOf(LedgerUnavailableException.class);
    }

    @Test
    void ledgerFailureOnFailedOperationKeepsOriginalError() {
        when(usageLedgerService.record(any()))
                .thenThrow(new LedgerUnavailableException("db down", null));

        assertThatThrownBy(() -> gateway.invoke(invocation(GENERATION), () -> {
            throw new OperationFailedException(FailureKind.PROVIDER, "upstream 500", null);
        }))
                .isInstanceOfSatisfying(OperationFailedException.class, e -> {
                    assertThat(e.getSuppressed()).hasSize(1);
                    assertThat(e.getSuppressed()[0]).isInstanceOf(LedgerUnavailableException.class);
                });
    }

    @Test
    void asyncLedgerClassHandsRecordToBackgroundWriter() {
        OperationResult<String> result = gateway.invoke(invocation(REWRITE),
                () -> new OperationResult<>("rewritten", CostReport.none()));

        assertThat(result.output()).isEqualTo("rewritten");
        ArgumentCaptor<UsageEntry> captor = ArgumentCaptor.forClass(UsageEntry.class);
        verify(usageLedgerService).recordAsync(captor.capture());
        verify(usageLedgerService, never()).record(any());
        assertThat(captor.getValue().outcome()).isEqualTo(UsageOutcome.SUCCESS);
    }

    @Test
    void generalClassCeilingAppliesAcrossOperationClasses() {
        governanceProperties.getClasses().get(USER).setCeiling(3);
        gateway = gatewayWithTimeout(Duration.ofSeconds(5));

        gateway.invoke(invocation(GENERATION), () -> new OperationResult<>("a", CostReport.none()));
        gateway.invoke(invocation(REWRITE), () -> new OperationResult<>("b", CostReport.none()));
        gateway.invoke(invocation(GENERATION), () -> new OperationResult<>("c", CostReport.none()));

        assertThatThrownBy(() -> gateway.invoke(invocation(REWRITE),
                () -> new OperationResult<>("d", CostReport.none())))
                .isInstanceOfSatisfying(RateLimitExceededException.class,
                        e -> assertThat(e.getOperationClass()).isEqualTo(USER));
    }

    @Test
    void unknownOperationClassIsRejectedBeforeAnythingRuns() {
        assertThatThrownBy(() -> gateway.invoke(invocation("unknown"),
                () -> new OperationResult<>("x", CostReport.none())))
                .isInstanceOf(IllegalArgumentException.class);
        verify(usageLedgerService, never()).record(any());
        verify(usageLedgerService, never()).recordAsync(any());
    }
}
